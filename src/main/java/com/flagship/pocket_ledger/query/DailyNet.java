package com.flagship.pocket_ledger.query;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

import java.time.LocalDate;

@Value
public class DailyNet {
    LocalDate date;
    FixedAmount income;
    FixedAmount expense;

    public FixedAmount getNet() {
        return income.subtract(expense);
    }
}
