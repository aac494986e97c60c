package com.flagship.pocket_ledger.query;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

import java.time.YearMonth;

/**
 * Income and expense of one calendar month, in the reference currency.
 */
@Value
public class MonthSummary {
    YearMonth month;
    FixedAmount income;
    FixedAmount expense;

    public FixedAmount getNet() {
        return income.subtract(expense);
    }
}
