package com.flagship.pocket_ledger.query;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

import java.time.LocalDate;

/**
 * Balance of an account at the end of a day, in the account currency.
 */
@Value
public class DailyBalance {
    LocalDate date;
    FixedAmount balance;
}
