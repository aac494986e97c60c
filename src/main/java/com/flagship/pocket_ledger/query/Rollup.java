package com.flagship.pocket_ledger.query;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

/**
 * Income, expense and net for one tag or counterparty, in the reference currency.
 */
@Value
public class Rollup {
    long key;
    FixedAmount income;
    FixedAmount expense;

    public FixedAmount getNet() {
        return income.subtract(expense);
    }
}
