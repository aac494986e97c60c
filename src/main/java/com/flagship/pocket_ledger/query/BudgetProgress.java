package com.flagship.pocket_ledger.query;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.ledger.Budget;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Spend against a budget so far. {@code ratio} is actual / target, null for a zero target.
 */
@Value
public class BudgetProgress {
    Budget budget;
    FixedAmount actual;
    FixedAmount remaining;
    BigDecimal ratio;
}
