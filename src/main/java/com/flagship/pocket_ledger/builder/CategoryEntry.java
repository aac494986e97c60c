package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

/**
 * One category share of an expense.
 */
@Value
public class CategoryEntry {
    Long tagId;
    FixedAmount amount;
}
