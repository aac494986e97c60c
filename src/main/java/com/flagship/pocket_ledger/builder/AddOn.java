package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Tip, fee, VAT or discount applied on top of the category entries of an expense.
 * Either an absolute amount or a percentage of the base (0.15 for 15%) is set, never both.
 * When neither is set the add-on was cleared and produces no line.
 */
@Value
public class AddOn {
    Long tagId;
    FixedAmount amount;
    BigDecimal percentage;

    public AddOn(Long tagId, FixedAmount amount, BigDecimal percentage) {
        this.tagId = tagId;
        this.amount = amount;
        this.percentage = percentage != null ? percentage.stripTrailingZeros() : null;
    }

    public static AddOn absolute(long tagId, FixedAmount amount) {
        return new AddOn(tagId, amount, null);
    }

    public static AddOn percentage(long tagId, BigDecimal percentage) {
        return new AddOn(tagId, null, percentage);
    }

    public boolean isPercentage() {
        return percentage != null;
    }

    public boolean isCleared() {
        if (percentage != null) {
            return percentage.signum() == 0;
        }
        return amount == null || amount.isZero();
    }
}
