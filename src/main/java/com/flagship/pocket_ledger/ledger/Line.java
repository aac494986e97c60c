package com.flagship.pocket_ledger.ledger;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.amount.Sign;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One signed ledger entry against one account and one tag.
 *
 * The amount is always a non-negative magnitude; direction lives in {@link #sign}.
 * {@code rate} is the value of one unit of the account currency in the reference
 * currency at transaction time. {@code pctValue} is set only for add-ons entered as a
 * percentage of the base amount (0.15 for 15%).
 */
@Value
public class Line {
    String transactionId;
    long accountId;
    long tagId;
    Sign sign;
    FixedAmount amount;
    FixedAmount rate;
    BigDecimal pctValue;
    boolean common;

    @Builder(toBuilder = true)
    private Line(String transactionId, long accountId, long tagId, Sign sign, FixedAmount amount,
                 FixedAmount rate, BigDecimal pctValue, boolean common) {
        this.transactionId = transactionId;
        this.accountId = accountId;
        this.tagId = tagId;
        this.sign = Objects.requireNonNull(sign, "sign");
        this.amount = Objects.requireNonNull(amount, "amount");
        if (amount.isNegative()) {
            throw new IllegalArgumentException("Line amount must be a non-negative magnitude: " + amount);
        }
        this.rate = rate != null ? rate : FixedAmount.ONE;
        this.pctValue = pctValue != null ? pctValue.stripTrailingZeros() : null;
        this.common = common;
    }

    public FixedAmount signedAmount() {
        return sign.apply(amount);
    }

    /**
     * Signed amount converted into the reference currency with the line's rate snapshot.
     */
    public FixedAmount signedReferenceAmount() {
        return signedAmount().multiply(rate);
    }

    public boolean isTagged(SystemTag tag) {
        return tag.is(tagId);
    }

    public boolean isPercentage() {
        return pctValue != null;
    }
}
