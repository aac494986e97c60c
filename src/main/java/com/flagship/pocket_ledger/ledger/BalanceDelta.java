package com.flagship.pocket_ledger.ledger;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.ledger.exception.InvariantViolationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Balance adjustments implied by line mutations.
 *
 * The store applies exactly one delta per committed line write, inside the same
 * database transaction as the write:
 * <ul>
 *   <li>insert: {@code +signed(after)}</li>
 *   <li>delete: {@code -signed(before)}</li>
 *   <li>update in place: {@code signed(after) - signed(before)}, covering sign flips and
 *       magnitude changes in one adjustment</li>
 * </ul>
 */
public final class BalanceDelta {

    private BalanceDelta() {
        // Utility class
    }

    /**
     * Signed delta for the account of a single line mutation.
     *
     * @param before the line as stored before the mutation, null for an insert
     * @param after the line as stored after the mutation, null for a delete
     * @throws InvariantViolationException if there is no mutation, or an update moves the line
     *         to another account (that must be a delete plus an insert)
     */
    public static FixedAmount between(Line before, Line after) {
        if (before == null && after == null) {
            throw new InvariantViolationException("Balance delta requested without a line mutation");
        }
        if (before == null) {
            return after.signedAmount();
        }
        if (after == null) {
            return before.signedAmount().negate();
        }
        if (before.getAccountId() != after.getAccountId()) {
            throw new InvariantViolationException(String.format(
                "In-place line update cannot move account %d to %d", before.getAccountId(), after.getAccountId()));
        }
        return after.signedAmount().subtract(before.signedAmount());
    }

    /**
     * Net per-account effect of replacing one line set with another.
     * Accounts whose net delta is zero are still listed.
     */
    public static Map<Long, FixedAmount> perAccount(Collection<Line> before, Collection<Line> after) {
        Map<Long, FixedAmount> deltas = new LinkedHashMap<>();
        for (Line line : before) {
            deltas.merge(line.getAccountId(), between(line, null), FixedAmount::add);
        }
        for (Line line : after) {
            deltas.merge(line.getAccountId(), between(null, line), FixedAmount::add);
        }
        return deltas;
    }
}
