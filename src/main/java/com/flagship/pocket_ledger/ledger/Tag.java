package com.flagship.pocket_ledger.ledger;

import lombok.Value;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.function.LongFunction;

/**
 * A category tag. Tags form a DAG: a tag may sit under both INCOME and EXPENSE.
 * {@code common} marks add-on tags (tips, fees, VAT, discounts).
 */
@Value
public class Tag {
    long id;
    String name;
    Set<Long> parentIds;
    boolean common;

    public boolean hasParent(SystemTag parent) {
        return parentIds.contains(parent.id());
    }

    /**
     * Walks the parent graph looking for {@code ancestorId}; unknown tags end the walk.
     */
    public boolean hasAncestor(long ancestorId, LongFunction<Tag> lookup) {
        Deque<Long> pending = new ArrayDeque<>(parentIds);
        Set<Long> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            long current = pending.pop();
            if (current == ancestorId) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            Tag parent = lookup.apply(current);
            if (parent != null) {
                pending.addAll(parent.getParentIds());
            }
        }
        return false;
    }
}
