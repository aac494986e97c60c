package com.flagship.pocket_ledger.ledger;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which system parents a newly created category tag is placed under.
 */
public enum CategoryType {
    INCOME,
    EXPENSE,
    BOTH;

    public Set<SystemTag> parents() {
        return switch (this) {
            case INCOME -> EnumSet.of(SystemTag.DEFAULT, SystemTag.INCOME);
            case EXPENSE -> EnumSet.of(SystemTag.DEFAULT, SystemTag.EXPENSE);
            case BOTH -> EnumSet.of(SystemTag.DEFAULT, SystemTag.INCOME, SystemTag.EXPENSE);
        };
    }
}
