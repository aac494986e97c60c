package com.flagship.pocket_ledger.ledger;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tags with reserved ids and engine-recognized meaning.
 * User tags get ids from 100 upwards.
 */
public enum SystemTag {
    SYSTEM(1),
    DEFAULT(2),
    INITIAL(3),
    FIAT(4),
    CRYPTO(5),
    TRANSFER(6),
    EXCHANGE(7),
    INCOME(9),
    EXPENSE(10),
    FEE(13),
    DISCOUNT(18),
    ARCHIVED(22),
    ADJUSTMENT(23);

    private static final Map<Long, SystemTag> BY_ID = Arrays.stream(values())
        .collect(Collectors.toMap(SystemTag::id, Function.identity()));

    private final long id;

    SystemTag(long id) {
        this.id = id;
    }

    public long id() {
        return id;
    }

    public boolean is(long tagId) {
        return id == tagId;
    }

    /**
     * Markers for balance entries created by the system; transactions carrying them are read-only.
     */
    public boolean isReadOnlyMarker() {
        return this == INITIAL || this == ADJUSTMENT;
    }

    /**
     * Lines of these tags move money between the user's own accounts.
     */
    public boolean isMovement() {
        return this == TRANSFER || this == EXCHANGE;
    }

    public static Optional<SystemTag> fromId(long tagId) {
        return Optional.ofNullable(BY_ID.get(tagId));
    }

    public static boolean isSystemTag(long tagId) {
        return BY_ID.containsKey(tagId);
    }
}
