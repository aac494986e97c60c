package com.flagship.pocket_ledger.ledger;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Transaction ids are 8 random bytes rendered as hex, so ids do not leak entry order.
 */
public final class TransactionIds {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private TransactionIds() {
        // Utility class
    }

    public static String random() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    public static boolean isValid(String id) {
        return id != null && id.length() == 16
            && id.chars().allMatch(HexFormat::isHexDigit);
    }
}
