package com.flagship.pocket_ledger.amount;

/**
 * Direction of a ledger line against its account.
 * PLUS increases the account balance, MINUS decreases it.
 */
public enum Sign {
    PLUS('+'),
    MINUS('-');

    private final char symbol;

    Sign(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public FixedAmount apply(FixedAmount magnitude) {
        return this == PLUS ? magnitude : magnitude.negate();
    }

    public Sign opposite() {
        return this == PLUS ? MINUS : PLUS;
    }

    public static Sign fromSymbol(char symbol) {
        return switch (symbol) {
            case '+' -> PLUS;
            case '-' -> MINUS;
            default -> throw new IllegalArgumentException("Unknown sign symbol: " + symbol);
        };
    }

    public static Sign fromSymbol(String symbol) {
        if (symbol == null || symbol.length() != 1) {
            throw new IllegalArgumentException("Unknown sign symbol: " + symbol);
        }
        return fromSymbol(symbol.charAt(0));
    }
}
