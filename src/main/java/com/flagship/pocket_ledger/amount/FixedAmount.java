package com.flagship.pocket_ledger.amount;

import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Exact fixed-point monetary value stored as an {@code (intPart, frac)} pair.
 *
 * The represented value is always {@code intPart + frac / SCALE} with
 * {@code 0 <= frac < SCALE}. Negative values use the floor convention:
 * -1.25 is {@code (-2, 0.75 * SCALE)}, never a signed fraction.
 *
 * Instances are immutable; arithmetic returns new instances.
 */
@Value
public class FixedAmount implements Comparable<FixedAmount> {

    public static final int SCALE_DIGITS = 18;
    public static final long SCALE = 1_000_000_000_000_000_000L;

    public static final FixedAmount ZERO = new FixedAmount(0L, 0L);
    public static final FixedAmount ONE = new FixedAmount(1L, 0L);

    private static final MathContext RATIO_CONTEXT = MathContext.DECIMAL128;

    long intPart;
    long frac;

    private FixedAmount(long intPart, long frac) {
        if (frac < 0 || frac >= SCALE) {
            throw new IllegalArgumentException("Fraction out of range [0, " + SCALE + "): " + frac);
        }
        this.intPart = intPart;
        this.frac = frac;
    }

    public static FixedAmount of(long intPart, long frac) {
        if (intPart == 0 && frac == 0) {
            return ZERO;
        }
        return new FixedAmount(intPart, frac);
    }

    /**
     * Converts an exact decimal, rounding HALF_UP beyond 18 fractional digits.
     */
    public static FixedAmount of(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount value is required");
        }
        BigDecimal scaled = value.setScale(SCALE_DIGITS, RoundingMode.HALF_UP);
        BigDecimal whole = scaled.setScale(0, RoundingMode.FLOOR);
        long fraction = scaled.subtract(whole).movePointRight(SCALE_DIGITS).longValueExact();
        return of(whole.longValueExact(), fraction);
    }

    public static FixedAmount of(String value) {
        return of(new BigDecimal(value));
    }

    public static FixedAmount of(long wholeUnits) {
        return of(wholeUnits, 0L);
    }

    /**
     * Converts a floating-point decimal using its shortest textual representation,
     * so {@code toFixed(12.5).toDecimal() == 12.5}.
     */
    public static FixedAmount toFixed(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Amount must be a finite number: " + value);
        }
        return of(BigDecimal.valueOf(value));
    }

    /**
     * Converts the legacy single-integer encoding, where the stored integer is the
     * amount multiplied by {@code 10^decimalPlaces} of the account currency.
     */
    public static FixedAmount fromLegacy(long scaledValue, int decimalPlaces) {
        if (decimalPlaces < 0 || decimalPlaces > SCALE_DIGITS) {
            throw new IllegalArgumentException("Decimal places must be within [0, 18]: " + decimalPlaces);
        }
        long divisor = pow10(decimalPlaces);
        long whole = Math.floorDiv(scaledValue, divisor);
        long remainder = Math.floorMod(scaledValue, divisor);
        return of(whole, remainder * pow10(SCALE_DIGITS - decimalPlaces));
    }

    public double toDecimal() {
        return toBigDecimal().doubleValue();
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(intPart).add(BigDecimal.valueOf(frac, SCALE_DIGITS)).stripTrailingZeros();
    }

    public FixedAmount add(FixedAmount other) {
        long rawFrac = frac + other.frac;
        long carry = rawFrac >= SCALE ? 1 : 0;
        return of(Math.addExact(Math.addExact(intPart, other.intPart), carry), rawFrac - carry * SCALE);
    }

    public FixedAmount subtract(FixedAmount other) {
        long rawFrac = frac - other.frac;
        long borrow = rawFrac < 0 ? 1 : 0;
        return of(Math.subtractExact(Math.subtractExact(intPart, other.intPart), borrow), rawFrac + borrow * SCALE);
    }

    public FixedAmount negate() {
        return ZERO.subtract(this);
    }

    public FixedAmount abs() {
        return isNegative() ? negate() : this;
    }

    public FixedAmount multiply(BigDecimal factor) {
        return of(toBigDecimal().multiply(factor));
    }

    public FixedAmount multiply(FixedAmount factor) {
        return multiply(factor.toBigDecimal());
    }

    /**
     * Ratio of this amount to the divisor, e.g. a realized exchange rate.
     */
    public FixedAmount divide(FixedAmount divisor) {
        if (divisor.isZero()) {
            throw new ArithmeticException("Division by zero amount");
        }
        return of(toBigDecimal().divide(divisor.toBigDecimal(), RATIO_CONTEXT));
    }

    public FixedAmount roundTo(int decimalPlaces) {
        return of(toBigDecimal().setScale(decimalPlaces, RoundingMode.HALF_UP));
    }

    /**
     * Smallest number of decimal places that represents this value exactly.
     */
    public int requiredDecimalPlaces() {
        if (frac == 0) {
            return 0;
        }
        long remaining = frac;
        int places = SCALE_DIGITS;
        while (remaining % 10 == 0) {
            remaining /= 10;
            places--;
        }
        return places;
    }

    public String format(int decimalPlaces) {
        return toBigDecimal().setScale(decimalPlaces, RoundingMode.HALF_UP).toPlainString();
    }

    public int signum() {
        if (intPart < 0) {
            return -1;
        }
        return (intPart == 0 && frac == 0) ? 0 : 1;
    }

    public boolean isZero() {
        return signum() == 0;
    }

    public boolean isPositive() {
        return signum() > 0;
    }

    public boolean isNegative() {
        return signum() < 0;
    }

    @Override
    public int compareTo(FixedAmount other) {
        int byInt = Long.compare(intPart, other.intPart);
        return byInt != 0 ? byInt : Long.compare(frac, other.frac);
    }

    @Override
    public String toString() {
        return toBigDecimal().toPlainString();
    }

    private static long pow10(int exponent) {
        long result = 1L;
        for (int i = 0; i < exponent; i++) {
            result *= 10L;
        }
        return result;
    }
}
