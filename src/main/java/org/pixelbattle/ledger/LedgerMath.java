package org.pixelbattle.ledger;

import java.math.BigInteger;

/**
 * Integer-only arithmetic helpers for currency amounts.
 */
public final class LedgerMath {

    private LedgerMath() {
        // Utility class
    }

    /**
     * Computes {@code floor(value * numerator / denominator)} for non-negative operands without
     * overflowing the intermediate product.
     * <p>
     * The value is split into {@code q * denominator + r}, so the result is
     * {@code q * numerator + floor(r * numerator / denominator)}, which is exact.
     *
     * @throws ArithmeticException if the result itself does not fit into a {@code long}
     * @throws IllegalArgumentException if an operand is negative or the denominator is zero
     */
    public static long mulDivFloor(final long value, final long numerator, final long denominator) {
        if (value < 0 || numerator < 0) {
            throw new IllegalArgumentException("Operands must not be negative: " + value + ", " + numerator);
        }
        if (denominator <= 0) {
            throw new IllegalArgumentException("Denominator must be positive: " + denominator);
        }
        final long quotient = value / denominator;
        final long remainder = value % denominator;
        final long whole = Math.multiplyExact(quotient, numerator);
        final long fraction;
        if (remainder == 0 || numerator <= Long.MAX_VALUE / remainder) {
            fraction = remainder * numerator / denominator;
        } else {
            // r < denominator, so the quotient always fits; only the product needs the wide type
            fraction = BigInteger.valueOf(remainder)
                .multiply(BigInteger.valueOf(numerator))
                .divide(BigInteger.valueOf(denominator))
                .longValueExact();
        }
        return Math.addExact(whole, fraction);
    }
}
