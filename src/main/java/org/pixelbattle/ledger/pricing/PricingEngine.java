package org.pixelbattle.ledger.pricing;

import org.pixelbattle.ledger.LedgerMath;

/**
 * Maps a cell's current price to its price after a purchase:
 * {@code next = floor(current * numerator / denominator)}.
 * <p>
 * Only integer arithmetic is used. The floor is applied after every purchase, so a cell bought
 * {@code n} times is priced slightly below {@code initial * (numerator/denominator)^n}. That
 * under-escalation is the defined, reproducible behaviour.
 * <p>
 * <strong>Thread Safety:</strong> immutable and thread-safe.
 */
public final class PricingEngine {

    /** Default escalation of 10% per purchase. */
    public static final long DEFAULT_NUMERATOR = 110;
    public static final long DEFAULT_DENOMINATOR = 100;

    private final long numerator;
    private final long denominator;

    /**
     * Creates an engine with the given multiplier.
     *
     * @param numerator   multiplier numerator, must be greater than the denominator
     * @param denominator multiplier denominator, must be positive
     * @throws IllegalArgumentException if the multiplier would not increase prices
     */
    public PricingEngine(final long numerator, final long denominator) {
        if (denominator <= 0) {
            throw new IllegalArgumentException("Multiplier denominator must be positive: " + denominator);
        }
        if (numerator <= denominator) {
            throw new IllegalArgumentException(
                "Multiplier " + numerator + "/" + denominator + " must be greater than 1.");
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static PricingEngine defaults() {
        return new PricingEngine(DEFAULT_NUMERATOR, DEFAULT_DENOMINATOR);
    }

    /**
     * Computes the price after one purchase.
     *
     * @param current the price that was just paid
     * @return the floored escalated price
     * @throws ArithmeticException if the escalated price no longer fits into a {@code long}
     */
    public long nextPrice(final long current) {
        return LedgerMath.mulDivFloor(current, numerator, denominator);
    }

    /**
     * Checks that {@code price} strictly increases under this multiplier. Small prices may floor
     * back to themselves (e.g. 5 * 110 / 100 = 5), which would break monotonic pricing.
     */
    public boolean escalates(final long price) {
        return nextPrice(price) > price;
    }

    public long getNumerator() {
        return numerator;
    }

    public long getDenominator() {
        return denominator;
    }
}
