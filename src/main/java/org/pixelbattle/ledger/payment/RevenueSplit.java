package org.pixelbattle.ledger.payment;

/**
 * Percentages a payment is split into. Fixed at construction.
 *
 * @param ownerPercent    share for the previous owner of the cell
 * @param poolPercent     share for the prize pool
 * @param operatorPercent share for the operator
 */
public record RevenueSplit(int ownerPercent, int poolPercent, int operatorPercent) {

    public RevenueSplit {
        if (ownerPercent < 0 || poolPercent < 0 || operatorPercent < 0) {
            throw new IllegalArgumentException("Split percentages must not be negative: " + describe(ownerPercent, poolPercent, operatorPercent));
        }
        if (ownerPercent + poolPercent + operatorPercent != 100) {
            throw new IllegalArgumentException("Split percentages must sum to 100, got " + describe(ownerPercent, poolPercent, operatorPercent));
        }
    }

    /**
     * 84% previous owner, 15% prize pool, 1% operator.
     */
    public static RevenueSplit defaults() {
        return new RevenueSplit(84, 15, 1);
    }

    private static String describe(final int owner, final int pool, final int operator) {
        return owner + "/" + pool + "/" + operator;
    }

    @Override
    public String toString() {
        return describe(ownerPercent, poolPercent, operatorPercent);
    }
}
