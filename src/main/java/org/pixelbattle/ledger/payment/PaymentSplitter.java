package org.pixelbattle.ledger.payment;

import org.pixelbattle.ledger.LedgerMath;

import java.util.Objects;

/**
 * Partitions a payment into previous-owner, prize-pool and operator shares.
 * <p>
 * Each share is floored individually. When the cell had no previous owner the owner percentage is
 * redirected to the pool. Whatever the floors leave over is added to the pool share, so every unit
 * of the amount lands in exactly one share.
 * <p>
 * <strong>Thread Safety:</strong> immutable and thread-safe.
 */
public final class PaymentSplitter {

    private final RevenueSplit split;

    public PaymentSplitter(final RevenueSplit split) {
        this.split = Objects.requireNonNull(split, "split");
    }

    /**
     * Splits {@code amount}.
     *
     * @param amount           the full amount tendered, must not be negative
     * @param hasPreviousOwner whether a previous owner exists to receive its share
     * @return the split, whose {@link PaymentSplit#total()} equals {@code amount}
     */
    public PaymentSplit split(final long amount, final boolean hasPreviousOwner) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
        final long operatorShare = LedgerMath.mulDivFloor(amount, split.operatorPercent(), 100);
        final long ownerShare;
        final long poolShare;
        if (hasPreviousOwner) {
            ownerShare = LedgerMath.mulDivFloor(amount, split.ownerPercent(), 100);
            poolShare = LedgerMath.mulDivFloor(amount, split.poolPercent(), 100);
        } else {
            ownerShare = 0L;
            poolShare = LedgerMath.mulDivFloor(amount, split.ownerPercent() + split.poolPercent(), 100);
        }
        final long carry = amount - (ownerShare + poolShare + operatorShare);
        return new PaymentSplit(ownerShare, poolShare + carry, operatorShare, carry);
    }

    public RevenueSplit getSplit() {
        return split;
    }
}
