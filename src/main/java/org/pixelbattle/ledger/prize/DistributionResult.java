package org.pixelbattle.ledger.prize;

import java.util.List;

/**
 * Outcome of distributing a prize pool.
 *
 * @param pool          the pool that was distributed
 * @param payouts       every attempted payout, ordered by recipient id
 * @param paidOut       sum of the successful payouts
 * @param undistributed what stayed behind: rounding remainder plus failed payouts
 */
public record DistributionResult(long pool, List<Payout> payouts, long paidOut, long undistributed) {

    public DistributionResult {
        payouts = List.copyOf(payouts);
    }

    static DistributionResult nothingDistributed(final long pool) {
        return new DistributionResult(pool, List.of(), 0L, pool);
    }

    public long failedCount() {
        return payouts.stream().filter(p -> !p.paid()).count();
    }
}
