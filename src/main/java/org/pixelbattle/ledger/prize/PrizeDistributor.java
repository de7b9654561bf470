package org.pixelbattle.ledger.prize;

import org.pixelbattle.ledger.LedgerMath;
import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.spi.ITransferGateway;
import org.pixelbattle.ledger.spi.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits a prize pool across all current owners proportionally to the cells they hold.
 * <p>
 * Each owner receives {@code floor(pool * count / totalOwned)}, computed in a single pass. The
 * truncation remainder is not paid out. Payouts are independent transfers: a failed one is
 * reported and its amount stays undistributed, the others are unaffected.
 */
public class PrizeDistributor {
    private static final Logger LOG = LoggerFactory.getLogger(PrizeDistributor.class);

    private final ITransferGateway gateway;

    public PrizeDistributor(final ITransferGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    /**
     * Distributes {@code pool}.
     *
     * @param pool   the prize pool, must not be negative
     * @param counts actor to owned-cell count; iteration order is the payout order
     * @return payouts and the undistributed remainder
     */
    public DistributionResult distribute(final long pool, final Map<ActorId, Integer> counts) {
        if (pool < 0) {
            throw new IllegalArgumentException("Prize pool must not be negative: " + pool);
        }
        long totalOwned = 0;
        for (final int count : counts.values()) {
            if (count > 0) {
                totalOwned += count;
            }
        }
        if (pool == 0 || totalOwned == 0) {
            LOG.debug("Nothing to distribute (pool={}, owned cells={}).", pool, totalOwned);
            return DistributionResult.nothingDistributed(pool);
        }

        final List<Payout> payouts = new ArrayList<>();
        long paidOut = 0;
        for (final Map.Entry<ActorId, Integer> entry : counts.entrySet()) {
            final int count = entry.getValue();
            if (count <= 0) {
                continue;
            }
            final ActorId recipient = entry.getKey();
            final long share = LedgerMath.mulDivFloor(pool, count, totalOwned);
            if (share == 0) {
                payouts.add(Payout.paid(recipient, count, 0L));
                continue;
            }
            try {
                gateway.transfer(recipient, share);
                payouts.add(Payout.paid(recipient, count, share));
                paidOut += share;
            } catch (final TransferException | RuntimeException e) {
                LOG.warn("Prize payout of {} to {} failed: {}", share, recipient, e.getMessage());
                payouts.add(Payout.failed(recipient, count, share, e.getMessage()));
            }
        }
        return new DistributionResult(pool, payouts, paidOut, pool - paidOut);
    }
}
