package org.pixelbattle.ledger.cycle;

import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.prize.DistributionResult;

import java.time.Instant;
import java.util.Set;

/**
 * Report of a finished cycle.
 *
 * @param endedCycleId id of the cycle that ended
 * @param endedAt      when the cycle was ended
 * @param winners      actors with the most cells, ties included, empty if nobody owned a cell
 * @param winningCount the cell count of the winners, {@code 0} if none
 * @param distribution payouts made from the prize pool
 * @param rolledOver   amount carried as opening pool into the next cycle
 * @param nextCycleId  id of the cycle opened right after
 */
public record CycleSettlement(
    long endedCycleId,
    Instant endedAt,
    Set<ActorId> winners,
    int winningCount,
    DistributionResult distribution,
    long rolledOver,
    long nextCycleId
) {

    public CycleSettlement {
        winners = Set.copyOf(winners);
    }
}
