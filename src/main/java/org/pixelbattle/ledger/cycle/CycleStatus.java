package org.pixelbattle.ledger.cycle;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the game cycle.
 *
 * @param active           whether purchases are accepted
 * @param cycleId          id of the current cycle, {@code 0} before the first start
 * @param startedAt        start of the current cycle, {@code null} before the first start
 * @param lastActivityAt   time of the last purchase or of the cycle start
 * @param inactivityWindow how long the cycle survives without a purchase
 * @param remainingTime    time left before the cycle may be ended, {@link Duration#ZERO} if due or inactive
 * @param prizePool        current prize pool
 */
public record CycleStatus(
    boolean active,
    long cycleId,
    Instant startedAt,
    Instant lastActivityAt,
    Duration inactivityWindow,
    Duration remainingTime,
    long prizePool
) {
}
