package org.pixelbattle.ledger.cycle;

import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.model.GameCycle;
import org.pixelbattle.ledger.model.OwnershipLedger;
import org.pixelbattle.ledger.prize.DistributionResult;
import org.pixelbattle.ledger.prize.PrizeDistributor;
import org.pixelbattle.ledger.prize.WinnerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * State machine of the game cycle: {@code Active} until no purchase happened for the inactivity
 * window, then {@code Ended}, immediately superseded by the next {@code Active} cycle.
 * <p>
 * Ending a cycle resolves the winners, distributes the prize pool over all owners and opens the
 * next cycle with a cleared ownership ledger. Cells are not touched here; they reset lazily when
 * next read through the new cycle id.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe. The owning ledger serializes all access.
 */
public class GameCycleController {
    private static final Logger LOG = LoggerFactory.getLogger(GameCycleController.class);

    private final GameCycle cycle;
    private final OwnershipLedger ledger;
    private final WinnerResolver winnerResolver;
    private final PrizeDistributor prizeDistributor;

    public GameCycleController(final GameCycle cycle, final OwnershipLedger ledger,
                               final WinnerResolver winnerResolver, final PrizeDistributor prizeDistributor) {
        this.cycle = Objects.requireNonNull(cycle, "cycle");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.winnerResolver = Objects.requireNonNull(winnerResolver, "winnerResolver");
        this.prizeDistributor = Objects.requireNonNull(prizeDistributor, "prizeDistributor");
    }

    /**
     * Opens the first cycle if none is active. The current prize pool is carried over.
     *
     * @return {@code true} if a cycle was opened, {@code false} if one was already active
     */
    public boolean start(final Instant now) {
        if (cycle.isActive()) {
            return false;
        }
        ledger.clear();
        cycle.open(now, cycle.drainPool());
        LOG.info("Game cycle {} started.", cycle.getCycleId());
        return true;
    }

    public boolean isActive() {
        return cycle.isActive();
    }

    public long getCycleId() {
        return cycle.getCycleId();
    }

    /**
     * Marks {@code now} as the latest activity.
     *
     * @throws IllegalStateException if no cycle is active
     */
    public void recordActivity(final Instant now) {
        if (!cycle.isActive()) {
            throw new IllegalStateException("Cannot record activity while no cycle is active.");
        }
        cycle.touch(now);
    }

    public void addToPool(final long amount) {
        cycle.addToPool(amount);
    }

    /**
     * @return {@code true} if the cycle is active and at least the inactivity window has passed
     * since the last activity
     */
    public boolean shouldEnd(final Instant now) {
        return cycle.isActive()
            && Duration.between(cycle.getLastActivityAt(), now).compareTo(cycle.getInactivityWindow()) >= 0;
    }

    /**
     * @return time left before the cycle may be ended, zero if not active or already due
     */
    public Duration remainingTime(final Instant now) {
        if (!cycle.isActive()) {
            return Duration.ZERO;
        }
        final Duration remaining = cycle.getInactivityWindow().minus(Duration.between(cycle.getLastActivityAt(), now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Ends the current cycle and opens the next one if {@link #shouldEnd(Instant)} holds; otherwise
     * does nothing. Winner resolution runs before prize distribution. Whatever the distribution does
     * not pay out becomes the opening pool of the next cycle.
     *
     * @return the settlement report, or empty if the cycle was not due
     */
    public Optional<CycleSettlement> endAndRestart(final Instant now) {
        if (!shouldEnd(now)) {
            return Optional.empty();
        }
        final long endedCycleId = cycle.getCycleId();
        cycle.close();

        final Map<ActorId, Integer> counts = ledger.snapshotCounts();
        final Set<ActorId> winners = winnerResolver.resolve(counts);
        final int winningCount = winners.isEmpty() ? 0 : counts.get(winners.iterator().next());

        final long pool = cycle.drainPool();
        final DistributionResult distribution = prizeDistributor.distribute(pool, counts);
        final long rolledOver = distribution.undistributed();

        ledger.clear();
        cycle.open(now, rolledOver);

        LOG.info("Game cycle {} ended: winners={} ({} cells), pool={}, paid out={}, rolled over={}. Cycle {} started.",
            endedCycleId, winners, winningCount, pool, distribution.paidOut(), rolledOver, cycle.getCycleId());

        return Optional.of(new CycleSettlement(endedCycleId, now, winners, winningCount,
            distribution, rolledOver, cycle.getCycleId()));
    }

    /**
     * @return a point-in-time view of the cycle
     */
    public CycleStatus status(final Instant now) {
        return new CycleStatus(cycle.isActive(), cycle.getCycleId(), cycle.getStartedAt(),
            cycle.getLastActivityAt(), cycle.getInactivityWindow(), remainingTime(now), cycle.getPrizePool());
    }

    /**
     * @return a copy of the cycle state for rollback
     */
    public GameCycle capture() {
        return cycle.copy();
    }

    /**
     * Restores the cycle state taken by {@link #capture()}.
     */
    public void restore(final GameCycle preImage) {
        cycle.restoreFrom(preImage);
    }
}
