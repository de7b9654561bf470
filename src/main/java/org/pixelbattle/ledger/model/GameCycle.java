package org.pixelbattle.ledger.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable state of the current game cycle. Exactly one instance is current at any time; it is
 * advanced in place when a cycle ends and the next one opens.
 * <p>
 * Invariants: {@code prizePool >= 0}; {@code cycleId} only grows; while active,
 * {@code lastActivityAt} is not after the time of the latest operation.
 */
public class GameCycle {
    private final Duration inactivityWindow;

    private boolean active;
    private long cycleId;
    private Instant startedAt;
    private Instant lastActivityAt;
    private long prizePool;

    public GameCycle(final Duration inactivityWindow) {
        this(inactivityWindow, false, 0L, null, null, 0L);
    }

    public GameCycle(final Duration inactivityWindow, final boolean active, final long cycleId,
                     final Instant startedAt, final Instant lastActivityAt, final long prizePool) {
        Objects.requireNonNull(inactivityWindow, "inactivityWindow");
        if (inactivityWindow.isNegative() || inactivityWindow.isZero()) {
            throw new IllegalArgumentException("Inactivity window must be positive: " + inactivityWindow);
        }
        if (prizePool < 0) {
            throw new IllegalArgumentException("Prize pool must not be negative: " + prizePool);
        }
        if (active && (startedAt == null || lastActivityAt == null)) {
            throw new IllegalArgumentException("An active cycle needs start and activity timestamps.");
        }
        this.inactivityWindow = inactivityWindow;
        this.active = active;
        this.cycleId = cycleId;
        this.startedAt = startedAt;
        this.lastActivityAt = lastActivityAt;
        this.prizePool = prizePool;
    }

    /**
     * Opens the next cycle at {@code now}, carrying {@code openingPool} into it.
     */
    public void open(final Instant now, final long openingPool) {
        Objects.requireNonNull(now, "now");
        if (openingPool < 0) {
            throw new IllegalArgumentException("Opening pool must not be negative: " + openingPool);
        }
        this.cycleId++;
        this.active = true;
        this.startedAt = now;
        this.lastActivityAt = now;
        this.prizePool = openingPool;
    }

    public void close() {
        this.active = false;
    }

    public void touch(final Instant now) {
        this.lastActivityAt = now;
    }

    public void addToPool(final long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Pool contribution must not be negative: " + amount);
        }
        this.prizePool = Math.addExact(this.prizePool, amount);
    }

    /**
     * Empties the pool and returns what it held.
     */
    public long drainPool() {
        final long drained = this.prizePool;
        this.prizePool = 0L;
        return drained;
    }

    /**
     * Returns an independent copy, used as a pre-image for rollback.
     */
    public GameCycle copy() {
        return new GameCycle(inactivityWindow, active, cycleId, startedAt, lastActivityAt, prizePool);
    }

    /**
     * Restores every mutable field from a previously taken {@link #copy()}.
     */
    public void restoreFrom(final GameCycle preImage) {
        this.active = preImage.active;
        this.cycleId = preImage.cycleId;
        this.startedAt = preImage.startedAt;
        this.lastActivityAt = preImage.lastActivityAt;
        this.prizePool = preImage.prizePool;
    }

    public boolean isActive() {
        return active;
    }

    public long getCycleId() {
        return cycleId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public Duration getInactivityWindow() {
        return inactivityWindow;
    }

    public long getPrizePool() {
        return prizePool;
    }
}
