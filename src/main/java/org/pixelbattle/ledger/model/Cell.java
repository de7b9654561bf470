package org.pixelbattle.ledger.model;

import java.util.Objects;
import java.util.Optional;

/**
 * State of a single grid cell.
 * <p>
 * A cell whose {@code lastUpdateCycle} is older than the current cycle is <em>stale</em>: it is
 * treated as unowned at the initial price until it is next written (lazy reset). The tag survives
 * the reset, only ownership and price are cycle scoped.
 *
 * @param owner           current owner, or {@code null} when unowned
 * @param price           price the next buyer has to pay, in the smallest currency unit
 * @param tag             opaque payload (a colour for the canvas), {@code null} if never painted
 * @param lastUpdateCycle id of the cycle that last wrote this cell, {@code 0} if never written
 */
public record Cell(ActorId owner, long price, String tag, long lastUpdateCycle) {

    public Cell {
        if (price < 0) {
            throw new IllegalArgumentException("Cell price must not be negative: " + price);
        }
        if (owner != null && (tag == null || tag.isEmpty())) {
            throw new IllegalArgumentException("An owned cell must carry a non-empty tag.");
        }
    }

    /**
     * Returns a never-written cell at the given initial price.
     */
    public static Cell fresh(final long initialPrice) {
        return new Cell(null, initialPrice, null, 0L);
    }

    public boolean isOwned() {
        return owner != null;
    }

    public Optional<ActorId> ownerOptional() {
        return Optional.ofNullable(owner);
    }

    public boolean isStale(final long currentCycle) {
        return lastUpdateCycle < currentCycle;
    }

    /**
     * Applies the lazy reset rule. A cell written in the current cycle is returned unchanged,
     * so resolving twice is a no-op.
     *
     * @param currentCycle id of the current cycle
     * @param initialPrice price a reset cell starts from
     * @return this cell if current, otherwise an unowned cell at the initial price stamped with the current cycle
     */
    public Cell resolve(final long currentCycle, final long initialPrice) {
        if (!isStale(currentCycle)) {
            return this;
        }
        return new Cell(null, initialPrice, tag, currentCycle);
    }

    /**
     * Returns the state after {@code buyer} bought this cell.
     */
    public Cell purchasedBy(final ActorId buyer, final long newPrice, final String newTag, final long cycleId) {
        Objects.requireNonNull(buyer, "buyer");
        return new Cell(buyer, newPrice, newTag, cycleId);
    }
}
