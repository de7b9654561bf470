package org.pixelbattle.ledger.model;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mapping from actor to the cells it owns in the current cycle.
 * <p>
 * Invariant: the sum of all counts equals the number of owned cells. Actors whose count drops to
 * zero are removed, so every entry has a positive count.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe. The owning ledger serializes all access.
 */
public class OwnershipLedger {

    private final Object2IntOpenHashMap<ActorId> counts = new Object2IntOpenHashMap<>();
    private final Map<ActorId, IntSet> ownedIndices = new HashMap<>();
    private int totalOwned;

    /**
     * Records that {@code actor} gained the cell at {@code flatIndex}.
     */
    public void credit(final ActorId actor, final int flatIndex) {
        final IntSet cells = ownedIndices.computeIfAbsent(actor, a -> new IntOpenHashSet());
        if (!cells.add(flatIndex)) {
            throw new IllegalStateException("Actor " + actor + " already owns cell index " + flatIndex);
        }
        counts.addTo(actor, 1);
        totalOwned++;
    }

    /**
     * Records that {@code actor} lost the cell at {@code flatIndex}.
     *
     * @throws IllegalStateException if the actor does not own that cell
     */
    public void debit(final ActorId actor, final int flatIndex) {
        final IntSet cells = ownedIndices.get(actor);
        if (cells == null || !cells.remove(flatIndex)) {
            throw new IllegalStateException("Actor " + actor + " does not own cell index " + flatIndex);
        }
        if (cells.isEmpty()) {
            ownedIndices.remove(actor);
            counts.removeInt(actor);
        } else {
            counts.addTo(actor, -1);
        }
        totalOwned--;
    }

    public int count(final ActorId actor) {
        return counts.getInt(actor);
    }

    public int getTotalOwned() {
        return totalOwned;
    }

    public boolean isEmpty() {
        return totalOwned == 0;
    }

    /**
     * @return the flat indices owned by {@code actor}, empty if none
     */
    public IntSet ownedIndices(final ActorId actor) {
        final IntSet cells = ownedIndices.get(actor);
        return cells == null ? IntSets.EMPTY_SET : IntSets.unmodifiable(cells);
    }

    /**
     * Returns a copy of all positive counts.
     *
     * @return actor to owned-cell count, ordered by actor id for deterministic iteration
     */
    public Map<ActorId, Integer> snapshotCounts() {
        final Map<ActorId, Integer> copy = new TreeMap<>();
        for (final Object2IntMap.Entry<ActorId> entry : counts.object2IntEntrySet()) {
            copy.put(entry.getKey(), entry.getIntValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Forgets all ownership. Used when a new cycle opens.
     */
    public void clear() {
        counts.clear();
        ownedIndices.clear();
        totalOwned = 0;
    }
}
