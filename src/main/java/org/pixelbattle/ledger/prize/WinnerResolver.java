package org.pixelbattle.ledger.prize;

import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.model.OwnershipLedger;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the actors holding the most cells. Ties are kept: every actor with the maximal count is a
 * winner. Runs in O(owners) over the ownership ledger.
 */
public final class WinnerResolver {

    /**
     * @param ledger the ownership ledger of the cycle being resolved
     * @return all actors with the maximal positive count, empty if no cell is owned
     */
    public Set<ActorId> resolve(final OwnershipLedger ledger) {
        return resolve(ledger.snapshotCounts());
    }

    /**
     * @param counts actor to owned-cell count
     * @return all actors with the maximal positive count, ordered by id
     */
    public Set<ActorId> resolve(final Map<ActorId, Integer> counts) {
        int max = 0;
        final Set<ActorId> winners = new TreeSet<>();
        for (final Map.Entry<ActorId, Integer> entry : counts.entrySet()) {
            final int count = entry.getValue();
            if (count <= 0 || count < max) {
                continue;
            }
            if (count > max) {
                max = count;
                winners.clear();
            }
            winners.add(entry.getKey());
        }
        return Collections.unmodifiableSet(winners);
    }
}
