package org.pixelbattle.ledger.persistence;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable storage for ledger snapshots.
 */
public interface ISnapshotStore {

    /**
     * Loads the latest snapshot.
     *
     * @return the snapshot, or empty if none was saved yet
     * @throws IOException if a snapshot exists but cannot be read
     */
    Optional<LedgerSnapshot> load() throws IOException;

    /**
     * Replaces the stored snapshot. A reader never observes a partially written snapshot.
     *
     * @param snapshot the snapshot to store
     * @throws IOException if writing failed; the previous snapshot is left intact
     */
    void save(LedgerSnapshot snapshot) throws IOException;
}
