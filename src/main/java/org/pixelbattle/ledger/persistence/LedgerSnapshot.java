package org.pixelbattle.ledger.persistence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.pixelbattle.ledger.model.ActorId;

import java.util.List;

/**
 * Serializable image of a ledger: the cycle and every cell that was ever written. Ownership counts
 * are not stored, they are rebuilt from the cells of the current cycle on restore.
 *
 * @param formatVersion version of this layout
 * @param width         grid width the snapshot was taken with
 * @param height        grid height the snapshot was taken with
 * @param cycle         the cycle state
 * @param cells         all touched cells in row-major order
 */
public record LedgerSnapshot(
    @JsonProperty("formatVersion") int formatVersion,
    @JsonProperty("width") int width,
    @JsonProperty("height") int height,
    @JsonProperty("cycle") CycleRecord cycle,
    @JsonProperty("cells") List<CellRecord> cells
) {

    public static final int CURRENT_FORMAT_VERSION = 1;

    @JsonCreator
    public LedgerSnapshot {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    /**
     * Cycle state. Timestamps are epoch milliseconds, {@code null} before the first start.
     */
    public record CycleRecord(
        @JsonProperty("active") boolean active,
        @JsonProperty("cycleId") long cycleId,
        @JsonProperty("startedAt") Long startedAt,
        @JsonProperty("lastActivityAt") Long lastActivityAt,
        @JsonProperty("prizePool") long prizePool
    ) {
    }

    /**
     * One written cell.
     */
    public record CellRecord(
        @JsonProperty("x") int x,
        @JsonProperty("y") int y,
        @JsonProperty("owner") ActorId owner,
        @JsonProperty("price") long price,
        @JsonProperty("tag") String tag,
        @JsonProperty("lastUpdateCycle") long lastUpdateCycle
    ) {
    }
}
