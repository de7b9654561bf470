package org.pixelbattle.ledger.model;

/**
 * Read-only projection of a cell as exposed to collaborators, already lazily resolved.
 *
 * @param x     column
 * @param y     row
 * @param owner current owner or {@code null}
 * @param price price of the next purchase
 * @param tag   tag or {@code null}
 */
public record CellView(int x, int y, ActorId owner, long price, String tag) {

    public static CellView of(final int x, final int y, final Cell cell) {
        return new CellView(x, y, cell.owner(), cell.price(), cell.tag());
    }

    public boolean isOwned() {
        return owner != null;
    }
}
