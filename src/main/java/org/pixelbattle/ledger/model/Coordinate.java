package org.pixelbattle.ledger.model;

/**
 * A grid position.
 */
public record Coordinate(int x, int y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
