package org.pixelbattle.ledger.model;

/**
 * Thrown by the {@link GridStore} when a coordinate lies outside the fixed grid.
 */
public class CellOutOfBoundsException extends RuntimeException {

    private final int x;
    private final int y;

    public CellOutOfBoundsException(final int x, final int y, final int width, final int height) {
        super("Cell (" + x + ", " + y + ") is outside the " + width + "x" + height + " grid.");
        this.x = x;
        this.y = y;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }
}
