package org.pixelbattle.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Dimensions of the grid and the coordinate arithmetic shared by the store, the ledger and the
 * snapshot code, without the cell data itself.
 */
public class GridProperties {
    private final int width;
    private final int height;

    /**
     * Creates new grid properties.
     *
     * @param width  number of columns, must be positive
     * @param height number of rows, must be positive
     */
    @JsonCreator
    public GridProperties(@JsonProperty("width") final int width, @JsonProperty("height") final int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + width + "x" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Grid of " + width + "x" + height + " cells is too large.");
        }
        this.width = width;
        this.height = height;
    }

    @JsonProperty("width")
    public int getWidth() {
        return width;
    }

    @JsonProperty("height")
    public int getHeight() {
        return height;
    }

    /**
     * @return total number of cells
     */
    public int getCellCount() {
        return width * height;
    }

    public boolean inBounds(final int x, final int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Converts a coordinate to its row-major flat index: {@code y * width + x}.
     *
     * @throws CellOutOfBoundsException if the coordinate is outside the grid
     */
    public int toFlatIndex(final int x, final int y) {
        if (!inBounds(x, y)) {
            throw new CellOutOfBoundsException(x, y, width, height);
        }
        return y * width + x;
    }

    /**
     * Converts a flat index back to a coordinate. Inverse of {@link #toFlatIndex(int, int)}.
     *
     * @param flatIndex the flat index (0 &lt;= index &lt; cell count)
     * @return the coordinate
     * @throws IllegalArgumentException if the index is out of range
     */
    public Coordinate toCoordinate(final int flatIndex) {
        if (flatIndex < 0 || flatIndex >= getCellCount()) {
            throw new IllegalArgumentException("Flat index out of range: " + flatIndex);
        }
        return new Coordinate(flatIndex % width, flatIndex / width);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
