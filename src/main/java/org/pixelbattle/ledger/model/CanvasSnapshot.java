package org.pixelbattle.ledger.model;

import java.util.List;

/**
 * The whole grid at one point in time, lazily resolved: stale cells appear unowned at the initial
 * price while keeping their tag.
 *
 * @param width   grid width
 * @param height  grid height
 * @param cycleId cycle the view was taken in
 * @param cells   all cells in row-major order ({@code index = y * width + x})
 */
public record CanvasSnapshot(int width, int height, long cycleId, List<CellView> cells) {

    public CanvasSnapshot {
        cells = List.copyOf(cells);
        if (cells.size() != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " cells, got " + cells.size());
        }
    }

    public CellView cellAt(final int x, final int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new CellOutOfBoundsException(x, y, width, height);
        }
        return cells.get(y * width + x);
    }
}
