package org.pixelbattle.ledger.model;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.Arrays;

/**
 * Holds the per-cell state of the fixed-size grid. Pure storage: bounds checking is the only
 * validation performed here, every other rule is enforced by the callers.
 * <p>
 * Cells are kept in row-major parallel arrays. Written cells are additionally tracked in a sparse
 * index set so snapshots only need to visit cells that were ever touched.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe. The owning ledger serializes all access.
 */
public class GridStore {
    private final GridProperties properties;
    private final long initialPrice;

    private final ActorId[] ownerGrid;
    private final long[] priceGrid;
    private final String[] tagGrid;
    private final long[] cycleGrid;

    private final IntSet touchedIndices;

    /**
     * Creates a grid whose cells are all unowned at {@code initialPrice}.
     *
     * @param properties   the grid dimensions
     * @param initialPrice the price of a never-bought cell
     */
    public GridStore(final GridProperties properties, final long initialPrice) {
        if (initialPrice < 1) {
            throw new IllegalArgumentException("Initial price must be at least 1, got " + initialPrice);
        }
        this.properties = properties;
        this.initialPrice = initialPrice;
        final int size = properties.getCellCount();
        this.ownerGrid = new ActorId[size];
        this.priceGrid = new long[size];
        Arrays.fill(this.priceGrid, initialPrice);
        this.tagGrid = new String[size];
        this.cycleGrid = new long[size];
        this.touchedIndices = new IntOpenHashSet();
    }

    public GridProperties getProperties() {
        return properties;
    }

    public long getInitialPrice() {
        return initialPrice;
    }

    public int getWidth() {
        return properties.getWidth();
    }

    public int getHeight() {
        return properties.getHeight();
    }

    public boolean inBounds(final int x, final int y) {
        return properties.inBounds(x, y);
    }

    /**
     * Gets the raw, unresolved cell at the given coordinate.
     *
     * @throws CellOutOfBoundsException if the coordinate is outside the grid
     */
    public Cell get(final int x, final int y) {
        return getByIndex(properties.toFlatIndex(x, y));
    }

    /**
     * Overwrites the cell at the given coordinate.
     *
     * @throws CellOutOfBoundsException if the coordinate is outside the grid
     */
    public void set(final int x, final int y, final Cell cell) {
        setByIndex(properties.toFlatIndex(x, y), cell);
    }

    Cell getByIndex(final int index) {
        return new Cell(ownerGrid[index], priceGrid[index], tagGrid[index], cycleGrid[index]);
    }

    void setByIndex(final int index, final Cell cell) {
        ownerGrid[index] = cell.owner();
        priceGrid[index] = cell.price();
        tagGrid[index] = cell.tag();
        cycleGrid[index] = cell.lastUpdateCycle();
        touchedIndices.add(index);
    }

    /**
     * Gets the raw cell at a flat index.
     *
     * @param flatIndex row-major index
     * @return the cell
     */
    public Cell getAt(final int flatIndex) {
        if (flatIndex < 0 || flatIndex >= ownerGrid.length) {
            throw new IllegalArgumentException("Flat index out of range: " + flatIndex);
        }
        return getByIndex(flatIndex);
    }

    /**
     * Returns the flat indices of all cells that were ever written.
     *
     * @return an unmodifiable view of the touched indices
     */
    public IntSet getTouchedIndices() {
        return IntSets.unmodifiable(touchedIndices);
    }
}
