package com.largomodo.shelfpack.core.domain;

/**
 * Immutable placement of a rectangle on the packing surface.
 * <p>
 * Produced by {@link Shelf#alloc(int, int, int)} and handed back to callers of
 * {@link RectanglePacker}. A Bin carries no reference to the shelf that produced it.
 * </p>
 *
 * @param id  Identifier supplied by the caller or drawn from a {@link BinIdGenerator}
 * @param w   Width of the rectangle (must be &gt; 0)
 * @param h   Height of the rectangle (must be &gt; 0)
 * @param x   Left coordinate, or {@link #UNPLACED}
 * @param y   Top coordinate, or {@link #UNPLACED}
 */
public record Bin(int id, int w, int h, int x, int y) {

    /**
     * Coordinate marker for a rectangle that has no placement.
     */
    public static final int UNPLACED = -1;

    /**
     * Compact constructor that validates the size and coordinate constraints.
     *
     * @throws IllegalArgumentException if a dimension is not positive or a coordinate is below {@link #UNPLACED}
     */
    public Bin {
        if (w <= 0 || h <= 0) {
            throw new IllegalArgumentException(
                    "Bin dimensions must be positive, got: " + w + "x" + h
            );
        }
        if (x < UNPLACED || y < UNPLACED) {
            throw new IllegalArgumentException(
                    "Bin coordinates must be >= " + UNPLACED + ", got: (" + x + ", " + y + ")"
            );
        }
    }

    public boolean isPlaced() {
        return x != UNPLACED && y != UNPLACED;
    }
}
