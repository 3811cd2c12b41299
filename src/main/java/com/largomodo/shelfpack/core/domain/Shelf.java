package com.largomodo.shelfpack.core.domain;

import java.util.Optional;

/**
 * Horizontal strip of the packing surface with a fixed top coordinate and height.
 * <p>
 * Bins are appended left-to-right; space is never reused. The only state that
 * changes after construction is the width (grown by {@link #resize(int)}) and
 * the free width consumed by {@link #alloc(int, int, int)}.
 * <p>
 * Invariant: {@code free == width - used}, where used is the summed width of
 * all bins placed so far.
 */
public class Shelf {

    private final int y;
    private final int height;
    private int width;
    private int free;

    /**
     * @param y      Top coordinate of the shelf
     * @param width  Initial width (normally the full surface width)
     * @param height Height of the shelf, fixed for its lifetime
     */
    public Shelf(int y, int width, int height) {
        this.y = y;
        this.width = width;
        this.height = height;
        this.free = width;
    }

    /**
     * Allocates a bin immediately to the right of the bins already on this shelf.
     *
     * @param id Identifier recorded in the resulting bin
     * @param w  Width of the bin
     * @param h  Height of the bin
     * @return the placed bin, or empty if the shelf is too short or lacks free width
     * @throws IllegalArgumentException if w or h is not positive
     */
    public Optional<Bin> alloc(int id, int w, int h) {
        if (w <= 0 || h <= 0) {
            throw new IllegalArgumentException("Bin size must be positive, got: " + w + "x" + h);
        }
        if (w > free || h > height) {
            return Optional.empty();
        }
        int x = width - free;
        free -= w;
        return Optional.of(new Bin(id, w, h, x, y));
    }

    /**
     * Grows the shelf to a new width.
     *
     * @param newWidth Requested width
     * @return true if the shelf was resized, false if newWidth is smaller than the current width
     */
    public boolean resize(int newWidth) {
        if (newWidth < width) {
            return false;
        }
        free += newWidth - width;
        width = newWidth;
        return true;
    }

    /**
     * Narrows the shelf when the surface is shrunk, never below its used width.
     */
    void trim(int newWidth) {
        int target = Math.max(newWidth, getUsedWidth());
        if (target < width) {
            free -= width - target;
            width = target;
        }
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getFree() {
        return free;
    }

    public int getUsedWidth() {
        return width - free;
    }
}
