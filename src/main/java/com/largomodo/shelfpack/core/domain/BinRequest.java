package com.largomodo.shelfpack.core.domain;

import java.util.OptionalInt;

/**
 * Caller-owned request for a rectangle of a given size.
 * <p>
 * Unlike {@link Bin}, a request is mutable: batch packing with {@code inPlace}
 * writes the placement and the assigned id back onto it. A request may carry
 * zero or negative dimensions; batch packing skips those instead of failing.
 * <p>
 * Not thread-safe.
 */
public class BinRequest {

    private Integer id;
    private final int w;
    private final int h;
    private int x = Bin.UNPLACED;
    private int y = Bin.UNPLACED;

    /**
     * Creates a request without an id; the packer assigns one on placement.
     *
     * @param w Requested width
     * @param h Requested height
     */
    public BinRequest(int w, int h) {
        this.w = w;
        this.h = h;
    }

    /**
     * Creates a request with a caller-chosen id.
     *
     * @param id Identifier reported back in the placement
     * @param w  Requested width
     * @param h  Requested height
     */
    public BinRequest(int id, int w, int h) {
        this(w, h);
        this.id = id;
    }

    public OptionalInt getId() {
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public int getW() {
        return w;
    }

    public int getH() {
        return h;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public boolean isPlaced() {
        return x != Bin.UNPLACED && y != Bin.UNPLACED;
    }

    /**
     * Copies id and coordinates of a placement onto this request.
     *
     * @param placement Bin returned by the packer for this request
     */
    void applyPlacement(Bin placement) {
        this.id = placement.id();
        this.x = placement.x();
        this.y = placement.y();
    }

    @Override
    public String toString() {
        return "BinRequest{id=" + (id == null ? "?" : id) + ", w=" + w + ", h=" + h + ", x=" + x + ", y=" + y + "}";
    }
}
