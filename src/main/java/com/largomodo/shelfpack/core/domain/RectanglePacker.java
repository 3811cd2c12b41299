package com.largomodo.shelfpack.core.domain;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Strategy interface for packing rectangles onto a single bounded surface.
 * <p>
 * "Does not fit" is an expected outcome and is reported through empty results
 * and boolean returns rather than exceptions. Implementations are not required
 * to be thread-safe; callers serialize mutating calls.
 */
public interface RectanglePacker {

    /**
     * Packs a single rectangle, assigning it a generated id.
     *
     * @param w Width, must be positive
     * @param h Height, must be positive
     * @return the placement, or empty if no space could be found
     * @throws IllegalArgumentException if w or h is not positive
     */
    Optional<Bin> packOne(int w, int h);

    /**
     * Packs a single rectangle under a caller-supplied id.
     * <p>
     * Ids are not required to be unique: a request reusing the id of an
     * earlier placement is allocated like any other, and {@link #getBin(int)}
     * then reports the newer placement.
     *
     * @param id Identifier of the rectangle
     * @param w  Width, must be positive
     * @param h  Height, must be positive
     * @return the placement, or empty if no space could be found
     * @throws IllegalArgumentException if w or h is not positive
     */
    Optional<Bin> packOne(int id, int w, int h);

    /**
     * Packs a batch of requests in order without modifying them.
     *
     * @see #pack(List, boolean)
     */
    default List<Bin> pack(List<BinRequest> requests) {
        return pack(requests, false);
    }

    /**
     * Packs a batch of requests strictly in order.
     * <p>
     * Requests with a non-positive dimension, and requests that do not fit, are
     * omitted from the result. Relative order of the placed requests is preserved.
     *
     * @param requests requests to pack, must not be null
     * @param inPlace  if true, id and coordinates of each placement are written back onto its request
     * @return placements of the successfully packed requests, empty if none fit
     * @throws IllegalArgumentException if requests is null
     */
    List<Bin> pack(List<BinRequest> requests, boolean inPlace);

    /**
     * Grows the surface. Shrinking is rejected without any state change.
     *
     * @return true if resized, false if either dimension is smaller than the current one
     */
    boolean resize(int width, int height);

    /**
     * Discards every placement and the allocation statistics.
     * <p>
     * The surface size is kept and the id source is not rewound: ids generated
     * after a clear continue from where they stopped, so they differ from the
     * ids a freshly constructed packer would hand out.
     */
    void clear();

    /**
     * Looks up the most recent placement recorded under an id.
     *
     * @param id Identifier supplied by the caller or generated by the packer
     * @return the placement, or empty if nothing with this id is placed (including after {@link #clear()})
     */
    Optional<Bin> getBin(int id);

    int getWidth();

    int getHeight();

    /**
     * Diagnostic count of successful allocations keyed by exact requested height.
     *
     * @return read-only view, ordered by height
     */
    SortedMap<Integer, Integer> getHeightStats();
}
