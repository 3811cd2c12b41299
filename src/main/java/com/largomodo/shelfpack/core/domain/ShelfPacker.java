package com.largomodo.shelfpack.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Shelf Best-Height-Fit rectangle packer.
 * <p>
 * The surface is divided into horizontal shelves stacked top to bottom in
 * creation order. A request goes to an existing shelf of exactly its height if
 * one has room, otherwise to the shelf wasting the least height, otherwise to a
 * new shelf opened below the last one. With auto-resize enabled the surface
 * grows (width first on a square surface) until the request fits.
 * <p>
 * Heuristic vs optimal tradeoff: O(shelves) per request with some vertical
 * waste, see "A Thousand Ways to Pack the Bin" (Jylänki) for the algorithm family.
 * <p>
 * Not thread-safe: callers must serialize packOne/pack/resize/clear on one instance.
 */
public class ShelfPacker implements RectanglePacker {

    public static final int DEFAULT_SIZE = 64;

    private static final Logger log = LoggerFactory.getLogger(ShelfPacker.class);

    // Sentinel index for "no candidate shelf found yet" during the best-fit scan
    private static final int NO_SHELF = -1;

    private final boolean autoResize;
    private final BinIdGenerator idGenerator;
    private final List<Shelf> shelves = new ArrayList<>();
    private final Map<Integer, Bin> binsById = new HashMap<>();
    private final SortedMap<Integer, Integer> heightStats = new TreeMap<>();
    private int width;
    private int height;

    /**
     * Creates a 64x64 packer without auto-resize.
     */
    public ShelfPacker() {
        this(DEFAULT_SIZE, DEFAULT_SIZE, false);
    }

    public ShelfPacker(int width, int height) {
        this(width, height, false);
    }

    public ShelfPacker(int width, int height, boolean autoResize) {
        this(width, height, autoResize, new SequentialBinIdGenerator());
    }

    /**
     * Creates a packer with an explicit id source for bins packed without an id.
     *
     * @param width       Initial surface width; non-positive values fall back to {@value #DEFAULT_SIZE}
     * @param height      Initial surface height; non-positive values fall back to {@value #DEFAULT_SIZE}
     * @param autoResize  Grow the surface when a request does not fit
     * @param idGenerator Id source, must not be null
     */
    public ShelfPacker(int width, int height, boolean autoResize, BinIdGenerator idGenerator) {
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        this.width = width > 0 ? width : DEFAULT_SIZE;
        this.height = height > 0 ? height : DEFAULT_SIZE;
        this.autoResize = autoResize;
        this.idGenerator = idGenerator;
    }

    @Override
    public List<Bin> pack(List<BinRequest> requests, boolean inPlace) {
        if (requests == null) {
            throw new IllegalArgumentException("Requests list cannot be null");
        }

        List<Bin> placements = new ArrayList<>();
        for (BinRequest request : requests) {
            // Malformed sizes are skipped, not signalled
            if (request.getW() <= 0 || request.getH() <= 0) {
                log.debug("Skipping {} with non-positive size", request);
                continue;
            }

            Optional<Bin> placement = request.getId().isPresent()
                    ? packOne(request.getId().getAsInt(), request.getW(), request.getH())
                    : packOne(request.getW(), request.getH());
            if (placement.isEmpty()) {
                continue;
            }
            if (inPlace) {
                request.applyPlacement(placement.get());
            }
            placements.add(placement.get());
        }

        // Doubling can overshoot near the end of a batch; give back the unused margin
        if (autoResize) {
            shrink();
        }
        return placements;
    }

    @Override
    public Optional<Bin> packOne(int w, int h) {
        requirePositive(w, h);
        int id;
        do {
            id = idGenerator.nextId();
        } while (binsById.containsKey(id));
        return packOne(id, w, h);
    }

    @Override
    public Optional<Bin> packOne(int id, int w, int h) {
        requirePositive(w, h);

        // Bounded: every growth strictly enlarges the surface and growth stops before int overflow
        while (true) {
            Optional<Bin> placement = place(id, w, h);
            if (placement.isPresent()) {
                // Latest placement wins the id index; earlier placements stay on their shelves
                binsById.put(id, placement.get());
                heightStats.merge(h, 1, Integer::sum);
                return placement;
            }
            if (!autoResize || !grow(w, h)) {
                log.debug("No space for bin {} ({}x{}) on {}x{} surface", id, w, h, width, height);
                return Optional.empty();
            }
        }
    }

    /**
     * Single best-fit pass over the current shelves without growing the surface.
     */
    private Optional<Bin> place(int id, int w, int h) {
        int nextY = 0;
        int best = NO_SHELF;
        int bestWaste = Integer.MAX_VALUE;

        for (int i = 0; i < shelves.size(); i++) {
            Shelf shelf = shelves.get(i);
            nextY += shelf.getHeight();

            // Exact height with room to spare wins outright
            if (h == shelf.getHeight() && w <= shelf.getFree()) {
                return shelf.alloc(id, w, h);
            }
            if (h > shelf.getHeight() || w > shelf.getFree()) {
                continue;
            }
            // Strict comparison: first shelf seen wins ties
            int waste = shelf.getHeight() - h;
            if (waste < bestWaste) {
                bestWaste = waste;
                best = i;
            }
        }

        if (best != NO_SHELF) {
            return shelves.get(best).alloc(id, w, h);
        }

        if (h <= height - nextY && w <= width) {
            Shelf shelf = new Shelf(nextY, width, h);
            shelves.add(shelf);
            log.debug("Opened shelf #{} at y={} with height {}", shelves.size() - 1, nextY, h);
            return shelf.alloc(id, w, h);
        }

        return Optional.empty();
    }

    /**
     * Enlarges the surface for a request that did not fit.
     * <p>
     * Width grows when the surface is not wider than tall, height when it is
     * wider; square surfaces grow in width. Either axis also grows when the
     * request alone exceeds it, sized against the request rather than blindly doubled.
     *
     * @return false if the grown size would overflow an int
     */
    private boolean grow(int w, int h) {
        long newWidth = width;
        long newHeight = height;

        if (width <= height || w > width) {
            newWidth = (long) Math.max(w, width) * 2;
        }
        if (height < width || h > height) {
            newHeight = (long) Math.max(h, height) * 2;
        }

        if (newWidth > Integer.MAX_VALUE || newHeight > Integer.MAX_VALUE) {
            log.debug("Cannot grow {}x{} surface any further for {}x{} request", width, height, w, h);
            return false;
        }

        log.debug("Growing surface from {}x{} to {}x{}", width, height, newWidth, newHeight);
        return resize((int) newWidth, (int) newHeight);
    }

    @Override
    public boolean resize(int newWidth, int newHeight) {
        if (newWidth < width || newHeight < height) {
            log.debug("Rejected resize from {}x{} to {}x{}: surface cannot shrink",
                    width, height, newWidth, newHeight);
            return false;
        }

        width = newWidth;
        height = newHeight;
        for (Shelf shelf : shelves) {
            shelf.resize(newWidth);
        }
        return true;
    }

    /**
     * Reduces the recorded surface to the bounding box of the shelves.
     * <p>
     * Width becomes the widest used shelf extent and height the summed shelf
     * heights. Placed bins never move; shelves are trimmed to the new width but
     * never below their used width. No-op when nothing has been packed.
     */
    public void shrink() {
        if (shelves.isEmpty()) {
            return;
        }

        int usedWidth = 0;
        int usedHeight = 0;
        for (Shelf shelf : shelves) {
            usedHeight += shelf.getHeight();
            usedWidth = Math.max(usedWidth, shelf.getUsedWidth());
        }

        if (usedWidth < width || usedHeight < height) {
            log.debug("Shrinking surface from {}x{} to {}x{}", width, height, usedWidth, usedHeight);
        }
        width = Math.min(width, usedWidth);
        height = Math.min(height, usedHeight);
        for (Shelf shelf : shelves) {
            shelf.trim(width);
        }
    }

    @Override
    public void clear() {
        shelves.clear();
        binsById.clear();
        heightStats.clear();
    }

    @Override
    public Optional<Bin> getBin(int id) {
        return Optional.ofNullable(binsById.get(id));
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    public boolean isAutoResize() {
        return autoResize;
    }

    public int getShelfCount() {
        return shelves.size();
    }

    @Override
    public SortedMap<Integer, Integer> getHeightStats() {
        return Collections.unmodifiableSortedMap(heightStats);
    }

    private static void requirePositive(int w, int h) {
        if (w <= 0 || h <= 0) {
            throw new IllegalArgumentException("Bin size must be positive, got: " + w + "x" + h);
        }
    }
}
