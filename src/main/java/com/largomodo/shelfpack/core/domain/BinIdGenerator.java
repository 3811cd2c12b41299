package com.largomodo.shelfpack.core.domain;

/**
 * Source of identifiers for bins packed without a caller-supplied id.
 * <p>
 * Injected into {@link ShelfPacker} so id allocation is owned by the caller
 * instead of living in global state.
 */
@FunctionalInterface
public interface BinIdGenerator {
    /**
     * Returns the next candidate id.
     * <p>
     * The packer skips candidates already used by a placed bin, so an
     * implementation only needs to avoid repeating itself.
     *
     * @return next id
     */
    int nextId();
}
