package com.largomodo.shelfpack.core.domain;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Monotonically increasing id generator starting at a configurable value.
 * <p>
 * Each {@link ShelfPacker} created without an explicit generator owns its own
 * instance. AtomicInteger allows one instance to be shared between packers
 * that must not hand out overlapping ids.
 */
public class SequentialBinIdGenerator implements BinIdGenerator {

    private final AtomicInteger next;

    public SequentialBinIdGenerator() {
        this(1);
    }

    public SequentialBinIdGenerator(int first) {
        this.next = new AtomicInteger(first);
    }

    @Override
    public int nextId() {
        return next.getAndIncrement();
    }
}
