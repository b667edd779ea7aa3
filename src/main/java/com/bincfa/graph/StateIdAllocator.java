package com.bincfa.graph;

/**
 * Issues state identifiers. Identifiers never decrease; {@link #reset(long)} is reserved for
 * seeding a new root and for restoring a checkpoint.
 */
public class StateIdAllocator {
    private long last;

    public StateIdAllocator() {
        this(Cfa.ROOT_ID);
    }

    public StateIdAllocator(long last) {
        this.last = last;
    }

    /** @return a fresh identifier */
    public long next() {
        return ++last;
    }

    /** @return the last issued identifier */
    public long current() {
        return last;
    }

    void reset(long value) {
        this.last = value;
    }
}
