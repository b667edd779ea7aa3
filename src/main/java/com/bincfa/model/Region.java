package com.bincfa.model;

/**
 * Memory address space partitions, used both for initialization and for domain addressing.
 */
public enum Region {
    GLOBAL,
    STACK,
    HEAP;

    public String prefix() {
        switch (this) {
            case STACK: return "stack:";
            case HEAP: return "heap:";
            default: return "";
        }
    }
}
