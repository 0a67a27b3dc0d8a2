package com.regiongraph.api;

/**
 * Element types an {@link Array} can hold.
 *
 * Every type has a fixed width in bytes. Integer types are read and written
 * through long accessors, floating point types through double accessors;
 * either accessor works on every type with the usual Java numeric conversion.
 */
public enum ElementType {
    BYTE(1, false),
    INT16(2, false),
    INT32(4, false),
    INT64(8, false),
    REAL32(4, true),
    REAL64(8, true);

    private final int byteSize;
    private final boolean floatingPoint;

    ElementType(int byteSize, boolean floatingPoint) {
        this.byteSize = byteSize;
        this.floatingPoint = floatingPoint;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }
}
