package com.regiongraph.api;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * A typed, fixed-size buffer.
 *
 * Storage is a single heap ByteBuffer in native order, allocated once at
 * construction. All copy operations write in place; nothing on the copy path
 * allocates, which keeps Input.prepare() garbage free.
 *
 * Copies between arrays of the same element type are bulk byte copies.
 * Copies between different element types convert element by element
 * (integer to integer through long, anything involving a floating point type
 * through double).
 */
public final class Array implements ReadableArray {
    private final ElementType type;
    private final int count;
    private final ByteBuffer buffer;

    public Array(ElementType type, int count) {
        if (type == null)
            throw new IllegalArgumentException("Element type is required");
        if (count < 0)
            throw new IllegalArgumentException("Negative element count: " + count);
        this.type = type;
        this.count = count;
        this.buffer = ByteBuffer.allocate(Math.multiplyExact(count, type.byteSize())).order(ByteOrder.nativeOrder());
    }

    @Override
    public ElementType getType() {
        return type;
    }

    @Override
    public int getCount() {
        return count;
    }

    @Override
    public double getDouble(int index) {
        int pos = position(index);
        return switch (type) {
            case BYTE -> buffer.get(pos);
            case INT16 -> buffer.getShort(pos);
            case INT32 -> buffer.getInt(pos);
            case INT64 -> buffer.getLong(pos);
            case REAL32 -> buffer.getFloat(pos);
            case REAL64 -> buffer.getDouble(pos);
        };
    }

    @Override
    public long getLong(int index) {
        int pos = position(index);
        return switch (type) {
            case BYTE -> buffer.get(pos);
            case INT16 -> buffer.getShort(pos);
            case INT32 -> buffer.getInt(pos);
            case INT64 -> buffer.getLong(pos);
            case REAL32 -> (long) buffer.getFloat(pos);
            case REAL64 -> (long) buffer.getDouble(pos);
        };
    }

    public void setDouble(int index, double value) {
        int pos = position(index);
        switch (type) {
            case BYTE -> buffer.put(pos, (byte) value);
            case INT16 -> buffer.putShort(pos, (short) value);
            case INT32 -> buffer.putInt(pos, (int) value);
            case INT64 -> buffer.putLong(pos, (long) value);
            case REAL32 -> buffer.putFloat(pos, (float) value);
            case REAL64 -> buffer.putDouble(pos, value);
        }
    }

    public void setLong(int index, long value) {
        int pos = position(index);
        switch (type) {
            case BYTE -> buffer.put(pos, (byte) value);
            case INT16 -> buffer.putShort(pos, (short) value);
            case INT32 -> buffer.putInt(pos, (int) value);
            case INT64 -> buffer.putLong(pos, value);
            case REAL32 -> buffer.putFloat(pos, (float) value);
            case REAL64 -> buffer.putDouble(pos, (double) value);
        }
    }

    /**
     * Convenience bulk write of doubles starting at element 0.
     *
     * @throws IllegalArgumentException if values is longer than this array.
     */
    public void setAll(double[] values) {
        if (values.length > count) {
            throw new IllegalArgumentException(
                    "Array length mismatch: capacity " + count + ", got " + values.length);
        }
        for (int i = 0; i < values.length; i++)
            setDouble(i, values[i]);
    }

    /**
     * Copies {@code n} elements from {@code src} starting at
     * {@code srcOffset} into this array starting at {@code destOffset}.
     */
    public void copyFrom(ReadableArray src, int srcOffset, int destOffset, int n) {
        checkRange(srcOffset, n, src.getCount(), "source");
        checkRange(destOffset, n, count, "destination");
        if (src instanceof Array a && a.type == type) {
            int width = type.byteSize();
            buffer.put(destOffset * width, a.buffer, srcOffset * width, n * width);
            return;
        }
        boolean viaDouble = type.isFloatingPoint() || src.getType().isFloatingPoint();
        for (int i = 0; i < n; i++) {
            if (viaDouble)
                setDouble(destOffset + i, src.getDouble(srcOffset + i));
            else
                setLong(destOffset + i, src.getLong(srcOffset + i));
        }
    }

    /**
     * Gathers whole nodes from {@code src}: block {@code i} of this array
     * (starting at {@code destOffset}) receives source node
     * {@code nodeOrder[i]}, each node being {@code nodeElementCount} elements.
     */
    public void copyNodes(ReadableArray src, int[] nodeOrder, int nodeElementCount, int destOffset) {
        int pos = destOffset;
        for (int srcNode : nodeOrder) {
            copyFrom(src, srcNode * nodeElementCount, pos, nodeElementCount);
            pos += nodeElementCount;
        }
    }

    private int position(int index) {
        if (index < 0 || index >= count)
            throw new IndexOutOfBoundsException("Index out of bounds: " + index + " (count=" + count + ")");
        return index * type.byteSize();
    }

    private static void checkRange(int offset, int n, int limit, String side) {
        if (offset < 0 || n < 0 || offset + n > limit) {
            throw new IndexOutOfBoundsException(
                    "Copy out of " + side + " bounds: offset=" + offset + ", count=" + n + ", size=" + limit);
        }
    }

    @Override
    public String toString() {
        return "Array[" + type + " x " + count + "]";
    }
}
