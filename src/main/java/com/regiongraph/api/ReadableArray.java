package com.regiongraph.api;

/**
 * Read-only view of a typed buffer.
 *
 * This is what an Input hands to region code after prepare(). It exposes
 * random access without materializing a copy, so under zero-copy aliasing a
 * reader sees the producing Output's buffer directly.
 */
public interface ReadableArray {

    ElementType getType();

    /**
     * @return The number of elements (not bytes).
     */
    int getCount();

    /**
     * Reads element {@code index} converted to double.
     *
     * @throws IndexOutOfBoundsException if index is outside [0, count).
     */
    double getDouble(int index);

    /**
     * Reads element {@code index} converted to long. Floating point values are
     * truncated toward zero.
     *
     * @throws IndexOutOfBoundsException if index is outside [0, count).
     */
    long getLong(int index);

    /**
     * Copies every element into a fresh double array.
     */
    default double[] toDoubleArray() {
        double[] out = new double[getCount()];
        for (int i = 0; i < out.length; i++)
            out[i] = getDouble(i);
        return out;
    }
}
