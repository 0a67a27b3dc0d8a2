package com.regiongraph.api;

import java.util.Arrays;

/**
 * Shape of a region's node grid, e.g. [4 2] for eight nodes laid out four by
 * two.
 *
 * Immutable. Two distinguished values exist besides a real shape:
 * <ul>
 * <li>{@link #UNSPECIFIED}: not yet known; negotiation has not reached it.</li>
 * <li>{@link #DONTCARE}: the holder accepts any shape (region-level
 * inputs).</li>
 * </ul>
 *
 * Linear node indices vary fastest along dimension 0: in [4 2] the node at
 * coordinate (x, y) has index x + 4 * y.
 */
public final class Dimensions {
    public static final Dimensions UNSPECIFIED = new Dimensions(new int[0]);
    public static final Dimensions DONTCARE = new Dimensions(new int[] { 0 });

    private final int[] dims;

    private Dimensions(int[] dims) {
        this.dims = dims;
    }

    /**
     * Creates a specified shape.
     *
     * @throws IllegalArgumentException if no sizes are given or any size is not
     *                                  positive.
     */
    public static Dimensions of(int... dims) {
        if (dims == null || dims.length == 0)
            throw new IllegalArgumentException("Dimensions need at least one size");
        for (int d : dims) {
            if (d <= 0)
                throw new IllegalArgumentException("Dimension sizes must be positive: " + Arrays.toString(dims));
        }
        return new Dimensions(dims.clone());
    }

    public boolean isUnspecified() {
        return dims.length == 0;
    }

    public boolean isDontcare() {
        return dims.length == 1 && dims[0] == 0;
    }

    public boolean isSpecified() {
        return !isUnspecified() && !isDontcare();
    }

    /** Number of axes. */
    public int size() {
        return isSpecified() ? dims.length : 0;
    }

    public int get(int axis) {
        requireSpecified();
        return dims[axis];
    }

    /**
     * @return The total number of nodes (product of all sizes).
     */
    public int getCount() {
        requireSpecified();
        int n = 1;
        for (int d : dims)
            n = Math.multiplyExact(n, d);
        return n;
    }

    public int[] toArray() {
        return isSpecified() ? dims.clone() : new int[0];
    }

    /**
     * Converts a coordinate to a linear node index (axis 0 fastest).
     */
    public int getIndex(int[] coordinate) {
        requireSpecified();
        if (coordinate.length != dims.length) {
            throw new IllegalArgumentException(
                    "Coordinate " + Arrays.toString(coordinate) + " does not match dimensions " + this);
        }
        int index = 0;
        int stride = 1;
        for (int axis = 0; axis < dims.length; axis++) {
            int c = coordinate[axis];
            if (c < 0 || c >= dims[axis])
                throw new IndexOutOfBoundsException("Coordinate " + Arrays.toString(coordinate) + " outside " + this);
            index += c * stride;
            stride *= dims[axis];
        }
        return index;
    }

    /**
     * Converts a linear node index to a coordinate (axis 0 fastest).
     */
    public int[] getCoordinate(int index) {
        int n = getCount();
        if (index < 0 || index >= n)
            throw new IndexOutOfBoundsException("Node index " + index + " outside " + this);
        int[] coordinate = new int[dims.length];
        for (int axis = 0; axis < dims.length; axis++) {
            coordinate[axis] = index % dims[axis];
            index /= dims[axis];
        }
        return coordinate;
    }

    /**
     * Two shapes are compatible when they are equal or either is DONTCARE.
     * UNSPECIFIED is only compatible with itself and DONTCARE.
     */
    public boolean isCompatible(Dimensions other) {
        return isDontcare() || other.isDontcare() || equals(other);
    }

    private void requireSpecified() {
        if (!isSpecified())
            throw new IllegalStateException("Dimensions are not specified: " + this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof Dimensions other && Arrays.equals(dims, other.dims);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        if (isUnspecified())
            return "[unspecified]";
        if (isDontcare())
            return "[dontcare]";
        StringBuilder sb = new StringBuilder(4 * dims.length + 2).append('[');
        for (int i = 0; i < dims.length; i++) {
            if (i > 0)
                sb.append(' ');
            sb.append(dims[i]);
        }
        return sb.append(']').toString();
    }
}
