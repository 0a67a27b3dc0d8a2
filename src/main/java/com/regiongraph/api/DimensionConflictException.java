package com.regiongraph.api;

/**
 * Two sources of truth disagree about a shape: a link asked to re-fix its
 * dimensions to a different value, links into one input imply different
 * shapes, or an induced shape contradicts a region's dimensions.
 */
public class DimensionConflictException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public DimensionConflictException(String message) {
        super(message);
    }
}
