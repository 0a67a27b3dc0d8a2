package com.regiongraph.link;

import com.regiongraph.api.DimensionConflictException;
import com.regiongraph.api.Dimensions;
import com.regiongraph.api.LinkPolicy;

import java.util.Set;

/**
 * Swaps the two axes of a two-dimensional region: an [a b] source feeds a
 * [b a] destination. Takes no parameters.
 *
 * The contribution is gathered in destination node order, so destination node
 * i reads exactly contribution node i. This is the one built-in policy that
 * requires reindexing, and therefore the one that always copies.
 */
public final class TransposeLinkPolicy implements LinkPolicy {
    public static final String NAME = "Transpose";

    static TransposeLinkPolicy fromParams(String raw) {
        if (!LinkParams.parse(NAME, raw, Set.of()).isEmpty())
            throw LinkParams.invalid(NAME, "takes no parameters");
        return new TransposeLinkPolicy();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Dimensions destDimensionsFor(Dimensions src) {
        return swap(src);
    }

    @Override
    public Dimensions sourceDimensionsFor(Dimensions dest) {
        return swap(dest);
    }

    @Override
    public boolean requiresReindexing() {
        return true;
    }

    @Override
    public int[] sourceNodeOrder(Dimensions src, Dimensions dest) {
        int n = dest.getCount();
        int[] order = new int[n];
        for (int node = 0; node < n; node++) {
            int[] c = dest.getCoordinate(node);
            order[node] = src.getIndex(new int[] { c[1], c[0] });
        }
        return order;
    }

    @Override
    public int[][] nodeSplitterMap(Dimensions src, Dimensions dest) {
        int[][] map = new int[dest.getCount()][];
        for (int node = 0; node < map.length; node++)
            map[node] = new int[] { node };
        return map;
    }

    private static Dimensions swap(Dimensions dims) {
        if (dims.size() != 2)
            throw new DimensionConflictException(NAME + " requires two-dimensional regions, got " + dims);
        return Dimensions.of(dims.get(1), dims.get(0));
    }

    @Override
    public String toString() {
        return NAME;
    }
}
