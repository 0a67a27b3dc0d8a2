package com.regiongraph.link;

import com.regiongraph.api.Dimensions;
import com.regiongraph.api.LinkPolicy;

import java.util.Set;

/**
 * Fixed fan-in of two along every axis. Takes no parameters.
 *
 * Equivalent to a strict {@link UniformLinkPolicy} with rfSize 2: a [4 4]
 * source feeds a [2 2] destination, each destination node reading a 2x2 block.
 */
public final class TestFanIn2LinkPolicy implements LinkPolicy {
    public static final String NAME = "TestFanIn2";

    private final UniformLinkPolicy fanIn = new UniformLinkPolicy(UniformLinkPolicy.Mapping.IN, new int[] { 2 },
            true);

    static TestFanIn2LinkPolicy fromParams(String raw) {
        if (!LinkParams.parse(NAME, raw, Set.of()).isEmpty())
            throw LinkParams.invalid(NAME, "takes no parameters");
        return new TestFanIn2LinkPolicy();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Dimensions destDimensionsFor(Dimensions src) {
        return fanIn.destDimensionsFor(src);
    }

    @Override
    public Dimensions sourceDimensionsFor(Dimensions dest) {
        return fanIn.sourceDimensionsFor(dest);
    }

    @Override
    public int[][] nodeSplitterMap(Dimensions src, Dimensions dest) {
        return fanIn.nodeSplitterMap(src, dest);
    }

    @Override
    public String toString() {
        return NAME;
    }
}
