package com.regiongraph.link;

import com.regiongraph.api.DimensionConflictException;
import com.regiongraph.api.Dimensions;
import com.regiongraph.api.LinkPolicy;

import java.util.Arrays;
import java.util.Set;

/**
 * Uniform receptive-field link.
 *
 * <p>
 * Parameters (all optional):
 * <ul>
 * <li><b>mapping</b>: {@code "in"} (fan-in, default) or {@code "out"}
 * (fan-out).</li>
 * <li><b>rfSize</b>: receptive field size per dimension, or a single value
 * applied to every dimension. Default {@code [1]}.</li>
 * <li><b>strict</b>: fan-in only. When true (default) every source size must
 * divide evenly by the receptive field. When false the destination rounds up
 * and the last receptive field along an axis is clipped; the source shape can
 * then no longer be inferred from the destination.</li>
 * </ul>
 *
 * <p>
 * Fan-in: destination node at coordinate c reads every source node whose
 * coordinate lies in {@code [c * rf, (c + 1) * rf)}, visited axis 0 fastest.
 * Fan-out: destination node at coordinate c reads the single source node
 * {@code c / rf}.
 */
public final class UniformLinkPolicy implements LinkPolicy {
    public static final String NAME = "UniformLink";
    private static final Set<String> KEYS = Set.of("mapping", "rfSize", "strict");

    public enum Mapping {
        IN, OUT
    }

    private final Mapping mapping;
    private final int[] rfSize;
    private final boolean strict;

    public UniformLinkPolicy(Mapping mapping, int[] rfSize, boolean strict) {
        if (rfSize.length == 0)
            throw new IllegalArgumentException("rfSize must not be empty");
        this.mapping = mapping;
        this.rfSize = rfSize.clone();
        this.strict = strict;
    }

    static UniformLinkPolicy fromParams(String raw) {
        LinkParams p = LinkParams.parse(NAME, raw, KEYS);
        String m = p.getString("mapping", "in");
        Mapping mapping = switch (m) {
            case "in" -> Mapping.IN;
            case "out" -> Mapping.OUT;
            default -> throw LinkParams.invalid(NAME, "mapping must be 'in' or 'out', got '" + m + "'");
        };
        boolean strict = p.getBoolean("strict", true);
        if (mapping == Mapping.OUT && !strict)
            throw LinkParams.invalid(NAME, "strict=false only applies to mapping 'in'");
        return new UniformLinkPolicy(mapping, p.getPositiveInts("rfSize", new int[] { 1 }), strict);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Dimensions destDimensionsFor(Dimensions src) {
        int[] s = src.toArray();
        int[] rf = rfFor(s.length);
        int[] d = new int[s.length];
        for (int axis = 0; axis < s.length; axis++) {
            if (mapping == Mapping.OUT) {
                d[axis] = Math.multiplyExact(s[axis], rf[axis]);
            } else if (s[axis] % rf[axis] == 0) {
                d[axis] = s[axis] / rf[axis];
            } else if (strict) {
                throw new DimensionConflictException("Source dimensions " + src
                        + " are not divisible by receptive field " + Arrays.toString(rf) + " (strict " + NAME + ")");
            } else {
                d[axis] = (s[axis] + rf[axis] - 1) / rf[axis];
            }
        }
        return Dimensions.of(d);
    }

    @Override
    public Dimensions sourceDimensionsFor(Dimensions dest) {
        if (mapping == Mapping.IN && !strict)
            return Dimensions.UNSPECIFIED;
        int[] d = dest.toArray();
        int[] rf = rfFor(d.length);
        int[] s = new int[d.length];
        for (int axis = 0; axis < d.length; axis++) {
            if (mapping == Mapping.IN) {
                s[axis] = Math.multiplyExact(d[axis], rf[axis]);
            } else if (d[axis] % rf[axis] != 0) {
                throw new DimensionConflictException("Destination dimensions " + dest
                        + " are not divisible by fan-out " + Arrays.toString(rf));
            } else {
                s[axis] = d[axis] / rf[axis];
            }
        }
        return Dimensions.of(s);
    }

    @Override
    public int[][] nodeSplitterMap(Dimensions src, Dimensions dest) {
        int n = dest.getCount();
        int[] rf = rfFor(dest.size());
        int[][] map = new int[n][];
        if (mapping == Mapping.OUT) {
            for (int node = 0; node < n; node++) {
                int[] c = dest.getCoordinate(node);
                for (int axis = 0; axis < c.length; axis++)
                    c[axis] /= rf[axis];
                map[node] = new int[] { src.getIndex(c) };
            }
            return map;
        }

        Dimensions field = Dimensions.of(rf);
        int fieldCount = field.getCount();
        int[] scratch = new int[fieldCount];
        for (int node = 0; node < n; node++) {
            int[] base = dest.getCoordinate(node);
            int found = 0;
            for (int k = 0; k < fieldCount; k++) {
                int[] c = field.getCoordinate(k);
                boolean inside = true;
                for (int axis = 0; axis < c.length; axis++) {
                    c[axis] += base[axis] * rf[axis];
                    if (c[axis] >= src.get(axis))
                        inside = false;
                }
                // Only non-strict fields can overhang the source grid
                if (inside)
                    scratch[found++] = src.getIndex(c);
            }
            map[node] = Arrays.copyOf(scratch, found);
        }
        return map;
    }

    private int[] rfFor(int axes) {
        if (rfSize.length == axes)
            return rfSize;
        if (rfSize.length == 1) {
            int[] rf = new int[axes];
            Arrays.fill(rf, rfSize[0]);
            return rf;
        }
        throw new DimensionConflictException("Receptive field " + Arrays.toString(rfSize)
                + " does not match a " + axes + "-dimensional region");
    }

    @Override
    public String toString() {
        return NAME + "{mapping=" + mapping.name().toLowerCase() + ", rfSize=" + Arrays.toString(rfSize)
                + ", strict=" + strict + "}";
    }
}
