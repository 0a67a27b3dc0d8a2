package com.regiongraph.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * For each node of a destination region, the ordered element indices of the
 * aggregated input buffer that belong to that node.
 *
 * Immutable once built. Entries are stored as one flattened index array plus
 * a start-offset array (compressed sparse row), so lookups never allocate
 * except for the defensive copy returned by {@link #getIndices(int)}.
 */
public final class SplitterMap {
    private final int[] starts;
    private final int[] indices;

    private SplitterMap(int[] starts, int[] indices) {
        this.starts = starts;
        this.indices = indices;
    }

    public int getNodeCount() {
        return starts.length - 1;
    }

    public int getElementCount(int node) {
        return starts[node + 1] - starts[node];
    }

    /** Element index {@code i} of {@code node}, without copying. */
    public int indexAt(int node, int i) {
        if (i < 0 || i >= getElementCount(node))
            throw new IndexOutOfBoundsException("Index " + i + " outside node " + node + " entry");
        return indices[starts[node] + i];
    }

    public int[] getIndices(int node) {
        return Arrays.copyOfRange(indices, starts[node], starts[node + 1]);
    }

    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof SplitterMap other
                && Arrays.equals(starts, other.starts)
                && Arrays.equals(indices, other.indices);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(starts) + Arrays.hashCode(indices);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64);
        for (int node = 0; node < getNodeCount(); node++)
            sb.append(node).append(": ").append(Arrays.toString(getIndices(node))).append('\n');
        return sb.toString();
    }

    /**
     * Accumulates per-node index lists. Links append their own entries,
     * already shifted by their offset into the aggregated buffer.
     */
    public static final class Builder {
        private final List<List<Integer>> entries;

        private Builder(int nodeCount) {
            if (nodeCount < 0)
                throw new IllegalArgumentException("Negative node count: " + nodeCount);
            entries = new ArrayList<>(nodeCount);
            for (int i = 0; i < nodeCount; i++)
                entries.add(new ArrayList<>());
        }

        public Builder add(int node, int index) {
            entries.get(node).add(index);
            return this;
        }

        /**
         * Appends every entry of a link-local map, shifting each index by
         * {@code offset}.
         */
        public Builder addAll(int[][] linkMap, int offset) {
            if (linkMap.length != entries.size()) {
                throw new IllegalArgumentException(
                        "Link splitter map has " + linkMap.length + " nodes, expected " + entries.size());
            }
            for (int node = 0; node < linkMap.length; node++)
                for (int index : linkMap[node])
                    entries.get(node).add(index + offset);
            return this;
        }

        public SplitterMap build() {
            int n = entries.size();
            int[] starts = new int[n + 1];
            for (int i = 0; i < n; i++)
                starts[i + 1] = starts[i] + entries.get(i).size();
            int[] flat = new int[starts[n]];
            for (int i = 0; i < n; i++) {
                List<Integer> e = entries.get(i);
                for (int j = 0; j < e.size(); j++)
                    flat[starts[i] + j] = e.get(j);
            }
            return new SplitterMap(starts, flat);
        }
    }
}
