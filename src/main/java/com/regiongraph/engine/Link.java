package com.regiongraph.engine;

import com.regiongraph.api.Array;
import com.regiongraph.api.DimensionConflictException;
import com.regiongraph.api.Dimensions;
import com.regiongraph.api.LinkPolicy;
import com.regiongraph.link.LinkPolicyRegistry;

import lombok.Getter;

/**
 * Binds one {@link Output} to one {@link Input} under a named link policy.
 *
 * <p>
 * A Link is created and owned by its destination Input; the source Output
 * only holds a handle to it. It carries two shapes, each UNSPECIFIED until
 * fixed:
 * <ul>
 * <li>source dimensions: the node grid of the source region,</li>
 * <li>destination dimensions: the node grid this link implies for the
 * destination region (DONTCARE for a region-level input).</li>
 * </ul>
 * Fixing either side derives the other through the policy where the policy
 * can. Once fixed, a side never changes: fixing it again to the same value is
 * a no-op and to a different value is a {@link DimensionConflictException}.
 *
 * <p>
 * After {@link Input#removeLink(Link)} the Link is released and every
 * dimension or data operation on it throws IllegalStateException.
 */
public final class Link {
    @Getter
    private final int id;
    @Getter
    private final String linkType;
    @Getter
    private final String linkParams;
    @Getter
    private final LinkPolicy policy;
    @Getter
    private final Output source;
    @Getter
    private final Input destination;

    private Dimensions sourceDimensions = Dimensions.UNSPECIFIED;
    private Dimensions destDimensions;

    // Lazily built once both sides are fixed; dimensions never change after
    // that, so neither cache needs invalidation.
    private int[][] splitterMap;
    private int[] gatherOrder;

    private boolean released;

    /**
     * @throws com.regiongraph.api.LinkConfigurationException if the link type is
     *                                                        unknown or its
     *                                                        parameters are
     *                                                        invalid.
     */
    Link(int id, String linkType, String linkParams, LinkPolicyRegistry policies, Output source,
            Input destination) {
        this.id = id;
        this.linkType = linkType == null || linkType.isEmpty() ? LinkPolicyRegistry.DEFAULT_LINK_TYPE : linkType;
        this.linkParams = linkParams == null ? "" : linkParams;
        this.policy = policies.create(this.linkType, this.linkParams);
        this.source = source;
        this.destination = destination;
        this.destDimensions = destination.isRegionLevel() ? Dimensions.DONTCARE : Dimensions.UNSPECIFIED;
    }

    public Dimensions getSourceDimensions() {
        return sourceDimensions;
    }

    /**
     * @return The destination shape this link implies, UNSPECIFIED while
     *         unknown, DONTCARE for a region-level destination input.
     */
    public Dimensions getDestDimensions() {
        return destDimensions;
    }

    /**
     * Fixes the source side and derives the destination side.
     *
     * @throws DimensionConflictException if the source side is already fixed to
     *                                    another shape, the policy rejects the
     *                                    shape, or the implied destination
     *                                    contradicts a fixed destination.
     */
    public void setSourceDimensions(Dimensions dims) {
        checkLive();
        requireSpecified(dims, "source");
        if (sourceDimensions.isSpecified()) {
            if (!sourceDimensions.equals(dims))
                throw conflict("source dimensions already fixed to " + sourceDimensions + ", cannot set " + dims);
            return;
        }

        Dimensions implied = policy.destDimensionsFor(dims);
        if (destDimensions.isSpecified() && !destDimensions.equals(implied)) {
            throw conflict("source dimensions " + dims + " imply destination " + implied
                    + " but destination is fixed to " + destDimensions);
        }
        sourceDimensions = dims;
        if (destDimensions.isUnspecified())
            destDimensions = implied;
    }

    /**
     * Fixes the destination side and, if the policy can infer it, the source
     * side.
     *
     * @throws IllegalStateException      for a link into a region-level input.
     * @throws DimensionConflictException on any disagreement with an already
     *                                    fixed side.
     */
    public void setDestDimensions(Dimensions dims) {
        checkLive();
        requireSpecified(dims, "destination");
        if (destination.isRegionLevel())
            throw new IllegalStateException("Link " + this + " feeds a region-level input; it has no destination shape");
        if (destDimensions.isSpecified()) {
            if (!destDimensions.equals(dims))
                throw conflict("destination dimensions already fixed to " + destDimensions + ", cannot set " + dims);
            return;
        }

        if (sourceDimensions.isSpecified()) {
            Dimensions implied = policy.destDimensionsFor(sourceDimensions);
            if (!implied.equals(dims)) {
                throw conflict("source dimensions " + sourceDimensions + " imply destination " + implied
                        + ", cannot set " + dims);
            }
            destDimensions = dims;
            return;
        }

        Dimensions inferred = policy.sourceDimensionsFor(dims);
        if (inferred.isSpecified() && !policy.destDimensionsFor(inferred).equals(dims)) {
            throw conflict("destination dimensions " + dims + " are not reachable from any source shape");
        }
        destDimensions = dims;
        if (inferred.isSpecified())
            sourceDimensions = inferred;
    }

    /**
     * A link is resolved when its source shape is known and, unless it feeds a
     * region-level input, its destination shape too.
     */
    public boolean isResolved() {
        return sourceDimensions.isSpecified() && !destDimensions.isUnspecified();
    }

    /**
     * Number of elements this link adds to the aggregated input buffer: every
     * node of the source region times the output's elements per node.
     */
    public int getContributionSize() {
        checkLive();
        if (!sourceDimensions.isSpecified())
            throw new IllegalStateException("Link " + this + " has no source dimensions yet");
        return Math.multiplyExact(sourceDimensions.getCount(), source.getNodeElementCount());
    }

    /**
     * This link's share of the destination splitter map: entry {@code d} lists
     * element indices, relative to the start of this link's contribution, read
     * by destination node {@code d}.
     *
     * @param destNodeCount Node count of the destination region; must match the
     *                      destination dimensions.
     */
    public int[][] getSplitterMap(int destNodeCount) {
        int[][] map = splitterMap(destNodeCount);
        int[][] copy = new int[map.length][];
        for (int i = 0; i < map.length; i++)
            copy[i] = map[i].clone();
        return copy;
    }

    int[][] splitterMap(int destNodeCount) {
        checkLive();
        if (!sourceDimensions.isSpecified() || !destDimensions.isSpecified())
            throw new IllegalStateException("Link " + this + " has no splitter map before both sides are resolved");
        if (destNodeCount != destDimensions.getCount()) {
            throw new IllegalArgumentException("Link " + this + " feeds " + destDimensions.getCount()
                    + " destination nodes, asked for " + destNodeCount);
        }
        if (splitterMap == null) {
            int k = source.getNodeElementCount();
            int[][] nodes = policy.nodeSplitterMap(sourceDimensions, destDimensions);
            int[][] elements = new int[nodes.length][];
            for (int d = 0; d < nodes.length; d++) {
                int[] e = new int[nodes[d].length * k];
                int pos = 0;
                for (int node : nodes[d])
                    for (int j = 0; j < k; j++)
                        e[pos++] = node * k + j;
                elements[d] = e;
            }
            splitterMap = elements;
        }
        return splitterMap;
    }

    /**
     * Copies this cycle's source data into {@code dest} at {@code offset},
     * gathering nodes in contribution order when the policy reindexes.
     */
    void copyInto(Array dest, int offset) {
        checkLive();
        if (policy.requiresReindexing()) {
            if (gatherOrder == null)
                gatherOrder = policy.sourceNodeOrder(sourceDimensions, resolvedGatherDims());
            dest.copyNodes(source.getData(), gatherOrder, source.getNodeElementCount(), offset);
        } else {
            dest.copyFrom(source.getData(), 0, offset, getContributionSize());
        }
    }

    private Dimensions resolvedGatherDims() {
        return destDimensions.isSpecified() ? destDimensions : policy.destDimensionsFor(sourceDimensions);
    }

    void release() {
        released = true;
    }

    public boolean isReleased() {
        return released;
    }

    private void checkLive() {
        if (released)
            throw new IllegalStateException("Link " + this + " has been removed");
    }

    private void requireSpecified(Dimensions dims, String side) {
        if (dims == null || !dims.isSpecified())
            throw new IllegalArgumentException("Link " + this + ": " + side + " dimensions must be specified, got " + dims);
    }

    private DimensionConflictException conflict(String detail) {
        return new DimensionConflictException("Link " + this + ": " + detail);
    }

    @Override
    public String toString() {
        return source.fullName() + " -> " + destination.fullName() + " [" + linkType + "]";
    }
}
