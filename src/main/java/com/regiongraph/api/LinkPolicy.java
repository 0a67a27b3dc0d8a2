package com.regiongraph.api;

/**
 * The rule a link applies between the node grid of its source region and the
 * node grid of its destination region.
 *
 * A policy is stateless with respect to negotiation: the Link stores the
 * dimensions it has fixed and asks the policy to translate them in either
 * direction. Policies are created by a {@link LinkPolicyFactory} from the
 * link's parameter string and are looked up by name.
 *
 * Index spaces:
 * The "contribution" of a link is the block of the aggregated input buffer it
 * fills, node by node. For a policy that does not reindex, contribution node
 * i is source node i. For a reindexing policy, contribution node i is source
 * node {@code sourceNodeOrder(...)[i]}. {@link #nodeSplitterMap} always speaks
 * in contribution node indices.
 */
public interface LinkPolicy {

    /** The registry name this policy was created under. */
    String name();

    /**
     * Destination dimensions implied by fully known source dimensions.
     *
     * @throws DimensionConflictException if the source shape is not legal for
     *                                    this policy.
     */
    Dimensions destDimensionsFor(Dimensions src);

    /**
     * Source dimensions implied by known destination dimensions.
     *
     * @return The implied shape, or {@link Dimensions#UNSPECIFIED} if this
     *         policy cannot infer the source from the destination.
     * @throws DimensionConflictException if the destination shape is not legal
     *                                    for this policy.
     */
    Dimensions sourceDimensionsFor(Dimensions dest);

    /**
     * Node-level splitter map: entry {@code d} lists the contribution node
     * indices read by destination node {@code d}, in a deterministic order.
     */
    int[][] nodeSplitterMap(Dimensions src, Dimensions dest);

    /**
     * Whether the contribution must be gathered in a different node order than
     * the source buffer. A reindexing link can never be served by zero-copy.
     */
    default boolean requiresReindexing() {
        return false;
    }

    /**
     * Gather order for reindexing policies: contribution node {@code i} is
     * source node {@code result[i]}.
     */
    default int[] sourceNodeOrder(Dimensions src, Dimensions dest) {
        throw new UnsupportedOperationException(name() + " does not reindex");
    }
}
