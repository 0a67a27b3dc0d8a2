package com.regiongraph.api;

/** Creates a {@link LinkPolicy} from a link's raw parameter string. */
@FunctionalInterface
public interface LinkPolicyFactory {

    /**
     * @param linkParams Policy-private parameter string, never null (may be
     *                   empty).
     * @throws LinkConfigurationException with reason INVALID_PARAMS if the
     *                                    string cannot be parsed.
     */
    LinkPolicy create(String linkParams);
}
