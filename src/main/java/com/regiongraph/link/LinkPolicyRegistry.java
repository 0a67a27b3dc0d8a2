package com.regiongraph.link;

import com.regiongraph.api.LinkConfigurationException;
import com.regiongraph.api.LinkConfigurationException.Reason;
import com.regiongraph.api.LinkPolicy;
import com.regiongraph.api.LinkPolicyFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry mapping link type names to policy factories.
 *
 * Comes pre-populated with the built-in policies. An empty link type name
 * selects {@link #DEFAULT_LINK_TYPE}.
 */
public final class LinkPolicyRegistry {
    public static final String DEFAULT_LINK_TYPE = UniformLinkPolicy.NAME;

    private final Map<String, LinkPolicyFactory> factories = new TreeMap<>();

    public LinkPolicyRegistry() {
        registerBuiltIns();
    }

    /**
     * Adds or replaces the factory for {@code linkType}.
     */
    public LinkPolicyRegistry register(String linkType, LinkPolicyFactory factory) {
        if (linkType == null || linkType.isEmpty())
            throw new IllegalArgumentException("Link type name must not be empty");
        factories.put(linkType, factory);
        return this;
    }

    public boolean contains(String linkType) {
        return factories.containsKey(resolveName(linkType));
    }

    public Set<String> linkTypes() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * Creates the policy for a new link.
     *
     * @throws LinkConfigurationException UNKNOWN_LINK_TYPE if no factory is
     *                                    registered, INVALID_PARAMS if the
     *                                    factory rejects the parameters.
     */
    public LinkPolicy create(String linkType, String linkParams) {
        String name = resolveName(linkType);
        LinkPolicyFactory factory = factories.get(name);
        if (factory == null) {
            throw new LinkConfigurationException(Reason.UNKNOWN_LINK_TYPE,
                    "Unknown link type '" + name + "' (known: " + factories.keySet() + ")");
        }
        return factory.create(linkParams == null ? "" : linkParams);
    }

    private static String resolveName(String linkType) {
        return linkType == null || linkType.isEmpty() ? DEFAULT_LINK_TYPE : linkType;
    }

    // ── Built-in Factories ──────────────────────────────────────────

    private void registerBuiltIns() {
        register(UniformLinkPolicy.NAME, UniformLinkPolicy::fromParams);
        register(TestFanIn2LinkPolicy.NAME, TestFanIn2LinkPolicy::fromParams);
        register(TransposeLinkPolicy.NAME, TransposeLinkPolicy::fromParams);
    }
}
