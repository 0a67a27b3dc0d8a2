package com.regiongraph.engine;

import com.regiongraph.api.Dimensions;
import com.regiongraph.link.LinkPolicyRegistry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A set of named regions and the links between them.
 *
 * <p>
 * The Network is the wiring facade: it resolves region and port names, routes
 * link and unlink requests to the destination input, and hands the whole
 * region set to an {@link InitializationDriver}. Regions are kept in
 * registration order; that order is the order in which the driver visits them
 * and in which {@link #prepareInputs()} prepares them.
 *
 * <p>
 * Typical use:
 *
 * <pre>
 * Network net = new Network("demo");
 * Region sensor = net.addRegion("sensor", Dimensions.of(4, 4));
 * sensor.addOutput("out", ElementType.REAL32, 1);
 * Region pooler = net.addRegion("pooler");
 * pooler.addInput("in", ElementType.REAL32, false);
 * net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
 * net.initialize(); // pooler becomes [2 2]
 * </pre>
 */
public final class Network {
    private static final Logger log = LogManager.getLogger(Network.class);

    private final String name;
    private final LinkPolicyRegistry linkPolicies;
    private final InitializationDriver driver;
    private final Map<String, Region> regions = new LinkedHashMap<>();
    private boolean initialized;

    public Network(String name) {
        this(name, new LinkPolicyRegistry(), new InitializationDriver());
    }

    public Network(String name, LinkPolicyRegistry linkPolicies, InitializationDriver driver) {
        this.name = name;
        this.linkPolicies = linkPolicies;
        this.driver = driver;
    }

    public String name() {
        return name;
    }

    public InitializationDriver driver() {
        return driver;
    }

    public LinkPolicyRegistry linkPolicies() {
        return linkPolicies;
    }

    // ── Regions ─────────────────────────────────────────────────────

    /** Adds a region whose dimensions will be induced by its links. */
    public Region addRegion(String regionName) {
        checkNotInitialized("add region " + regionName);
        if (regions.containsKey(regionName))
            throw new IllegalArgumentException("Duplicate region name: " + regionName);
        Region region = new Region(regionName, linkPolicies);
        regions.put(regionName, region);
        return region;
    }

    public Region addRegion(String regionName, Dimensions dims) {
        Region region = addRegion(regionName);
        region.setDimensions(dims);
        return region;
    }

    /**
     * @throws IllegalArgumentException if no region has that name.
     */
    public Region getRegion(String regionName) {
        Region region = regions.get(regionName);
        if (region == null)
            throw new IllegalArgumentException("Unknown region: " + regionName);
        return region;
    }

    public Collection<Region> getRegions() {
        return Collections.unmodifiableCollection(regions.values());
    }

    /**
     * Removes a region and every link into or out of it.
     */
    public void removeRegion(String regionName) {
        checkNotInitialized("remove region " + regionName);
        Region region = getRegion(regionName);
        for (Output output : region.getOutputs())
            for (Link link : new ArrayList<>(output.getLinks()))
                link.getDestination().removeLink(link);
        for (Input input : region.getInputs())
            for (Link link : new ArrayList<>(input.getLinks()))
                input.removeLink(link);
        regions.remove(regionName);
        log.debug("Removed region {} from network {}", regionName, name);
    }

    // ── Wiring ──────────────────────────────────────────────────────

    public Link link(String srcRegion, String srcOutput, String destRegion, String destInput, String linkType,
            String linkParams) {
        checkNotInitialized("link " + srcRegion + "." + srcOutput + " to " + destRegion + "." + destInput);
        Output output = getRegion(srcRegion).getOutput(srcOutput);
        Input input = getRegion(destRegion).getInput(destInput);
        return input.addLink(linkType, linkParams, output);
    }

    /**
     * @throws IllegalArgumentException if no such link exists.
     */
    public void unlink(String srcRegion, String srcOutput, String destRegion, String destInput) {
        checkNotInitialized("unlink " + srcRegion + "." + srcOutput + " from " + destRegion + "." + destInput);
        Input input = getRegion(destRegion).getInput(destInput);
        Link link = input.findLink(srcRegion, srcOutput)
                .orElseThrow(() -> new IllegalArgumentException("No link from " + srcRegion + "." + srcOutput
                        + " to " + destRegion + "." + destInput));
        input.removeLink(link);
    }

    /** Every link in the network, grouped by destination region and input. */
    public List<Link> getLinks() {
        List<Link> all = new ArrayList<>();
        for (Region region : regions.values())
            for (Input input : region.getInputs())
                all.addAll(input.getLinks());
        return all;
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    public void initialize() {
        if (initialized)
            throw new IllegalStateException("Network " + name + " is already initialized");
        driver.initialize(regions.values());
        initialized = true;
    }

    /**
     * Returns every region to the wired state: all region flags are cleared
     * before any buffer is released, and inputs (including zero-copy aliases)
     * are released before outputs. Dimensions stay fixed.
     */
    public void uninitialize() {
        for (Region region : regions.values())
            region.clearInitialized();
        for (Region region : regions.values())
            region.uninitializeInputs();
        for (Region region : regions.values())
            region.uninitializeOutputs();
        initialized = false;
        log.debug("Network {} uninitialized", name);
    }

    public boolean isInitialized() {
        return initialized;
    }

    /** Prepares the inputs of every region, in registration order. */
    public void prepareInputs() {
        if (!initialized)
            throw new IllegalStateException("Network " + name + " is not initialized");
        for (Region region : regions.values())
            region.prepareInputs();
    }

    private void checkNotInitialized(String action) {
        if (initialized)
            throw new IllegalStateException("Cannot " + action + " while network " + name + " is initialized");
    }
}
