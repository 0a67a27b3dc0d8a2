package com.regiongraph.engine;

import com.regiongraph.api.Dimensions;
import com.regiongraph.api.InitializationListener;
import com.regiongraph.api.LinkConfigurationException;
import com.regiongraph.api.LinkConfigurationException.Reason;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Drives the two-phase network initialization protocol.
 *
 * <p>
 * Phase 1, dimension fixed point:
 * Every pass calls {@link Input#evaluateLinks()} on every input of every
 * region, in region order then input order. A pass can induce dimensions on
 * regions several links away, so passes repeat until one ends with zero
 * unresolved links and no region dimensions changed during it. The loop is
 * bounded twice: a pass that changes nothing while links are still
 * unresolved can never make progress, and {@code maxPasses} caps the total.
 * Either way the failure names every unresolved link.
 *
 * <p>
 * Phase 2, buffer finalization:
 * All outputs are initialized first (inputs need their sources' buffers to
 * size themselves and to alias under zero-copy), then all inputs, then every
 * region is marked initialized. If anything in phase 2 throws, every region
 * is rolled back to uninitialized before the error propagates.
 *
 * <p>
 * Single-threaded and non-reentrant, like everything it drives.
 */
@Log4j2
public final class InitializationDriver {
    public static final int DEFAULT_MAX_PASSES = 100;

    private final int maxPasses;
    private InitializationListener listener;
    private int lastPassCount;

    public InitializationDriver() {
        this(DEFAULT_MAX_PASSES);
    }

    public InitializationDriver(int maxPasses) {
        if (maxPasses < 1)
            throw new IllegalArgumentException("maxPasses must be positive, got " + maxPasses);
        this.maxPasses = maxPasses;
    }

    public void setListener(InitializationListener listener) {
        this.listener = listener;
    }

    public int maxPasses() {
        return maxPasses;
    }

    /** Passes the last successful or failed resolution took. */
    public int lastPassCount() {
        return lastPassCount;
    }

    /**
     * Runs both phases.
     *
     * @throws LinkConfigurationException  UNRESOLVED_DIMENSIONS if negotiation
     *                                     does not converge.
     * @throws com.regiongraph.api.DimensionConflictException if shapes
     *                                     conflict anywhere in the graph.
     */
    public void initialize(Collection<Region> regions) {
        int passes;
        try {
            passes = resolveDimensions(regions);
        } catch (RuntimeException e) {
            fail(lastPassCount, e);
            throw e;
        }

        try {
            for (Region region : regions)
                region.initializeOutputs();
            for (Region region : regions)
                region.initializeInputs();
        } catch (RuntimeException e) {
            for (Region region : regions)
                region.uninitialize();
            fail(passes, e);
            throw e;
        }

        for (Region region : regions)
            region.markInitialized();
        log.info("Initialized {} regions after {} resolution passes", regions.size(), passes);
        if (listener != null)
            listener.onInitialized(passes);
    }

    /**
     * Phase 1 alone: repeats resolution passes to the fixed point.
     *
     * @return The number of passes taken.
     */
    public int resolveDimensions(Collection<Region> regions) {
        Map<String, Dimensions> before = snapshot(regions);
        int previousUnresolved = -1;

        for (int pass = 1; pass <= maxPasses; pass++) {
            lastPassCount = pass;
            if (listener != null)
                listener.onPassStart(pass);

            int unresolved = 0;
            for (Region region : regions)
                unresolved += region.evaluateLinks();

            if (listener != null)
                listener.onPassEnd(pass, unresolved);
            log.debug("Resolution pass {}: {} unresolved links", pass, unresolved);

            Map<String, Dimensions> after = snapshot(regions);
            boolean changed = !after.equals(before);
            if (unresolved == 0 && !changed) {
                requireAllDimensioned(regions);
                return pass;
            }
            if (!changed && unresolved == previousUnresolved) {
                throw unresolved(regions, "no progress after pass " + pass);
            }
            before = after;
            previousUnresolved = unresolved;
        }
        throw unresolved(regions, "no fixed point within " + maxPasses + " passes");
    }

    private void requireAllDimensioned(Collection<Region> regions) {
        List<String> missing = regions.stream()
                .filter(r -> !r.getDimensions().isSpecified())
                .map(Region::getName)
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new LinkConfigurationException(Reason.UNRESOLVED_DIMENSIONS,
                    "Dimensions could not be determined for regions: " + String.join(", ", missing));
        }
    }

    private LinkConfigurationException unresolved(Collection<Region> regions, String why) {
        List<String> ports = new ArrayList<>();
        for (Region region : regions)
            for (Input input : region.getInputs())
                for (Link link : input.getLinks())
                    if (!link.isResolved())
                        ports.add(link.toString());
        return new LinkConfigurationException(Reason.UNRESOLVED_DIMENSIONS,
                "Dimension negotiation failed (" + why + "); unresolved links: " + String.join(", ", ports));
    }

    private void fail(int pass, RuntimeException e) {
        log.warn("Network initialization failed at pass {}: {}", pass, e.getMessage());
        if (listener != null)
            listener.onFailure(pass, e);
    }

    private static Map<String, Dimensions> snapshot(Collection<Region> regions) {
        Map<String, Dimensions> dims = new LinkedHashMap<>(regions.size() * 2);
        for (Region region : regions)
            dims.put(region.getName(), region.getDimensions());
        return dims;
    }
}
