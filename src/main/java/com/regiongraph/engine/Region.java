package com.regiongraph.engine;

import com.regiongraph.api.DimensionConflictException;
import com.regiongraph.api.Dimensions;
import com.regiongraph.api.ElementType;
import com.regiongraph.link.LinkPolicyRegistry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * A computation node exposing named inputs and outputs over a grid of nodes.
 *
 * This class is the boundary the wiring core talks to: it owns the dimensions
 * that links negotiate, owns its ports, and reports the initialized flag that
 * guards every wiring mutation. What a region computes each cycle is up to the
 * code that reads its inputs and writes its outputs.
 */
@Log4j2
public class Region {
    @Getter
    private final String name;
    @Getter
    private final LinkPolicyRegistry linkPolicies;

    private final Map<String, Input> inputs = new LinkedHashMap<>();
    private final Map<String, Output> outputs = new LinkedHashMap<>();
    private Dimensions dimensions = Dimensions.UNSPECIFIED;
    private boolean initialized;

    public Region(String name) {
        this(name, new LinkPolicyRegistry());
    }

    public Region(String name, LinkPolicyRegistry linkPolicies) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Region name must not be empty");
        this.name = name;
        this.linkPolicies = linkPolicies;
    }

    // ── Ports ───────────────────────────────────────────────────────

    public Input addInput(String inputName, ElementType type, boolean regionLevel) {
        checkNotInitialized("add input " + inputName);
        if (inputs.containsKey(inputName))
            throw new IllegalArgumentException("Duplicate input " + inputName + " on region " + name);
        Input input = new Input(this, type, regionLevel);
        input.setName(inputName);
        inputs.put(inputName, input);
        return input;
    }

    public Output addOutput(String outputName, ElementType type, int nodeElementCount) {
        checkNotInitialized("add output " + outputName);
        if (outputs.containsKey(outputName))
            throw new IllegalArgumentException("Duplicate output " + outputName + " on region " + name);
        Output output = new Output(this, outputName, type, nodeElementCount);
        outputs.put(outputName, output);
        return output;
    }

    /**
     * @throws IllegalArgumentException if the region has no such input.
     */
    public Input getInput(String inputName) {
        Input input = inputs.get(inputName);
        if (input == null)
            throw new IllegalArgumentException("Unknown input " + inputName + " on region " + name);
        return input;
    }

    /**
     * @throws IllegalArgumentException if the region has no such output.
     */
    public Output getOutput(String outputName) {
        Output output = outputs.get(outputName);
        if (output == null)
            throw new IllegalArgumentException("Unknown output " + outputName + " on region " + name);
        return output;
    }

    public Collection<Input> getInputs() {
        return Collections.unmodifiableCollection(inputs.values());
    }

    public Collection<Output> getOutputs() {
        return Collections.unmodifiableCollection(outputs.values());
    }

    // ── Dimensions ──────────────────────────────────────────────────

    public Dimensions getDimensions() {
        return dimensions;
    }

    /**
     * Sets (or induces) the region's dimensions. Setting the current value
     * again is a no-op.
     *
     * @throws DimensionConflictException if different dimensions are already
     *                                    set.
     * @throws IllegalStateException      if the region is initialized and the
     *                                    value differs.
     */
    public void setDimensions(Dimensions dims) {
        if (dims == null || !dims.isSpecified())
            throw new IllegalArgumentException("Region " + name + " needs specified dimensions, got " + dims);
        if (dims.equals(dimensions))
            return;
        checkNotInitialized("change dimensions");
        if (dimensions.isSpecified()) {
            throw new DimensionConflictException(
                    "Region " + name + " has dimensions " + dimensions + ", cannot set " + dims);
        }
        dimensions = dims;
        log.debug("Region {} dimensions set to {}", name, dims);
    }

    /**
     * @throws IllegalStateException if the dimensions are not specified yet.
     */
    public int getNodeCount() {
        if (!dimensions.isSpecified())
            throw new IllegalStateException("Region " + name + " has no dimensions yet");
        return dimensions.getCount();
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    /**
     * One resolution step over every input.
     *
     * @return The number of unresolved links into this region.
     */
    public int evaluateLinks() {
        int unresolved = 0;
        for (Input input : inputs.values())
            unresolved += input.evaluateLinks();
        return unresolved;
    }

    public void initializeOutputs() {
        for (Output output : outputs.values())
            output.initialize();
    }

    public void initializeInputs() {
        for (Input input : inputs.values())
            input.initialize();
    }

    void markInitialized() {
        initialized = true;
        log.debug("Region {} initialized with dimensions {}", name, dimensions);
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Clears the initialized flag and releases every input buffer, then every
     * output buffer. Dimensions and links are kept. Nothing changes if a
     * region reading one of the outputs is still initialized.
     *
     * @throws IllegalStateException if an initialized region reads one of this
     *                               region's outputs.
     */
    public void uninitialize() {
        for (Output output : outputs.values())
            output.requireNoInitializedReader();
        clearInitialized();
        uninitializeInputs();
        uninitializeOutputs();
    }

    void clearInitialized() {
        initialized = false;
    }

    void uninitializeInputs() {
        for (Input input : inputs.values())
            input.uninitialize();
    }

    void uninitializeOutputs() {
        for (Output output : outputs.values())
            output.uninitialize();
    }

    /** Prepares every input for this cycle. */
    public void prepareInputs() {
        for (Input input : inputs.values())
            input.prepare();
    }

    private void checkNotInitialized(String action) {
        if (initialized)
            throw new IllegalStateException("Cannot " + action + " on initialized region " + name);
    }

    @Override
    public String toString() {
        return "Region[" + name + " " + dimensions + "]";
    }
}
