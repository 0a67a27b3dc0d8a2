package com.regiongraph.util;

import com.regiongraph.engine.Input;
import com.regiongraph.engine.Link;
import com.regiongraph.engine.Network;
import com.regiongraph.engine.Output;
import com.regiongraph.engine.Region;

import java.util.Arrays;

/**
 * Diagnostic utility for inspecting network wiring and negotiated layout.
 *
 * <p>
 * Generates human-readable text for regions, their ports, links, offsets and
 * zero-copy decisions.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error reports.
 * Do <b>not</b> use per cycle (allocates strings, iterates collections).
 */
public final class NetworkExplain {
    private final Network network;

    public NetworkExplain(Network network) {
        this.network = network;
    }

    /**
     * Dumps every region with its dimensions, outputs, inputs and links.
     */
    public String dumpNetwork() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Network ").append(network.name()).append(" (").append(network.getRegions().size())
                .append(" regions, ").append(network.isInitialized() ? "initialized" : "not initialized")
                .append("):\n");
        for (Region region : network.getRegions())
            appendRegion(sb, region);
        return sb.toString();
    }

    /**
     * Dumps a single region.
     */
    public String explainRegion(String regionName) {
        StringBuilder sb = new StringBuilder(256);
        appendRegion(sb, network.getRegion(regionName));
        return sb.toString();
    }

    /**
     * Dumps the splitter map of an initialized, node-level input.
     */
    public String explainSplitterMap(String regionName, String inputName) {
        Input input = network.getRegion(regionName).getInput(inputName);
        return "Splitter map of " + input.fullName() + ":\n" + input.getSplitterMap();
    }

    private static void appendRegion(StringBuilder sb, Region region) {
        sb.append("  ").append(region.getName()).append(' ').append(region.getDimensions()).append('\n');
        for (Output output : region.getOutputs()) {
            sb.append("    out ").append(output.getName()).append(" (").append(output.getElementType())
                    .append(" x ").append(output.getNodeElementCount()).append("/node, ")
                    .append(output.getLinks().size()).append(" readers)\n");
        }
        for (Input input : region.getInputs()) {
            sb.append("    in  ").append(input.getName()).append(" (").append(input.getElementType());
            if (input.isRegionLevel())
                sb.append(", region-level");
            if (input.isInitialized()) {
                sb.append(", size ").append(input.getSize())
                        .append(", offsets ").append(Arrays.toString(input.getOffsets()));
                if (input.isZeroCopy())
                    sb.append(", zero-copy");
            }
            sb.append(")\n");
            for (Link link : input.getLinks()) {
                sb.append("      <- ").append(link.getSource().fullName())
                        .append(" [").append(link.getLinkType());
                if (!link.getLinkParams().isBlank())
                    sb.append(' ').append(link.getLinkParams());
                sb.append("] ")
                        .append(link.getSourceDimensions()).append(" => ").append(link.getDestDimensions());
                if (!link.isResolved())
                    sb.append(" (unresolved)");
                sb.append('\n');
            }
        }
    }
}
