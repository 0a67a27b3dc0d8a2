package com.regiongraph.engine;

import com.regiongraph.api.Array;
import com.regiongraph.api.ElementType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * A named data-producing port of a region.
 *
 * The Output owns the buffer its region writes each cycle:
 * {@code nodeCount * nodeElementCount} elements, node-major. It does not own
 * any Link. It keeps only (Input, link id) handles so it can enumerate the
 * links reading from it; the Input that owns a link is the only place the
 * Link object lives.
 */
public final class Output {
    @Getter
    private final Region region;
    @Getter
    private final String name;
    @Getter
    private final ElementType elementType;
    @Getter
    private final int nodeElementCount;

    private final List<LinkRef> links = new ArrayList<>();
    private Array data;

    /** Non-owning handle to a link held by {@code input}. */
    private record LinkRef(Input input, int linkId) {
    }

    public Output(Region region, String name, ElementType elementType, int nodeElementCount) {
        if (nodeElementCount <= 0)
            throw new IllegalArgumentException(
                    "Output " + name + " needs a positive element count per node, got " + nodeElementCount);
        this.region = region;
        this.name = name;
        this.elementType = elementType;
        this.nodeElementCount = nodeElementCount;
    }

    /** Registers a handle to a link that reads from this output. */
    public void addLink(Link link) {
        if (link.getSource() != this)
            throw new IllegalArgumentException("Link " + link + " does not read from output " + fullName());
        links.add(new LinkRef(link.getDestination(), link.getId()));
    }

    /** Drops the handle of a link; unknown links are ignored. */
    public void removeLink(Link link) {
        links.removeIf(ref -> ref.input() == link.getDestination() && ref.linkId() == link.getId());
    }

    /**
     * @return The links reading from this output. No order is promised.
     */
    public List<Link> getLinks() {
        List<Link> out = new ArrayList<>(links.size());
        for (LinkRef ref : links)
            ref.input().linkById(ref.linkId()).ifPresent(out::add);
        return Collections.unmodifiableList(out);
    }

    public boolean hasOutgoingLinks() {
        return !links.isEmpty();
    }

    /**
     * Allocates the buffer once the region's dimensions are known. Calling it
     * again while initialized does nothing.
     */
    public void initialize() {
        if (data != null)
            return;
        if (!region.getDimensions().isSpecified()) {
            throw new IllegalStateException(
                    "Cannot initialize output " + fullName() + ": region dimensions are not specified");
        }
        data = new Array(elementType, Math.multiplyExact(region.getNodeCount(), nodeElementCount));
    }

    /**
     * Releases the buffer.
     *
     * @throws IllegalStateException if the owning region, or the region of any
     *                               input reading this output, is initialized.
     */
    public void uninitialize() {
        if (region.isInitialized())
            throw new IllegalStateException("Cannot uninitialize output " + fullName() + " of an initialized region");
        requireNoInitializedReader();
        data = null;
    }

    /**
     * An initialized reader may alias this buffer (zero-copy) or copy from it
     * on its next prepare, so the buffer must outlive it.
     */
    void requireNoInitializedReader() {
        for (LinkRef ref : links) {
            Region reader = ref.input().getRegion();
            if (reader != region && reader.isInitialized()) {
                throw new IllegalStateException("Cannot uninitialize output " + fullName() + ": region "
                        + reader.getName() + " still reads it");
            }
        }
    }

    public boolean isInitialized() {
        return data != null;
    }

    /**
     * The buffer the owning region writes between cycles.
     *
     * @throws IllegalStateException if the output is not initialized.
     */
    public Array getData() {
        if (data == null)
            throw new IllegalStateException("Output " + fullName() + " is not initialized");
        return data;
    }

    /** "region.output", used in diagnostics. */
    public String fullName() {
        return region.getName() + "." + name;
    }

    @Override
    public String toString() {
        return "Output[" + fullName() + ", " + elementType + " x " + nodeElementCount + "/node]";
    }
}
