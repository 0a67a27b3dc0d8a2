package com.regiongraph.engine;

import com.regiongraph.api.Array;
import com.regiongraph.api.DimensionConflictException;
import com.regiongraph.api.Dimensions;
import com.regiongraph.api.ElementType;
import com.regiongraph.api.LinkConfigurationException;
import com.regiongraph.api.LinkConfigurationException.Reason;
import com.regiongraph.api.ReadableArray;
import com.regiongraph.api.SplitterMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * A named data-consuming port of a region (e.g. bottomUpIn).
 *
 * <p>
 * An Input owns an ordered list of {@link Link}s and concatenates their
 * contributions into one buffer. Link order is declaration order and is
 * observable: link i's contribution starts at {@code offsets[i]}, and the
 * splitter map lists link i's elements before link i+1's.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Wiring: {@link #addLink}, {@link #removeLink} while uninitialized.</li>
 * <li>Negotiation: {@link #evaluateLinks()} is called repeatedly by the
 * network driver until every input in the graph reports zero unresolved
 * links.</li>
 * <li>{@link #initialize()} fixes offsets and the buffer. With exactly one
 * link whose output has this input's element type and whose policy does not
 * reindex, the buffer is the source output's buffer itself (zero-copy).</li>
 * <li>{@link #prepare()} once per cycle, then region code reads
 * {@link #getData()} / {@link #getSplitterMap()}.</li>
 * </ol>
 *
 * Single-threaded: no method here synchronizes.
 */
@Log4j2
public final class Input {
    private final Region region;
    private final ElementType elementType;
    private final boolean regionLevel;
    private String name;

    // Owning container; order is load-bearing.
    private final List<Link> links = new ArrayList<>();
    private int nextLinkId;

    private boolean initialized;
    private boolean zeroCopy;
    // Either the owned copy target or, under zero-copy, the source output's
    // buffer. Never both.
    private Array data;
    private int[] offsets = new int[0];
    private int size;

    // null means invalid; rebuilt on demand.
    private SplitterMap splitterMap;

    public Input(Region region, ElementType elementType, boolean regionLevel) {
        this.region = region;
        this.elementType = elementType;
        this.regionLevel = regionLevel;
    }

    /** Inputs need to know their own name for error messages. */
    public void setName(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** "region.input", used in diagnostics. */
    public String fullName() {
        return region.getName() + "." + name;
    }

    public Region getRegion() {
        return region;
    }

    public ElementType getElementType() {
        return elementType;
    }

    /**
     * A region-level input feeds the region as a whole rather than its nodes.
     * Its links impose no shape on the region and it has no splitter map.
     */
    public boolean isRegionLevel() {
        return regionLevel;
    }

    // ── Wiring ──────────────────────────────────────────────────────

    /**
     * Creates a link from {@code sourceOutput}, appends it and registers it
     * with the output.
     *
     * @return The new link, owned by this input.
     * @throws IllegalStateException      if this input or its region is
     *                                    initialized.
     * @throws LinkConfigurationException if the link type or parameters are
     *                                    invalid or the output is already
     *                                    linked here.
     */
    public Link addLink(String linkType, String linkParams, Output sourceOutput) {
        if (initialized || region.isInitialized())
            throw new IllegalStateException("Cannot add a link to initialized input " + fullName());
        if (sourceOutput == null)
            throw new IllegalArgumentException("Source output is required for a link into " + fullName());
        if (findLink(sourceOutput.getRegion().getName(), sourceOutput.getName()).isPresent()) {
            throw new LinkConfigurationException(Reason.DUPLICATE_LINK,
                    "Link from " + sourceOutput.fullName() + " to " + fullName() + " already exists");
        }

        Link link = new Link(nextLinkId, linkType, linkParams, region.getLinkPolicies(), sourceOutput, this);
        nextLinkId++;
        links.add(link);
        sourceOutput.addLink(link);
        invalidateSplitterMap();
        log.debug("Added link {}", link);
        return link;
    }

    /**
     * @return The link from the named source output, or empty.
     */
    public Optional<Link> findLink(String sourceRegionName, String sourceOutputName) {
        for (Link link : links) {
            Output src = link.getSource();
            if (src.getRegion().getName().equals(sourceRegionName) && src.getName().equals(sourceOutputName))
                return Optional.of(link);
        }
        return Optional.empty();
    }

    /**
     * Detaches {@code link} from this input and its source output and releases
     * it. Any later use of the released Link object throws
     * IllegalStateException. Uninitializes this input first.
     *
     * @throws IllegalStateException    if the owning region is initialized.
     * @throws IllegalArgumentException if this input does not own the link.
     */
    public void removeLink(Link link) {
        if (region.isInitialized())
            throw new IllegalStateException("Cannot remove a link from input " + fullName() + " of an initialized region");
        if (link == null || link.getDestination() != this || !links.contains(link))
            throw new IllegalArgumentException("Link " + link + " does not belong to input " + fullName());

        uninitialize();
        links.remove(link);
        link.getSource().removeLink(link);
        link.release();
        invalidateSplitterMap();
        log.debug("Removed link {}", link);
    }

    /** Unmodifiable, in declaration order. */
    public List<Link> getLinks() {
        return Collections.unmodifiableList(links);
    }

    Optional<Link> linkById(int id) {
        for (Link link : links) {
            if (link.getId() == id)
                return Optional.of(link);
        }
        return Optional.empty();
    }

    // ── Negotiation ─────────────────────────────────────────────────

    /**
     * One dimension resolution step for this input.
     *
     * <p>
     * For every link, the destination side is fixed first when this region's
     * shape is known, which may induce the link's source shape. The link's
     * source shape then induces (or is checked against) the source region; or,
     * if the link's source is still open, the source region's shape fixes it.
     * Finally every link's implied destination shape must agree, and the agreed
     * shape induces (or is checked against) this region's dimensions.
     *
     * @return The number of links still unresolved; 0 means this input is done.
     * @throws DimensionConflictException on any irreconcilable shape.
     */
    public int evaluateLinks() {
        int unresolved = 0;
        Dimensions implied = Dimensions.UNSPECIFIED;
        Link impliedBy = null;

        for (Link link : links) {
            Dimensions regionDims = region.getDimensions();
            if (!regionLevel && regionDims.isSpecified() && link.getDestDimensions().isUnspecified())
                link.setDestDimensions(regionDims);

            Region srcRegion = link.getSource().getRegion();
            if (link.getSourceDimensions().isSpecified()) {
                srcRegion.setDimensions(link.getSourceDimensions());
            } else if (srcRegion.getDimensions().isSpecified()) {
                link.setSourceDimensions(srcRegion.getDimensions());
            }

            if (!link.isResolved())
                unresolved++;

            Dimensions d = link.getDestDimensions();
            if (regionLevel || !d.isSpecified())
                continue;
            if (impliedBy == null) {
                implied = d;
                impliedBy = link;
            } else if (!implied.equals(d)) {
                throw new DimensionConflictException("Input " + fullName() + ": link " + impliedBy + " implies "
                        + implied + " but link " + link + " implies " + d);
            }
        }

        if (impliedBy != null)
            region.setDimensions(implied);
        return unresolved;
    }

    // ── Buffer lifecycle ────────────────────────────────────────────

    /**
     * Fixes offsets and the input buffer.
     *
     * @throws IllegalStateException if already initialized, if a link is
     *                               unresolved, or if a source output has no
     *                               buffer yet.
     */
    public void initialize() {
        if (initialized)
            throw new IllegalStateException("Input " + fullName() + " is already initialized");
        for (Link link : links) {
            if (!link.isResolved())
                throw new IllegalStateException("Cannot initialize input " + fullName() + ": link " + link + " is unresolved");
            if (!link.getSource().isInitialized())
                throw new IllegalStateException("Cannot initialize input " + fullName() + ": source output "
                        + link.getSource().fullName() + " is not initialized");
        }

        int[] linkOffsets = new int[links.size()];
        int count = 0;
        for (int i = 0; i < links.size(); i++) {
            linkOffsets[i] = count;
            count = Math.addExact(count, links.get(i).getContributionSize());
        }

        offsets = linkOffsets;
        size = count;
        if (isZeroCopyEligible()) {
            data = links.get(0).getSource().getData();
            zeroCopy = true;
            log.debug("Input {} aliases {} (zero-copy, {} elements)", fullName(), links.get(0).getSource().fullName(), size);
        } else {
            data = new Array(elementType, size);
            zeroCopy = false;
        }
        invalidateSplitterMap();
        initialized = true;
    }

    private boolean isZeroCopyEligible() {
        if (links.size() != 1)
            return false;
        Link only = links.get(0);
        return only.getSource().getElementType() == elementType && !only.getPolicy().requiresReindexing();
    }

    public boolean isInitialized() {
        return initialized;
    }

    /** Whether the buffer is an alias of the sole source output's buffer. */
    public boolean isZeroCopy() {
        return zeroCopy;
    }

    /**
     * Releases the buffer (or drops the alias) and the splitter map. Links are
     * untouched. A no-op on an uninitialized input.
     *
     * @throws IllegalStateException if the owning region is initialized.
     */
    public void uninitialize() {
        if (region.isInitialized())
            throw new IllegalStateException("Cannot uninitialize input " + fullName() + " of an initialized region");
        invalidateSplitterMap();
        if (!initialized)
            return;
        data = null;
        zeroCopy = false;
        offsets = new int[0];
        size = 0;
        initialized = false;
    }

    /**
     * Makes this cycle's input available: copies each link's contribution into
     * the buffer at its offset, in declaration order. Does nothing under
     * zero-copy.
     *
     * @throws IllegalStateException if not initialized.
     */
    public void prepare() {
        if (!initialized)
            throw new IllegalStateException("Cannot prepare uninitialized input " + fullName());
        if (zeroCopy)
            return;
        for (int i = 0; i < links.size(); i++)
            links.get(i).copyInto(data, offsets[i]);
    }

    /**
     * @throws IllegalStateException if not initialized.
     */
    public ReadableArray getData() {
        if (!initialized)
            throw new IllegalStateException("Input " + fullName() + " is not initialized");
        return data;
    }

    /** Start of each link's contribution; empty before initialization. */
    public int[] getOffsets() {
        return offsets.clone();
    }

    /** Total element count of the buffer; 0 before initialization. */
    public int getSize() {
        return size;
    }

    // ── Splitter map ────────────────────────────────────────────────

    /**
     * Maps each node of this region to the buffer indices it reads. Built on
     * first request after initialization and cached until the next wiring
     * change or uninitialize.
     *
     * @throws IllegalStateException if not initialized or region-level.
     */
    public SplitterMap getSplitterMap() {
        if (!initialized)
            throw new IllegalStateException("Splitter map requested from uninitialized input " + fullName());
        if (regionLevel)
            throw new IllegalStateException("Region-level input " + fullName() + " has no splitter map");
        if (splitterMap == null) {
            int nodeCount = region.getNodeCount();
            SplitterMap.Builder builder = SplitterMap.builder(nodeCount);
            for (int i = 0; i < links.size(); i++)
                builder.addAll(links.get(i).splitterMap(nodeCount), offsets[i]);
            splitterMap = builder.build();
        }
        return splitterMap;
    }

    /**
     * Gathers the elements node {@code nodeIndex} reads, in splitter map
     * order.
     */
    public double[] getInputForNode(int nodeIndex) {
        SplitterMap map = getSplitterMap();
        if (nodeIndex < 0 || nodeIndex >= map.getNodeCount())
            throw new IndexOutOfBoundsException("Node " + nodeIndex + " outside region " + region.getName());
        double[] out = new double[map.getElementCount(nodeIndex)];
        for (int i = 0; i < out.length; i++)
            out[i] = data.getDouble(map.indexAt(nodeIndex, i));
        return out;
    }

    /** Drops the cached splitter map. Every wiring change calls this. */
    public void invalidateSplitterMap() {
        splitterMap = null;
    }

    boolean hasCachedSplitterMap() {
        return splitterMap != null;
    }

    @Override
    public String toString() {
        return "Input[" + fullName() + ", " + elementType + (regionLevel ? ", region-level" : "") + ", links="
                + links.size() + "]";
    }
}
