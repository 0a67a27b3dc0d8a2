package com.regiongraph.engine;

import com.regiongraph.api.DimensionConflictException;
import com.regiongraph.api.Dimensions;
import com.regiongraph.api.ElementType;
import com.regiongraph.api.LinkConfigurationException;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class LinkTest {

    private Region src;
    private Region dest;
    private Output out;
    private Input in;

    @Before
    public void setUp() {
        src = new Region("src");
        out = src.addOutput("out", ElementType.REAL32, 2);
        dest = new Region("dest");
        in = dest.addInput("in", ElementType.REAL32, false);
    }

    @Test
    public void testNewLinkIsUnresolved() {
        Link link = in.addLink("TestFanIn2", "", out);
        assertTrue(link.getSourceDimensions().isUnspecified());
        assertTrue(link.getDestDimensions().isUnspecified());
        assertFalse(link.isResolved());
        assertEquals("src.out -> dest.in [TestFanIn2]", link.toString());
    }

    @Test
    public void testSourceInducesDestination() {
        Link link = in.addLink("TestFanIn2", "", out);
        link.setSourceDimensions(Dimensions.of(4, 2));

        assertEquals(Dimensions.of(2, 1), link.getDestDimensions());
        assertTrue(link.isResolved());
        assertEquals(16, link.getContributionSize());
    }

    @Test
    public void testDestinationInducesSource() {
        Link link = in.addLink("TestFanIn2", "", out);
        link.setDestDimensions(Dimensions.of(3));

        assertEquals(Dimensions.of(6), link.getSourceDimensions());
        assertTrue(link.isResolved());
    }

    @Test
    public void testRefixingSameValueIsNoOp() {
        Link link = in.addLink("", "", out);
        link.setSourceDimensions(Dimensions.of(5));
        link.setSourceDimensions(Dimensions.of(5));
        link.setDestDimensions(Dimensions.of(5));
        assertEquals(Dimensions.of(5), link.getDestDimensions());
    }

    @Test
    public void testRefixingDifferentValueConflicts() {
        Link link = in.addLink("", "", out);
        link.setSourceDimensions(Dimensions.of(5));
        try {
            link.setSourceDimensions(Dimensions.of(6));
            fail("Source dimensions are immutable once fixed");
        } catch (DimensionConflictException e) {
            assertTrue(e.getMessage().contains("already fixed"));
        }
        try {
            link.setDestDimensions(Dimensions.of(5, 1));
            fail("Destination implied by the source cannot be overridden");
        } catch (DimensionConflictException e) {
            assertTrue(e.getMessage().contains("imply destination") || e.getMessage().contains("already fixed"));
        }
        assertEquals(Dimensions.of(5), link.getSourceDimensions());
    }

    @Test
    public void testNonStrictDestinationLeavesSourceOpen() {
        Link link = in.addLink("UniformLink", "{\"rfSize\": 2, \"strict\": false}", out);
        link.setDestDimensions(Dimensions.of(3));
        assertTrue(link.getSourceDimensions().isUnspecified());
        assertFalse(link.isResolved());

        link.setSourceDimensions(Dimensions.of(5));
        assertTrue(link.isResolved());

        Link other = dest.addInput("in2", ElementType.REAL32, false).addLink("UniformLink",
                "{\"rfSize\": 2, \"strict\": false}", out);
        other.setDestDimensions(Dimensions.of(3));
        try {
            other.setSourceDimensions(Dimensions.of(8));
            fail("[8] implies [4], not the fixed [3]");
        } catch (DimensionConflictException e) {
            assertTrue(other.getSourceDimensions().isUnspecified());
        }
    }

    @Test
    public void testRegionLevelDestinationIsDontcare() {
        Input regionLevel = dest.addInput("reset", ElementType.REAL32, true);
        Link link = regionLevel.addLink("", "", out);
        assertTrue(link.getDestDimensions().isDontcare());
        assertFalse(link.isResolved());

        link.setSourceDimensions(Dimensions.of(3));
        assertTrue(link.isResolved());
        assertTrue(link.getDestDimensions().isDontcare());

        try {
            link.setDestDimensions(Dimensions.of(3));
            fail("A region-level link has no destination shape");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("region-level"));
        }
    }

    @Test
    public void testSplitterMapExpandsNodesToElements() {
        Link link = in.addLink("TestFanIn2", "", out);
        link.setSourceDimensions(Dimensions.of(4));

        int[][] map = link.getSplitterMap(2);
        // two elements per source node: dest 0 reads source nodes 0, 1
        assertArrayEquals(new int[] { 0, 1, 2, 3 }, map[0]);
        assertArrayEquals(new int[] { 4, 5, 6, 7 }, map[1]);

        map[0][0] = 42;
        assertEquals(0, link.getSplitterMap(2)[0][0]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSplitterMapNodeCountMismatch() {
        Link link = in.addLink("TestFanIn2", "", out);
        link.setSourceDimensions(Dimensions.of(4));
        link.getSplitterMap(3);
    }

    @Test(expected = IllegalStateException.class)
    public void testSplitterMapBeforeResolution() {
        in.addLink("TestFanIn2", "", out).getSplitterMap(2);
    }

    @Test(expected = LinkConfigurationException.class)
    public void testConstructionValidatesType() {
        in.addLink("Bogus", "", out);
    }
}
