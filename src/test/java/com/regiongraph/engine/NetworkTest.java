package com.regiongraph.engine;

import com.regiongraph.api.Dimensions;
import com.regiongraph.api.ElementType;
import com.regiongraph.api.LinkConfigurationException;
import com.regiongraph.api.LinkConfigurationException.Reason;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class NetworkTest {

    private Network net;

    @Before
    public void setUp() {
        net = new Network("test");
        Region sensor = net.addRegion("sensor", Dimensions.of(4, 4));
        sensor.addOutput("out", ElementType.REAL32, 1);
        Region pooler = net.addRegion("pooler");
        pooler.addInput("in", ElementType.REAL32, false);
        pooler.addOutput("out", ElementType.REAL32, 1);
        Region classifier = net.addRegion("classifier");
        classifier.addInput("in", ElementType.REAL64, false);
    }

    @Test
    public void testLinkAndInitialize() {
        Link link = net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
        net.link("pooler", "out", "classifier", "in", "", "");

        net.initialize();

        assertTrue(net.isInitialized());
        assertEquals(Dimensions.of(2, 2), net.getRegion("pooler").getDimensions());
        assertEquals(Dimensions.of(2, 2), net.getRegion("classifier").getDimensions());
        assertEquals(Dimensions.of(2, 2), link.getDestDimensions());
        assertEquals(2, net.getLinks().size());
        assertEquals(2, net.driver().lastPassCount());
    }

    @Test
    public void testPrepareMovesDataAcrossTypes() {
        net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
        net.link("pooler", "out", "classifier", "in", "", "");
        net.initialize();

        Input classifierIn = net.getRegion("classifier").getInput("in");
        assertFalse("REAL32 into REAL64 needs a copy", classifierIn.isZeroCopy());
        net.getRegion("pooler").getOutput("out").getData().setAll(new double[] { 1, 2, 3, 4 });

        net.prepareInputs();

        assertArrayEquals(new double[] { 1, 2, 3, 4 }, classifierIn.getData().toDoubleArray(), 0.0);
        assertArrayEquals(new double[] { 4 }, classifierIn.getInputForNode(3), 0.0);
    }

    @Test
    public void testWiringFrozenWhileInitialized() {
        net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
        net.link("pooler", "out", "classifier", "in", "", "");
        net.initialize();

        try {
            net.unlink("sensor", "out", "pooler", "in");
            fail("Cannot unlink an initialized network");
        } catch (IllegalStateException expected) {
            assertEquals(2, net.getLinks().size());
        }
        try {
            net.addRegion("late");
            fail();
        } catch (IllegalStateException expected) {
            assertEquals(3, net.getRegions().size());
        }
        try {
            net.getRegion("pooler").getOutput("out").uninitialize();
            fail("Output buffers stay while the region is initialized");
        } catch (IllegalStateException expected) {
            assertTrue(net.getRegion("pooler").getOutput("out").isInitialized());
        }
        try {
            net.initialize();
            fail();
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("already initialized"));
        }
    }

    @Test
    public void testUninitializeAllowsRewiring() {
        net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
        net.link("pooler", "out", "classifier", "in", "", "");
        net.initialize();

        net.uninitialize();

        assertFalse(net.isInitialized());
        for (Region region : net.getRegions())
            assertFalse(region.isInitialized());
        assertFalse(net.getRegion("sensor").getOutput("out").isInitialized());
        assertEquals("Dimensions survive uninitialize", Dimensions.of(2, 2), net.getRegion("pooler").getDimensions());

        net.unlink("pooler", "out", "classifier", "in");
        assertEquals(1, net.getLinks().size());
        try {
            net.prepareInputs();
            fail();
        } catch (IllegalStateException expected) {
            assertFalse(net.isInitialized());
        }
    }

    @Test
    public void testSourceRegionCannotUninitializeUnderInitializedReader() {
        net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
        net.link("pooler", "out", "classifier", "in", "", "");
        net.initialize();
        Region sensor = net.getRegion("sensor");
        Output sensorOut = sensor.getOutput("out");
        Input poolerIn = net.getRegion("pooler").getInput("in");
        assertTrue(poolerIn.isZeroCopy());

        try {
            sensor.uninitialize();
            fail("pooler still aliases sensor.out");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("pooler"));
        }

        assertTrue("A refused uninitialize leaves the region untouched", sensor.isInitialized());
        assertTrue(sensorOut.isInitialized());
        sensorOut.getData().setDouble(2, 9.5);
        assertSame(sensorOut.getData(), poolerIn.getData());
        assertEquals(9.5, poolerIn.getData().getDouble(2), 0.0);

        net.uninitialize();
        assertFalse(sensorOut.isInitialized());
        assertFalse(poolerIn.isInitialized());
    }

    @Test
    public void testCustomLinkTypeThroughNetworkRegistry() {
        net.linkPolicies().register("Halve", raw -> net.linkPolicies().create("UniformLink", "{rfSize: 2}"));
        net.link("sensor", "out", "pooler", "in", "Halve", "");
        net.link("pooler", "out", "classifier", "in", "", "");

        net.initialize();

        assertSame(net.linkPolicies(), net.getRegion("pooler").getLinkPolicies());
        assertEquals(Dimensions.of(2, 2), net.getRegion("pooler").getDimensions());
    }

    @Test
    public void testDuplicateLink() {
        net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
        try {
            net.link("sensor", "out", "pooler", "in", "", "");
            fail();
        } catch (LinkConfigurationException e) {
            assertEquals(Reason.DUPLICATE_LINK, e.getReason());
        }
    }

    @Test
    public void testBadLinkTypeAndParams() {
        try {
            net.link("sensor", "out", "pooler", "in", "Teleport", "");
            fail();
        } catch (LinkConfigurationException e) {
            assertEquals(Reason.UNKNOWN_LINK_TYPE, e.getReason());
        }
        try {
            net.link("sensor", "out", "pooler", "in", "UniformLink", "{rfSize: }");
            fail();
        } catch (LinkConfigurationException e) {
            assertEquals(Reason.INVALID_PARAMS, e.getReason());
        }
        assertTrue("Failed links leave no trace", net.getLinks().isEmpty());
        assertFalse(net.getRegion("sensor").getOutput("out").hasOutgoingLinks());
        assertEquals(Reason.UNKNOWN_LINK_TYPE,
                assertThrows(LinkConfigurationException.class,
                        () -> net.link("sensor", "out", "classifier", "in", "Teleport", "")).getReason());
        net.link("sensor", "out", "pooler", "in", "", "");
    }

    @Test
    public void testUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> net.getRegion("nowhere"));
        assertThrows(IllegalArgumentException.class, () -> net.link("sensor", "nope", "pooler", "in", "", ""));
        assertThrows(IllegalArgumentException.class, () -> net.link("sensor", "out", "pooler", "nope", "", ""));
        assertThrows(IllegalArgumentException.class, () -> net.unlink("sensor", "out", "pooler", "in"));
        assertThrows(IllegalArgumentException.class, () -> net.addRegion("sensor"));
    }

    @Test
    public void testRemoveRegionDropsItsLinks() {
        Link in = net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
        Link out = net.link("pooler", "out", "classifier", "in", "", "");

        net.removeRegion("pooler");

        assertEquals(2, net.getRegions().size());
        assertTrue(net.getLinks().isEmpty());
        assertTrue(in.isReleased());
        assertTrue(out.isReleased());
        assertFalse(net.getRegion("sensor").getOutput("out").hasOutgoingLinks());
    }

    @Test
    public void testUnlinkThenInitializeAloneFails() {
        net.link("sensor", "out", "pooler", "in", "TestFanIn2", "");
        net.unlink("sensor", "out", "pooler", "in");

        try {
            net.initialize();
            fail("Nothing shapes pooler or classifier any more");
        } catch (LinkConfigurationException e) {
            assertEquals(Reason.UNRESOLVED_DIMENSIONS, e.getReason());
            assertTrue(e.getMessage().contains("pooler"));
        }
        assertFalse(net.isInitialized());
    }
}
