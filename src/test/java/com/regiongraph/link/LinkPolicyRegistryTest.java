package com.regiongraph.link;

import com.regiongraph.api.Dimensions;
import com.regiongraph.api.LinkConfigurationException;
import com.regiongraph.api.LinkConfigurationException.Reason;
import com.regiongraph.api.LinkPolicy;

import org.junit.Test;

import static org.junit.Assert.*;

public class LinkPolicyRegistryTest {

    private final LinkPolicyRegistry registry = new LinkPolicyRegistry();

    @Test
    public void testBuiltInsRegistered() {
        assertTrue(registry.contains("UniformLink"));
        assertTrue(registry.contains("TestFanIn2"));
        assertTrue(registry.contains("Transpose"));
        assertTrue("Empty type selects the default", registry.contains(""));
        assertEquals(3, registry.linkTypes().size());
    }

    @Test
    public void testEmptyTypeIsUniformLink() {
        LinkPolicy policy = registry.create("", "");
        assertEquals(UniformLinkPolicy.NAME, policy.name());
        assertEquals(Dimensions.of(3, 3), policy.destDimensionsFor(Dimensions.of(3, 3)));
    }

    @Test
    public void testUnknownType() {
        try {
            registry.create("NoSuchLink", "");
            fail("Should reject an unknown link type");
        } catch (LinkConfigurationException e) {
            assertEquals(Reason.UNKNOWN_LINK_TYPE, e.getReason());
            assertTrue(e.getMessage().contains("NoSuchLink"));
        }
    }

    @Test
    public void testUnparsableParams() {
        assertInvalid("UniformLink", "{mapping: ");
        assertInvalid("UniformLink", "[1, 2]");
        assertInvalid("UniformLink", "null");
        assertInvalid("UniformLink", "{mapping: 'out', rfSize: [2]} }}} not json");
        assertInvalid("UniformLink", "{\"rfSize\": 2} {\"rfSize\": 3}");
    }

    @Test
    public void testRepeatedKeyRejected() {
        assertInvalid("UniformLink", "{rfSize: 2, rfSize: 3}");
    }

    @Test
    public void testUnknownParamKey() {
        assertInvalid("UniformLink", "{\"span\": 2}");
    }

    @Test
    public void testWrongParamShape() {
        assertInvalid("UniformLink", "{\"mapping\": \"sideways\"}");
        assertInvalid("UniformLink", "{\"rfSize\": [2, 0]}");
        assertInvalid("UniformLink", "{\"rfSize\": \"two\"}");
        assertInvalid("UniformLink", "{\"strict\": \"yes\"}");
        assertInvalid("UniformLink", "{\"mapping\": \"out\", \"strict\": false}");
    }

    @Test
    public void testParameterlessPoliciesRejectParams() {
        assertInvalid("TestFanIn2", "{\"rfSize\": 2}");
        assertInvalid("Transpose", "{\"x\": 1}");
        assertNotNull(registry.create("TestFanIn2", "{}"));
    }

    @Test
    public void testRelaxedJsonAccepted() {
        LinkPolicy policy = registry.create("UniformLink", "{mapping: 'in', rfSize: [2, 1], strict: true}");
        assertEquals(Dimensions.of(2, 3), policy.destDimensionsFor(Dimensions.of(4, 3)));
    }

    @Test
    public void testCustomPolicyRegistration() {
        registry.register("Identity", raw -> new UniformLinkPolicy(UniformLinkPolicy.Mapping.IN, new int[] { 1 }, true));
        assertTrue(registry.contains("Identity"));
        assertEquals(Dimensions.of(5), registry.create("Identity", "ignored").destDimensionsFor(Dimensions.of(5)));
    }

    private void assertInvalid(String type, String params) {
        try {
            registry.create(type, params);
            fail("Should reject parameters " + params + " for " + type);
        } catch (LinkConfigurationException e) {
            assertEquals(Reason.INVALID_PARAMS, e.getReason());
        }
    }
}
