package com.regiongraph.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class SplitterMapTest {

    @Test
    public void testAddAllShiftsByOffset() {
        SplitterMap map = SplitterMap.builder(2)
                .addAll(new int[][] { { 0, 1 }, { 2, 3 } }, 0)
                .addAll(new int[][] { { 0 }, { 1 } }, 4)
                .build();

        assertEquals(2, map.getNodeCount());
        assertArrayEquals(new int[] { 0, 1, 4 }, map.getIndices(0));
        assertArrayEquals(new int[] { 2, 3, 5 }, map.getIndices(1));
        assertEquals(3, map.getElementCount(1));
        assertEquals(5, map.indexAt(1, 2));
    }

    @Test
    public void testValueEquality() {
        SplitterMap a = SplitterMap.builder(1).add(0, 3).add(0, 4).build();
        SplitterMap b = SplitterMap.builder(1).add(0, 3).add(0, 4).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, SplitterMap.builder(1).add(0, 4).add(0, 3).build());
    }

    @Test
    public void testIndicesAreDefensiveCopies() {
        SplitterMap map = SplitterMap.builder(1).add(0, 7).build();
        map.getIndices(0)[0] = 99;
        assertEquals(7, map.indexAt(0, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeCountMismatch() {
        SplitterMap.builder(2).addAll(new int[][] { { 0 } }, 0);
    }
}
