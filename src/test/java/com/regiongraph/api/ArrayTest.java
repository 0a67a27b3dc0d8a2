package com.regiongraph.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class ArrayTest {

    @Test
    public void testSameTypeCopyAtOffset() {
        Array src = new Array(ElementType.REAL32, 3);
        src.setAll(new double[] { 1.5, 2.5, 3.5 });
        Array dest = new Array(ElementType.REAL32, 5);

        dest.copyFrom(src, 0, 2, 3);

        assertArrayEquals(new double[] { 0, 0, 1.5, 2.5, 3.5 }, dest.toDoubleArray(), 0.0);
    }

    @Test
    public void testIntegerToRealConversion() {
        Array src = new Array(ElementType.INT32, 2);
        src.setLong(0, 7);
        src.setLong(1, -3);
        Array dest = new Array(ElementType.REAL64, 2);

        dest.copyFrom(src, 0, 0, 2);

        assertEquals(7.0, dest.getDouble(0), 0.0);
        assertEquals(-3.0, dest.getDouble(1), 0.0);
    }

    @Test
    public void testIntegerWideningKeepsLargeValues() {
        Array src = new Array(ElementType.INT64, 1);
        src.setLong(0, 1L << 40);
        Array dest = new Array(ElementType.INT64, 1);
        dest.copyFrom(src, 0, 0, 1);
        assertEquals(1L << 40, dest.getLong(0));

        Array narrow = new Array(ElementType.INT16, 1);
        Array wide = new Array(ElementType.INT64, 1);
        narrow.setLong(0, -1234);
        wide.copyFrom(narrow, 0, 0, 1);
        assertEquals(-1234L, wide.getLong(0));
    }

    @Test
    public void testCopyNodesGathersBlocks() {
        Array src = new Array(ElementType.REAL64, 6);
        src.setAll(new double[] { 0, 1, 10, 11, 20, 21 }); // 3 nodes x 2 elements
        Array dest = new Array(ElementType.REAL64, 6);

        dest.copyNodes(src, new int[] { 2, 0, 1 }, 2, 0);

        assertArrayEquals(new double[] { 20, 21, 0, 1, 10, 11 }, dest.toDoubleArray(), 0.0);
    }

    @Test
    public void testBounds() {
        Array a = new Array(ElementType.BYTE, 2);
        try {
            a.getDouble(2);
            fail("Should throw IndexOutOfBoundsException past the end");
        } catch (IndexOutOfBoundsException e) {
            assertTrue(e.getMessage().contains("out of bounds"));
        }

        try {
            a.copyFrom(new Array(ElementType.BYTE, 3), 0, 0, 3);
            fail("Should reject a copy larger than the destination");
        } catch (IndexOutOfBoundsException e) {
            assertTrue(e.getMessage().contains("destination"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCount() {
        new Array(ElementType.INT32, -1);
    }
}
