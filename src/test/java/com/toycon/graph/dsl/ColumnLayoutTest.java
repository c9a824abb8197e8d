package com.toycon.graph.dsl;

import org.junit.Test;

import static org.junit.Assert.*;

public class ColumnLayoutTest {

    @Test
    public void testStacksThenWrapsToNextColumn() {
        ColumnLayout layout = ColumnLayout.standard();

        assertArrayEquals(new int[] { 100, 100 }, layout.next());
        assertArrayEquals(new int[] { 100, 180 }, layout.next());
        assertArrayEquals(new int[] { 100, 260 }, layout.next());
        assertArrayEquals(new int[] { 100, 340 }, layout.next());
        assertArrayEquals(new int[] { 300, 100 }, layout.next());
        assertArrayEquals(new int[] { 300, 180 }, layout.next());
    }

    @Test
    public void testCustomGeometry() {
        ColumnLayout layout = new ColumnLayout(0, 0, 10, 15, 50);
        assertArrayEquals(new int[] { 0, 0 }, layout.next());
        assertArrayEquals(new int[] { 0, 10 }, layout.next());
        assertArrayEquals(new int[] { 50, 0 }, layout.next());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsZeroStep() {
        new ColumnLayout(0, 0, 0, 100, 10);
    }
}
