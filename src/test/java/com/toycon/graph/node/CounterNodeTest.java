package com.toycon.graph.node;

import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class CounterNodeTest {

    private Evaluator evaluator;
    private ConstantNode up;
    private ConstantNode down;
    private ConstantNode reset;
    private CounterNode counter;

    @Before
    public void setUp() {
        Graph graph = new Graph();
        GraphBuilder g = GraphBuilder.on(graph);
        up = g.constant(0);
        down = g.constant(0);
        reset = g.constant(0);
        counter = g.counter();
        g.wire(up, counter, 0).wire(down, counter, 1).wire(reset, counter, 2);
        evaluator = new Evaluator(graph, 1L);
    }

    @Test
    public void testHeldUpCountsOnce() {
        up.setStoredValue(1);
        for (int i = 0; i < 5; i++)
            evaluator.tick(0.1);

        assertEquals(1.0, counter.outputValue(), 0.0);
    }

    @Test
    public void testEachRisingEdgeCounts() {
        for (int i = 0; i < 3; i++) {
            up.setStoredValue(1);
            evaluator.tick(0.1);
            up.setStoredValue(0);
            evaluator.tick(0.1);
        }
        assertEquals(3.0, counter.outputValue(), 0.0);

        down.setStoredValue(1);
        evaluator.tick(0.1);
        assertEquals(2.0, counter.outputValue(), 0.0);
    }

    @Test
    public void testResetWinsAndStillTracksEdges() {
        up.setStoredValue(1);
        evaluator.tick(0.1);
        up.setStoredValue(0);
        evaluator.tick(0.1);
        assertEquals(1.0, counter.outputValue(), 0.0);

        // Reset and a rising Up edge in the same tick
        reset.setStoredValue(1);
        up.setStoredValue(1);
        evaluator.tick(0.1);
        assertEquals(0.0, counter.outputValue(), 0.0);

        // Releasing reset while Up stays high is not a new edge
        reset.setStoredValue(0);
        evaluator.tick(0.1);
        assertEquals(0.0, counter.outputValue(), 0.0);
    }

    @Test
    public void testNegativeInputIsNotHigh() {
        up.setStoredValue(-1);
        evaluator.tick(0.1);
        assertEquals(0.0, counter.outputValue(), 0.0);
    }

    @Test
    public void testDataIsCurrentValue() {
        assertEquals("0.0", counter.data());
        up.setStoredValue(1);
        evaluator.tick(0.1);
        assertEquals("1.0", counter.data());
        assertEquals(1.0, new CounterNode(3, 1.0).value(), 0.0);
    }
}
