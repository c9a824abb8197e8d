package com.toycon.graph.util;

import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class TickLatencyListenerTest {

    private TickLatencyListener latency;

    @Before
    public void setUp() {
        latency = new TickLatencyListener();
    }

    @Test
    public void testSlowestNodeOfLastTick() {
        latency.onTickStart(1);
        latency.onNodeEvaluated(1, 0, "Constant", 100);
        latency.onNodeEvaluated(1, 1, "Timer", 900);
        latency.onNodeEvaluated(1, 2, "Math", 300);
        latency.onTickEnd(1, 3);

        assertEquals(1, latency.slowestNodeIndex());
        assertEquals("Timer", latency.slowestNodeName());
        assertEquals(900, latency.slowestNodeNanos());
        assertEquals(3, latency.lastNodesEvaluated());

        // Next tick starts a fresh scan
        latency.onTickStart(2);
        latency.onNodeEvaluated(2, 0, "Constant", 50);
        latency.onTickEnd(2, 1);
        assertEquals(0, latency.slowestNodeIndex());
        assertEquals("Constant", latency.slowestNodeName());
        assertEquals(2, latency.ticks());
    }

    @Test
    public void testFailedTickCounted() {
        latency.onTickStart(1);
        latency.onNodeEvaluated(1, 0, "Constant", 10);
        latency.onNodeError(1, 1, "Counter", new IllegalStateException("boom"));
        latency.onTickEnd(1, 1);

        assertEquals(1, latency.ticks());
        assertEquals(1, latency.failedTicks());
        assertEquals("Counter [1]", latency.lastFailedNode());
    }

    @Test
    public void testEmptyTick() {
        latency.onTickStart(1);
        latency.onTickEnd(1, 0);
        assertEquals(-1, latency.slowestNodeIndex());
        assertNull(latency.slowestNodeName());
        assertTrue(latency.toString().contains("slowest node none"));
    }

    @Test
    public void testDrivenByEvaluator() {
        Graph graph = new Graph();
        GraphBuilder g = GraphBuilder.on(graph);
        g.constant(1);
        g.timer();

        Evaluator evaluator = new Evaluator(graph, 1L);
        evaluator.setListener(latency);
        evaluator.tick(0.1);
        evaluator.tick(0.1);

        assertEquals(2, latency.ticks());
        assertEquals(0, latency.failedTicks());
        assertEquals(2, latency.lastNodesEvaluated());
        assertTrue(latency.slowestNodeIndex() == 0 || latency.slowestNodeIndex() == 1);
        assertTrue(latency.slowestNanos() >= latency.fastestNanos());
    }

    @Test
    public void testReset() {
        latency.onTickStart(1);
        latency.onNodeEvaluated(1, 0, "Timer", 5);
        latency.onTickEnd(1, 1);
        latency.reset();

        assertEquals(0, latency.ticks());
        assertEquals(0, latency.fastestNanos());
        assertEquals(0.0, latency.averageNanos(), 0.0);
        assertEquals(-1, latency.slowestNodeIndex());
    }
}
