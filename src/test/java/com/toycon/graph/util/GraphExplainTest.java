package com.toycon.graph.util;

import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import com.toycon.graph.node.MathNode;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private Graph graph;
    private Evaluator evaluator;
    private MathNode consumer;
    private MathNode producer;

    @Before
    public void setUp() {
        graph = new Graph();
        GraphBuilder g = GraphBuilder.on(graph);
        consumer = g.math(MathNode.Operation.ADD);
        var seven = g.constant(7);
        producer = g.math(MathNode.Operation.ADD, seven);
        g.wire(producer, consumer, 1);
        evaluator = new Evaluator(graph, 1L);
        evaluator.tick(0.1);
    }

    @Test
    public void testDumpGraphListsTargets() {
        String dump = new GraphExplain(graph).dumpGraph();
        assertTrue(dump.startsWith("Graph (3 nodes):"));
        assertTrue(dump.contains("[1] Constant#1 -> Math (Add)#2.A"));
        assertTrue(dump.contains("[2] Math (Add)#2 -> Math (Add)#0.B"));
    }

    @Test
    public void testMermaidMarksBackwardEdgesAsDelayed() {
        String mermaid = new GraphExplain(evaluator).toMermaid();
        assertTrue(mermaid.startsWith("graph TD;"));
        assertTrue(mermaid.contains("n1 -- \"A\" --> n2;"));
        assertTrue(mermaid.contains("n2 -. \"B\" .-> n0;"));
    }

    @Test
    public void testExplainNode() {
        String text = new GraphExplain(graph).explainNode(producer.id());
        assertTrue(text.contains("Kind: MathNode"));
        assertTrue(text.contains("in  A = 7.0 <- #1.Out"));
        assertTrue(text.contains("out Result = 7.0"));
    }

    @Test
    public void testExplainLastTick() {
        assertEquals("Epoch: 1, Evaluated: 3/3", new GraphExplain(evaluator).explainLastTick());
    }
}
