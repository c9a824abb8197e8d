package com.toycon.graph.node;

import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import org.junit.Before;
import org.junit.Test;

import static com.toycon.graph.node.LogicNode.Operation.*;
import static org.junit.Assert.*;

public class LogicNodeTest {

    private GraphBuilder g;
    private Evaluator evaluator;

    @Before
    public void setUp() {
        Graph graph = new Graph();
        g = GraphBuilder.on(graph);
        evaluator = new Evaluator(graph, 1L);
    }

    private double eval(LogicNode.Operation op, double... values) {
        ConstantNode[] operands = new ConstantNode[values.length];
        for (int i = 0; i < values.length; i++)
            operands[i] = g.constant(values[i]);
        LogicNode node = g.logic(op, operands);
        evaluator.tick(0.1);
        return node.outputValue();
    }

    @Test
    public void testBooleanOperationsUseThreshold() {
        assertEquals(1.0, eval(AND, 1, -2), 0.0);
        assertEquals(0.0, eval(AND, 1, 0.0005), 0.0);
        assertEquals(1.0, eval(OR, 0, 0.5), 0.0);
        assertEquals(0.0, eval(OR, 0, 0.001), 0.0);
        assertEquals(1.0, eval(XOR, 1, 0), 0.0);
        assertEquals(0.0, eval(XOR, 1, 1), 0.0);
        assertEquals(1.0, eval(NOT, 0), 0.0);
        assertEquals(0.0, eval(NOT, 3), 0.0);
    }

    @Test
    public void testComparisonsAreRaw() {
        assertEquals(1.0, eval(GREATER_THAN, 0.0002, 0.0001), 0.0);
        assertEquals(0.0, eval(GREATER_THAN, 1, 1), 0.0);
        assertEquals(1.0, eval(LESS_THAN, -1, 0), 0.0);
    }

    @Test
    public void testNotHasOneInput() {
        assertEquals(1, new LogicNode(0, NOT).inputs().size());
        assertEquals(2, new LogicNode(0, AND).inputs().size());
        assertEquals("GreaterThan", new LogicNode(0, GREATER_THAN).data());
    }
}
