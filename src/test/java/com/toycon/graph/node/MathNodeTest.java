package com.toycon.graph.node;

import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import org.junit.Before;
import org.junit.Test;

import static com.toycon.graph.node.MathNode.Operation.*;
import static org.junit.Assert.*;

public class MathNodeTest {

    private Graph graph;
    private GraphBuilder g;
    private Evaluator evaluator;

    @Before
    public void setUp() {
        graph = new Graph();
        g = GraphBuilder.on(graph);
        evaluator = new Evaluator(graph, 1L);
    }

    private double eval(MathNode.Operation op, double... values) {
        ConstantNode[] operands = new ConstantNode[values.length];
        for (int i = 0; i < values.length; i++)
            operands[i] = g.constant(values[i]);
        MathNode node = g.math(op, operands);
        evaluator.tick(0.1);
        return node.outputValue();
    }

    @Test
    public void testArithmetic() {
        assertEquals(5.0, eval(ADD, 2, 3), 0.0);
        assertEquals(-1.0, eval(SUBTRACT, 2, 3), 0.0);
        assertEquals(6.0, eval(MULTIPLY, 2, 3), 0.0);
        assertEquals(2.0, eval(DIVIDE, 6, 3), 0.0);
        assertEquals(3.0, eval(ABS, -3), 0.0);
    }

    @Test
    public void testDivideByNearZeroYieldsZero() {
        assertEquals(0.0, eval(DIVIDE, 6, 0), 0.0);
        assertEquals(0.0, eval(DIVIDE, 6, 0.0005), 0.0);
        assertEquals(0.0, eval(DIVIDE, 6, -0.001), 0.0);
        assertEquals(-3000.0, eval(DIVIDE, 6, -0.002), 1e-9);
    }

    @Test
    public void testSelect() {
        assertEquals(10.0, eval(SELECT, 1, 10, 20), 0.0);
        assertEquals(10.0, eval(SELECT, -1, 10, 20), 0.0);
        assertEquals(20.0, eval(SELECT, 0.0005, 10, 20), 0.0);
        assertEquals(20.0, eval(SELECT, 0, 10, 20), 0.0);
    }

    @Test
    public void testUnconnectedInputsReadZero() {
        var node = g.math(ADD);
        evaluator.tick(0.1);
        assertEquals(0.0, node.outputValue(), 0.0);
    }

    @Test
    public void testPortsByOperation() {
        assertEquals(1, new MathNode(0, ABS).inputs().size());
        assertEquals(3, new MathNode(0, SELECT).inputs().size());
        assertEquals("Cond", new MathNode(0, SELECT).inputs().get(0).name());
        assertEquals(2, new MathNode(0, DIVIDE).inputs().size());
    }

    @Test
    public void testOperationParse() {
        assertEquals(SELECT, MathNode.Operation.parse("Select"));
        assertEquals(DIVIDE, MathNode.Operation.parse("DIVIDE"));
        assertEquals("Multiply", new MathNode(0, MULTIPLY).data());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOperation() {
        MathNode.Operation.parse("Modulo");
    }
}
