package com.toycon.graph.node;

import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class OutputNodesTest {

    private GraphBuilder g;
    private Evaluator evaluator;

    @Before
    public void setUp() {
        Graph graph = new Graph();
        g = GraphBuilder.on(graph);
        evaluator = new Evaluator(graph, 1L);
    }

    @Test
    public void testColorOutputClamps() {
        var r = g.constant(2);
        var gr = g.constant(0.5);
        var b = g.constant(-1);
        var color = g.colorOutput();
        g.wire(r, color, 0).wire(gr, color, 1).wire(b, color, 2);

        evaluator.tick(0.1);

        assertEquals(1.0, color.red(), 0.0);
        assertEquals(0.5, color.green(), 0.0);
        assertEquals(0.0, color.blue(), 0.0);
        assertEquals(0xFF8000, color.rgb());
        assertTrue(color.outputs().isEmpty());
    }

    @Test
    public void testScreenDrawAndClear() {
        var x = g.constant(3.7);
        var y = g.constant(4);
        var red = g.constant(1);
        var draw = g.constant(1);
        var clear = g.constant(0);
        var screen = g.screen();
        g.wire(x, screen, 0).wire(y, screen, 1).wire(red, screen, 2)
                .wire(draw, screen, ScreenNode.DRAW_SLOT).wire(clear, screen, 6);

        evaluator.tick(0.1);
        assertEquals(0xFF0000, screen.pixel(3, 4));

        draw.setStoredValue(0);
        clear.setStoredValue(1);
        evaluator.tick(0.1);
        assertEquals(0, screen.pixel(3, 4));
    }

    @Test
    public void testScreenIgnoresOutOfRange() {
        var x = g.constant(64);
        var draw = g.constant(1);
        var red = g.constant(1);
        var screen = g.screen();
        g.wire(x, screen, 0).wire(red, screen, 2).wire(draw, screen, ScreenNode.DRAW_SLOT);

        evaluator.tick(0.1);
        for (int p : screen.pixels())
            assertEquals(0, p);
    }

    @Test
    public void testScriptNodeIsInert() {
        var script = g.script("var x = 1;");
        evaluator.tick(0.1);
        assertTrue(script.inputs().isEmpty());
        assertTrue(script.outputs().isEmpty());
        assertEquals("var x = 1;", ScriptNode.decode(script.data()));
    }
}
