package com.toycon.graph.node;

import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import com.toycon.graph.engine.InputSnapshot;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class InputNodesTest {

    private Graph graph;
    private GraphBuilder g;
    private Evaluator evaluator;

    @Before
    public void setUp() {
        graph = new Graph();
        g = GraphBuilder.on(graph);
        evaluator = new Evaluator(graph, 7L);
    }

    @Test
    public void testTimerAccumulatesAndResets() {
        var reset = g.constant(0);
        var timer = g.timer();
        g.wire(reset, timer, 0);

        evaluator.tick(0.5);
        evaluator.tick(0.5);
        assertEquals(1.0, timer.outputValue(), 1e-12);

        reset.setStoredValue(1);
        evaluator.tick(0.25);
        assertEquals(0.25, timer.outputValue(), 1e-12);

        reset.setStoredValue(0);
        evaluator.tick(0.25);
        assertEquals(0.5, timer.outputValue(), 1e-12);
    }

    @Test
    public void testMomentaryButton() {
        var button = g.button(false);
        var pressed = InputSnapshot.EMPTY.withButtonPressed(button.id());

        evaluator.tick(0.1, pressed);
        assertEquals(1.0, button.outputValue(), 0.0);
        evaluator.tick(0.1, InputSnapshot.EMPTY);
        assertEquals(0.0, button.outputValue(), 0.0);
    }

    @Test
    public void testToggleButtonFlipsOnPress() {
        var button = g.button(true);
        var pressed = InputSnapshot.EMPTY.withButtonPressed(button.id());

        evaluator.tick(0.1, pressed);
        assertEquals(1.0, button.outputValue(), 0.0);
        evaluator.tick(0.1, pressed);
        assertEquals(1.0, button.outputValue(), 0.0);
        evaluator.tick(0.1, InputSnapshot.EMPTY);
        assertEquals(1.0, button.outputValue(), 0.0);
        evaluator.tick(0.1, pressed);
        assertEquals(0.0, button.outputValue(), 0.0);
    }

    @Test
    public void testButtonIgnoresOtherButtons() {
        var button = g.button(false);
        evaluator.tick(0.1, InputSnapshot.EMPTY.withButtonPressed(button.id() + 1));
        assertEquals(0.0, button.outputValue(), 0.0);
    }

    @Test
    public void testKeyIsCaseInsensitive() {
        var key = g.key("a");
        assertEquals("A", key.key());

        evaluator.tick(0.1, InputSnapshot.EMPTY.withKeyDown("a"));
        assertEquals(1.0, key.outputValue(), 0.0);
        evaluator.tick(0.1, InputSnapshot.EMPTY.withKeyDown("SPACE"));
        assertEquals(0.0, key.outputValue(), 0.0);
    }

    @Test
    public void testCursorNormalizedByViewport() {
        var cursor = g.cursor();
        evaluator.tick(0.1, InputSnapshot.EMPTY.withPointer(50, 25, 100, 100));
        assertEquals(0.5, cursor.outputs().get(0).value(), 0.0);
        assertEquals(0.25, cursor.outputs().get(1).value(), 0.0);

        evaluator.tick(0.1, InputSnapshot.EMPTY);
        assertEquals(0.0, cursor.outputs().get(0).value(), 0.0);
        assertEquals(0.0, cursor.outputs().get(1).value(), 0.0);
    }

    @Test
    public void testRandomIsSeededAndInRange() {
        var random = g.random();
        Graph other = new Graph();
        var twin = GraphBuilder.on(other).random();
        Evaluator otherEvaluator = new Evaluator(other, 7L);

        for (int i = 0; i < 20; i++) {
            evaluator.tick(0.1);
            otherEvaluator.tick(0.1);
            double v = random.outputValue();
            assertTrue(v >= 0.0 && v < 1.0);
            assertEquals(v, twin.outputValue(), 0.0);
        }
    }
}
