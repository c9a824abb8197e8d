package com.toycon.graph.io;

import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import org.junit.Test;

import static org.junit.Assert.*;

public class TickSnapshotTest {

    @Test
    public void testCapturesOutputsAndSinkChannels() {
        Graph graph = new Graph();
        GraphBuilder g = GraphBuilder.on(graph);
        var one = g.constant(1);
        var half = g.constant(0.5);
        var beep = g.beep("KICK-01");
        var color = g.colorOutput();
        g.wire(one, beep, 0).wire(half, beep, 1).wire(one, color, 0);
        Evaluator evaluator = new Evaluator(graph, 1L);
        evaluator.tick(0.1);

        TickSnapshot snapshot = TickSnapshot.capture(graph, evaluator.epoch());

        assertEquals(1L, snapshot.getEpoch());
        assertEquals(4, snapshot.getNodes().size());
        assertEquals(Double.valueOf(1.0), snapshot.getNodes().get(0).getOutputs().get("Out"));

        TickSnapshot.NodeState beepState = snapshot.getNodes().get(beep.id());
        assertEquals("BeepOutputNode", beepState.getKind());
        assertEquals(Boolean.TRUE, beepState.getPlay());
        assertEquals(Double.valueOf(0.5), beepState.getPitch());
        assertEquals("KICK-01", beepState.getSound());

        assertEquals(Integer.valueOf(0xFF0000), snapshot.getNodes().get(color.id()).getColor());
        assertNull(snapshot.getNodes().get(0).getColor());
    }

    @Test
    public void testJsonRoundTrip() {
        Graph graph = new Graph();
        GraphBuilder.on(graph).constant(3);
        new Evaluator(graph, 1L).tick(0.1);

        String json = TickSnapshot.capture(graph, 5).toJson();
        assertTrue(json.contains("\"epoch\":5"));
        assertFalse("null sink fields are omitted", json.contains("pitch"));

        TickSnapshot back = TickSnapshot.fromJson(json);
        assertEquals(5L, back.getEpoch());
        assertEquals(Double.valueOf(3.0), back.getNodes().get(0).getOutputs().get("Out"));
    }
}
