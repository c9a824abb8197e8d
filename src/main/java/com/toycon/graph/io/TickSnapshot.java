package com.toycon.graph.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toycon.graph.api.Node;
import com.toycon.graph.core.OutputPort;
import com.toycon.graph.engine.Graph;
import com.toycon.graph.node.BeepOutputNode;
import com.toycon.graph.node.ColorOutputNode;
import com.toycon.graph.node.ScreenNode;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a graph after a tick, for presentation collaborators:
 * every node's output values plus the side channels of the sinks.
 *
 * Screen pixels are not included; read them from {@link ScreenNode#pixels()}.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TickSnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private long epoch;
    private List<NodeState> nodes = new ArrayList<>();

    /** One node's state. Sink fields are only set for the matching kind. */
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeState {
        private int id;
        private String name;
        private String kind;
        private Map<String, Double> outputs;
        private Boolean play;
        private Double pitch;
        private Double volume;
        private String sound;
        private Integer color;
    }

    /** Captures the current state of {@code graph}. */
    public static TickSnapshot capture(Graph graph, long epoch) {
        TickSnapshot snapshot = new TickSnapshot();
        snapshot.setEpoch(epoch);
        for (Node n : graph.nodes()) {
            NodeState s = new NodeState();
            s.setId(n.id());
            s.setName(n.name());
            s.setKind(n.kind().typeName());

            Map<String, Double> outs = new LinkedHashMap<>();
            for (OutputPort p : n.outputs())
                outs.put(p.name(), p.value());
            s.setOutputs(outs);

            if (n instanceof BeepOutputNode beep) {
                s.setPlay(beep.shouldPlay());
                s.setPitch(beep.pitch());
                s.setVolume(beep.volume());
                s.setSound(beep.soundName());
            } else if (n instanceof ColorOutputNode color) {
                s.setColor(color.rgb());
            }
            snapshot.getNodes().add(s);
        }
        return snapshot;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tick snapshot", e);
        }
    }

    public static TickSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, TickSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid tick snapshot", e);
        }
    }
}
