package com.toycon.graph.node;

import com.toycon.graph.api.Node;

/**
 * The closed set of node kinds, each with the factory that rebuilds a node
 * from its persisted kind data.
 *
 * The type name is the token written in the kind column of a NODE line.
 */
public enum NodeKind {
    CONSTANT("ConstantNode", (id, data) -> new ConstantNode(id, data.isEmpty() ? 0.0 : Double.parseDouble(data))),
    MATH("MathNode", (id, data) -> new MathNode(id,
            data.isEmpty() ? MathNode.Operation.ADD : MathNode.Operation.parse(data))),
    LOGIC("LogicNode", (id, data) -> new LogicNode(id,
            data.isEmpty() ? LogicNode.Operation.AND : LogicNode.Operation.parse(data))),
    TIMER("TimerNode", (id, data) -> new TimerNode(id)),
    COUNTER("CounterNode", (id, data) -> new CounterNode(id, data.isEmpty() ? 0.0 : Double.parseDouble(data))),
    RANDOM("RandomNode", (id, data) -> new RandomNode(id)),
    BUTTON("ButtonNode", (id, data) -> new ButtonNode(id, parseBoolean(data))),
    KEY("KeyNode", (id, data) -> new KeyNode(id, data.isEmpty() ? KeyNode.DEFAULT_KEY : data)),
    CURSOR("CursorNode", (id, data) -> new CursorNode(id)),
    COLOR_OUTPUT("ColorOutputNode", (id, data) -> new ColorOutputNode(id)),
    BEEP_OUTPUT("BeepOutputNode", (id, data) -> new BeepOutputNode(id,
            data.isEmpty() ? BeepOutputNode.DEFAULT_SOUND : data)),
    SCREEN("ScreenNode", (id, data) -> new ScreenNode(id)),
    SCRIPT("ScriptImporterNode", (id, data) -> new ScriptNode(id, data.isEmpty() ? "" : ScriptNode.decode(data)));

    private final String typeName;
    private final Factory factory;

    NodeKind(String typeName, Factory factory) {
        this.typeName = typeName;
        this.factory = factory;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Creates a node of this kind.
     *
     * @param id   The node id (see Graph#allocateId).
     * @param data Persisted kind data, empty for defaults.
     * @return The new, unattached node.
     * @throws IllegalArgumentException if the data cannot be parsed.
     */
    public Node create(int id, String data) {
        return factory.create(id, data == null ? "" : data.trim());
    }

    /**
     * Resolves a persisted type token. Accepts the type name or the enum
     * constant name, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown token.
     */
    public static NodeKind fromString(String text) {
        for (NodeKind k : values()) {
            if (k.typeName.equalsIgnoreCase(text) || k.name().equalsIgnoreCase(text))
                return k;
        }
        throw new IllegalArgumentException("Unknown NodeKind: " + text);
    }

    private static boolean parseBoolean(String data) {
        if (data.isEmpty() || data.equalsIgnoreCase("false"))
            return false;
        if (data.equalsIgnoreCase("true"))
            return true;
        throw new IllegalArgumentException("Not a boolean: " + data);
    }

    @FunctionalInterface
    interface Factory {
        Node create(int id, String data);
    }
}
