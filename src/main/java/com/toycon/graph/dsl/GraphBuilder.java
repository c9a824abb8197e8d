package com.toycon.graph.dsl;

import com.toycon.graph.api.Node;
import com.toycon.graph.engine.Graph;
import com.toycon.graph.node.BeepOutputNode;
import com.toycon.graph.node.ButtonNode;
import com.toycon.graph.node.ColorOutputNode;
import com.toycon.graph.node.ConstantNode;
import com.toycon.graph.node.CounterNode;
import com.toycon.graph.node.CursorNode;
import com.toycon.graph.node.KeyNode;
import com.toycon.graph.node.LogicNode;
import com.toycon.graph.node.MathNode;
import com.toycon.graph.node.NodeKind;
import com.toycon.graph.node.RandomNode;
import com.toycon.graph.node.ScreenNode;
import com.toycon.graph.node.ScriptNode;
import com.toycon.graph.node.TimerNode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Graph Builder -- the node factory entry points.
 *
 * This class provides a fluent API for spawning nodes into a {@link Graph} and
 * wiring them. It is used by host menu actions and by the script compiler;
 * both go through the same factories so that every spawned node gets an id
 * from the graph and a layout position.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.on(graph);
 * 2. Spawn nodes: var two = g.constant(2); var sum = g.math(ADD, two, two);
 * 3. Tick the graph through an Evaluator.
 *
 * Every spawn appends to the END of the graph, so spawn order is evaluation
 * order. Operand-wiring helpers connect output slot 0 of each operand.
 */
public final class GraphBuilder {
    private static final Logger log = LogManager.getLogger(GraphBuilder.class);

    private final Graph graph;
    private final ColumnLayout layout;

    private GraphBuilder(Graph graph, ColumnLayout layout) {
        this.graph = graph;
        this.layout = layout;
    }

    /**
     * Creates a builder that appends to {@code graph} using the standard
     * column layout.
     */
    public static GraphBuilder on(Graph graph) {
        return new GraphBuilder(graph, ColumnLayout.standard());
    }

    public static GraphBuilder on(Graph graph, ColumnLayout layout) {
        return new GraphBuilder(graph, layout);
    }

    public Graph graph() {
        return graph;
    }

    // ── Generic spawning ─────────────────────────────────────────

    /**
     * Spawns a node of any kind from persisted-style kind data at the next
     * layout position.
     */
    public Node spawn(NodeKind kind, String data) {
        return place(kind.create(graph.allocateId(), data));
    }

    /**
     * Spawns a node of any kind at an explicit canvas position (menu action).
     */
    public Node spawnAt(NodeKind kind, String data, int x, int y) {
        Node node = kind.create(graph.allocateId(), data);
        node.moveTo(x, y);
        graph.add(node);
        log.debug("Spawned {} at ({}, {})", node, x, y);
        return node;
    }

    // ── Sources ──────────────────────────────────────────────────

    public ConstantNode constant(double value) {
        return place(new ConstantNode(graph.allocateId(), value));
    }

    public TimerNode timer() {
        return place(new TimerNode(graph.allocateId()));
    }

    public RandomNode random() {
        return place(new RandomNode(graph.allocateId()));
    }

    public ButtonNode button(boolean toggle) {
        return place(new ButtonNode(graph.allocateId(), toggle));
    }

    public KeyNode key(String keyName) {
        return place(new KeyNode(graph.allocateId(), keyName));
    }

    public CursorNode cursor() {
        return place(new CursorNode(graph.allocateId()));
    }

    public ScriptNode script(String source) {
        return place(new ScriptNode(graph.allocateId(), source));
    }

    // ── Transforms ───────────────────────────────────────────────

    /**
     * Spawns a math node and wires the operands, in order, into its input
     * slots. Fewer operands than inputs leave the remaining inputs unconnected.
     */
    public MathNode math(MathNode.Operation op, Node... operands) {
        return wireOperands(place(new MathNode(graph.allocateId(), op)), operands);
    }

    /**
     * Spawns a Select: {@code |cond| > epsilon ? ifTrue : ifFalse}.
     */
    public MathNode select(Node cond, Node ifTrue, Node ifFalse) {
        return math(MathNode.Operation.SELECT, cond, ifTrue, ifFalse);
    }

    public LogicNode logic(LogicNode.Operation op, Node... operands) {
        return wireOperands(place(new LogicNode(graph.allocateId(), op)), operands);
    }

    public CounterNode counter() {
        return place(new CounterNode(graph.allocateId()));
    }

    // ── Sinks ────────────────────────────────────────────────────

    public BeepOutputNode beep(String soundName) {
        return place(new BeepOutputNode(graph.allocateId(), soundName));
    }

    public ColorOutputNode colorOutput() {
        return place(new ColorOutputNode(graph.allocateId()));
    }

    public ScreenNode screen() {
        return place(new ScreenNode(graph.allocateId()));
    }

    // ── Wiring ───────────────────────────────────────────────────

    /**
     * Connects {@code source} output slot 0 to {@code target} input
     * {@code targetSlot}.
     */
    public GraphBuilder wire(Node source, Node target, int targetSlot) {
        graph.connect(source, 0, target, targetSlot);
        return this;
    }

    public GraphBuilder connect(Node source, int sourceSlot, Node target, int targetSlot) {
        graph.connect(source, sourceSlot, target, targetSlot);
        return this;
    }

    private <N extends Node> N wireOperands(N node, Node[] operands) {
        for (int i = 0; i < operands.length; i++) {
            if (operands[i] != null)
                graph.connect(operands[i], 0, node, i);
        }
        return node;
    }

    // Internal helper to lay out and register a node
    private <N extends Node> N place(N node) {
        int[] pos = layout.next();
        node.moveTo(pos[0], pos[1]);
        graph.add(node);
        log.debug("Spawned {} at ({}, {})", node, pos[0], pos[1]);
        return node;
    }
}
