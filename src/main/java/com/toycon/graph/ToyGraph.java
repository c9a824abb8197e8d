package com.toycon.graph;

import com.toycon.graph.api.Node;
import com.toycon.graph.api.TickListener;
import com.toycon.graph.dsl.ColumnLayout;
import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;
import com.toycon.graph.engine.InputSnapshot;
import com.toycon.graph.io.EngineConfig;
import com.toycon.graph.io.GraphTextFormat;
import com.toycon.graph.io.TickSnapshot;
import com.toycon.graph.node.NodeKind;
import com.toycon.graph.node.ScriptNode;
import com.toycon.graph.script.CompileResult;
import com.toycon.graph.script.ScriptCompiler;
import com.toycon.graph.util.CompositeTickListener;
import com.toycon.graph.util.GraphExplain;
import com.toycon.graph.util.TickLatencyListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A high-level wrapper that owns one live graph and everything that acts on
 * it.
 * <p>
 * This class handles:
 * <ul>
 * <li>Ticking the graph through an {@link Evaluator}</li>
 * <li>Compiling scripts with {@link ScriptCompiler} and installing the result
 * as a wholesale replacement of the graph</li>
 * <li>Menu-style editing: spawn, connect, remove</li>
 * <li>Saving and loading with {@link GraphTextFormat}</li>
 * </ul>
 *
 * <p>
 * <b>Threading:</b> single owner, not thread-safe. Any mutation attempted
 * while a tick is running (for instance from a {@link TickListener}) is
 * rejected with {@link IllegalStateException}. Use
 * {@link com.toycon.graph.wiring.GraphHost} to drive a ToyGraph from several
 * threads.
 *
 * <p>
 * Compile and load are atomic: the new graph is built off to the side and
 * only swapped in once complete, so a failure leaves the live graph exactly as
 * it was.
 */
public class ToyGraph {
    private static final Logger log = LogManager.getLogger(ToyGraph.class);

    private final EngineConfig config;
    private final Graph graph = new Graph();
    private final Evaluator evaluator;
    private final ScriptCompiler compiler;
    private final CompositeTickListener compositeListener = new CompositeTickListener();

    // Placement cursor for menu spawns; restarts whenever the graph is replaced
    private ColumnLayout layout;

    public ToyGraph() {
        this(EngineConfig.defaults());
    }

    public ToyGraph(EngineConfig config) {
        this.config = config;
        this.evaluator = new Evaluator(graph, config.getRandomSeed());
        this.evaluator.setListener(compositeListener);
        this.compiler = new ScriptCompiler(config::newLayout, config.getMaxNestingDepth());
        this.layout = config.newLayout();
    }

    // ── Observation ──────────────────────────────────────────────

    /**
     * Registers a listener for tick events. Adds to the existing listeners
     * rather than replacing them.
     */
    public void addListener(TickListener listener) {
        compositeListener.add(listener);
    }

    /**
     * Enables per-tick latency tracking. Use the returned listener to read the
     * statistics.
     */
    public TickLatencyListener enableLatencyTracking() {
        var latency = new TickLatencyListener();
        compositeListener.add(latency);
        return latency;
    }

    // ── Evaluation ───────────────────────────────────────────────

    /**
     * Runs one tick.
     *
     * @param dt    Seconds since the previous tick.
     * @param input Host input state (null for none).
     * @return The number of nodes evaluated.
     */
    public int tick(double dt, InputSnapshot input) {
        return evaluator.tick(dt, input);
    }

    public int tick(double dt) {
        return evaluator.tick(dt, InputSnapshot.EMPTY);
    }

    /** Clears the evaluator's circuit breaker after a failed tick. */
    public void resetHealth() {
        evaluator.resetHealth();
    }

    // ── Scripts ──────────────────────────────────────────────────

    /**
     * Compiles {@code script} and, on success, replaces the whole graph with
     * the result. On failure the live graph is untouched and the failure is
     * logged at WARN.
     *
     * <p>
     * The returned result's {@link CompileResult#graph()} is the live graph,
     * and its {@link CompileResult#variables()} are live nodes.
     */
    public CompileResult compile(String script) {
        requireIdle("compile");
        CompileResult result = compiler.compile(script);
        if (!result.isSuccess()) {
            log.warn("Script compilation failed: {}", result.errorMessage());
            return result;
        }
        install(result.graph());
        log.info("Compiled script into {} nodes ({} warnings)", result.nodeCount(), result.warnings().size());
        return result.installedIn(graph);
    }

    /**
     * Compiles the script held by a SCRIPT node. Like any compile this replaces
     * the whole graph, including the SCRIPT node itself.
     *
     * @throws IllegalArgumentException if {@code nodeId} is not a SCRIPT node.
     */
    public CompileResult compileScriptNode(int nodeId) {
        Node node = graph.require(nodeId);
        if (!(node instanceof ScriptNode scriptNode))
            throw new IllegalArgumentException("Node " + nodeId + " is a " + node.kind() + ", not a SCRIPT node");
        return compile(scriptNode.script());
    }

    // ── Editing ──────────────────────────────────────────────────

    /**
     * Spawns a node at the next layout position.
     *
     * @param data Kind data as persisted (empty for defaults).
     */
    public Node spawn(NodeKind kind, String data) {
        requireIdle("spawn");
        return builder().spawn(kind, data);
    }

    /** Spawns a node at an explicit canvas position. */
    public Node spawnAt(NodeKind kind, String data, int x, int y) {
        requireIdle("spawn");
        return builder().spawnAt(kind, data, x, y);
    }

    /**
     * Builder over the live graph sharing this facade's layout cursor. Do not
     * use it while a tick is running.
     */
    public GraphBuilder builder() {
        return GraphBuilder.on(graph, layout);
    }

    /** @see Graph#connect(int, int, int, int) */
    public boolean connect(int sourceId, int sourceSlot, int targetId, int targetSlot) {
        requireIdle("connect");
        return graph.connect(sourceId, sourceSlot, targetId, targetSlot);
    }

    public boolean disconnect(int sourceId, int sourceSlot, int targetId, int targetSlot) {
        requireIdle("disconnect");
        return graph.disconnect(graph.require(sourceId), sourceSlot, graph.require(targetId), targetSlot);
    }

    /** Removes a node and scrubs every connection that reads from it. */
    public boolean remove(int nodeId) {
        requireIdle("remove");
        return graph.remove(nodeId);
    }

    public void clear() {
        requireIdle("clear");
        graph.clear();
        layout = config.newLayout();
    }

    // ── Persistence ──────────────────────────────────────────────

    public String save() {
        return GraphTextFormat.write(graph);
    }

    public void save(Path file) throws IOException {
        GraphTextFormat.save(graph, file);
    }

    /**
     * Replaces the graph with one read from {@code text}.
     *
     * @throws com.toycon.graph.io.GraphFormatException if the header is
     *                                                  missing; the live graph
     *                                                  is then untouched.
     */
    public void load(String text) {
        requireIdle("load");
        install(GraphTextFormat.read(text));
        log.info("Loaded graph with {} nodes", graph.size());
    }

    public void load(Path file) throws IOException {
        requireIdle("load");
        install(GraphTextFormat.load(file));
    }

    // ── Queries ──────────────────────────────────────────────────

    /** Current value of output {@code slot} of node {@code nodeId}. */
    public double value(int nodeId, int slot) {
        Node node = graph.require(nodeId);
        return node.outputs().get(slot).value();
    }

    /** Current value of output slot 0 of {@code node}. */
    public double value(Node node) {
        return value(node.id(), 0);
    }

    public Node node(int nodeId) {
        return graph.node(nodeId);
    }

    public TickSnapshot snapshot() {
        return TickSnapshot.capture(graph, evaluator.epoch());
    }

    public String snapshotJson() {
        return snapshot().toJson();
    }

    public GraphExplain explain() {
        return new GraphExplain(evaluator);
    }

    public Graph graph() {
        return graph;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    public EngineConfig config() {
        return config;
    }

    private void install(Graph replacement) {
        graph.replaceWith(replacement);
        layout = config.newLayout();
    }

    private void requireIdle(String operation) {
        if (evaluator.isTicking())
            throw new IllegalStateException("Cannot " + operation + " while a tick is running");
    }
}
