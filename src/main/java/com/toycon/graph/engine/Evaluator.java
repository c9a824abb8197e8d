package com.toycon.graph.engine;

import com.toycon.graph.api.Node;
import com.toycon.graph.api.TickListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Random;

/**
 * The engine that drives one relaxation pass per host tick.
 *
 * Algorithm Details:
 * The evaluator uses a "Single Linear Pass" strategy:
 *
 * 1. Epoch: Advances the tick counter and refills the shared TickContext with
 * the host's time delta and input snapshot.
 *
 * 2. Iterate: Walks the graph's node list from index 0 to N-1.
 *
 * 3. Evaluate: Calls evaluate() on every node exactly once. There is no dirty
 * tracking and no dependency sort. A node reading from a node that appears
 * later in the list sees that node's value from the previous tick; a node
 * reading from an earlier node sees the current tick's value. This one-tick
 * latency along backward edges is part of the engine's contract.
 *
 * Circuit Breaker / Fail Fast:
 * If a node throws during evaluation, the pass stops, listeners are notified,
 * and the evaluator is marked unhealthy. Further ticks are refused until
 * resetHealth() is called. Node kinds never throw for degenerate input (zero
 * divisors, unconnected ports); an exception here is a programming error.
 */
public final class Evaluator {
    private static final Logger log = LogManager.getLogger(Evaluator.class);

    private final Graph graph;
    private final TickContext context;

    // Circuit Breaker state
    private boolean healthy = true;
    private boolean ticking;

    private int lastEvaluatedCount;
    private long epoch;
    private TickListener listener;

    public Evaluator(Graph graph, Random random) {
        this.graph = graph;
        this.context = new TickContext(random);
    }

    public Evaluator(Graph graph, long seed) {
        this(graph, new Random(seed));
    }

    public void setListener(TickListener listener) {
        this.listener = listener;
    }

    /**
     * Run one tick over every node in graph order.
     *
     * This method is single-threaded and non-reentrant.
     *
     * @param dt    Time elapsed since the previous tick, in seconds.
     * @param input Host input state for this tick (null means no input).
     * @return The number of nodes evaluated.
     * @throws IllegalStateException if the evaluator is unhealthy or already
     *                               inside a tick.
     * @throws RuntimeException      if a node failed during this pass.
     */
    public int tick(double dt, InputSnapshot input) {
        if (!healthy) {
            throw new IllegalStateException(
                    "Evaluator is in unhealthy state due to previous errors. Manual reset required.");
        }
        if (ticking)
            throw new IllegalStateException("tick() is not reentrant");

        ticking = true;
        epoch++;
        context.begin(epoch, dt, input);

        final List<Node> nodes = graph.nodes();
        final int n = nodes.size();
        final TickListener l = this.listener;
        final boolean hasListener = l != null;

        if (hasListener)
            l.onTickStart(epoch);

        int evaluated = 0;
        Throwable failure = null;
        String failedNode = null;

        try {
            for (int i = 0; i < n; i++) {
                Node node = nodes.get(i);
                long start = hasListener ? System.nanoTime() : 0L;
                try {
                    node.evaluate(context);
                } catch (RuntimeException e) {
                    failure = e;
                    failedNode = node.name() + "#" + node.id();
                    if (hasListener)
                        l.onNodeError(epoch, i, node.name(), e);
                    break;
                }
                evaluated++;
                if (hasListener)
                    l.onNodeEvaluated(epoch, i, node.name(), System.nanoTime() - start);
            }
        } finally {
            this.lastEvaluatedCount = evaluated;
            ticking = false;
            if (hasListener)
                l.onTickEnd(epoch, evaluated);
        }

        if (failure != null) {
            this.healthy = false;
            log.error("Tick {} failed in node {}", epoch, failedNode, failure);
            throw new RuntimeException("Tick failed in node " + failedNode + ". Evaluator is now unhealthy.",
                    failure);
        }
        return evaluated;
    }

    /** Ticks with no host input. */
    public int tick(double dt) {
        return tick(dt, InputSnapshot.EMPTY);
    }

    /** True while a tick pass is running. */
    public boolean isTicking() {
        return ticking;
    }

    public long epoch() {
        return epoch;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void resetHealth() {
        this.healthy = true;
    }

    public int lastEvaluatedCount() {
        return lastEvaluatedCount;
    }

    public Graph graph() {
        return graph;
    }
}
