package com.toycon.graph.api;

/**
 * Observability interface for monitoring the tick evaluation pass.
 *
 * Implementations can be registered with the Evaluator to receive callbacks
 * during every tick. This is the primary mechanism for:
 *
 * - Profiling: Measuring how long a tick or a single node takes.
 * - Debugging: Tracing the order in which nodes were evaluated.
 * - Sink handling: Reacting to sink side channels (e.g. a beep that should
 * play) once the pass is complete.
 *
 * Performance Warning:
 * These callbacks run inside the evaluation loop. Implementations must be
 * lightweight; blocking I/O here stalls the host's tick.
 */
public interface TickListener {

    /**
     * Called immediately before a tick pass begins.
     *
     * @param epoch The incrementing tick number.
     */
    void onTickStart(long epoch);

    /**
     * Called after a node has finished its evaluate() method.
     *
     * @param epoch         Current tick number.
     * @param index         Position of the node in the graph list.
     * @param nodeName      The display name of the node.
     * @param durationNanos Time spent in evaluate().
     */
    void onNodeEvaluated(long epoch, int index, String nodeName, long durationNanos);

    /**
     * Called when a node throws during evaluation.
     *
     * @param epoch    Current tick number.
     * @param index    Position of the node in the graph list.
     * @param nodeName The name of the failing node.
     * @param error    The exception that occurred.
     */
    void onNodeError(long epoch, int index, String nodeName, Throwable error);

    /**
     * Called when the tick pass is complete.
     *
     * @param epoch          Current tick number.
     * @param nodesEvaluated The number of nodes evaluated in this pass.
     */
    void onTickEnd(long epoch, int nodesEvaluated);
}
