package com.toycon.graph.wiring;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.toycon.graph.ToyGraph;
import com.toycon.graph.script.CompileResult;
import com.toycon.graph.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that applies {@link GraphCommand}s to a
 * {@link ToyGraph}.
 *
 * This is the only code that touches the graph once a {@link GraphHost} is
 * running. It runs on the single consumer thread, so commands published from
 * any number of producer threads are applied strictly one after another in
 * ring buffer order, and a tick can never overlap a compile or a load.
 *
 * Failure policy:
 * A command that throws (a node failing mid-tick, an unreadable graph text)
 * is counted and dropped. The handler never rethrows, so the consumer thread
 * stays alive. A failed tick leaves the evaluator unhealthy; the handler
 * resets it so the next TICK runs again.
 *
 * A tick failure has already been logged at ERROR by the evaluator and is
 * only traced here at DEBUG. Other command failures are logged at ERROR
 * through an {@link ErrorRateLimiter}.
 *
 * The handler is also installed as the Disruptor's exception handler, which
 * catches what {@link #onEvent} does not ({@link Error}s such as a stack
 * overflow) and applies the same policy.
 */
public final class GraphCommandHandler implements EventHandler<GraphCommand>, ExceptionHandler<GraphCommand> {
    private static final Logger log = LogManager.getLogger(GraphCommandHandler.class);

    private final ToyGraph graph;
    private final ErrorRateLimiter errors;

    private PostTickCallback postTick;
    private CompileCallback onCompiled;
    private volatile long failures;
    // Survives command.clear() for the Disruptor exception callback
    private GraphCommand.Type inFlight;

    public GraphCommandHandler(ToyGraph graph, long errorLogIntervalMillis) {
        this.graph = graph;
        this.errors = new ErrorRateLimiter(log, errorLogIntervalMillis);
    }

    /**
     * Sets a callback invoked on the consumer thread after every successful
     * tick. This is where presentation collaborators read sink outputs.
     */
    public void setPostTickCallback(PostTickCallback cb) {
        this.postTick = cb;
    }

    /** Sets a callback invoked with the result of every COMPILE command. */
    public void setCompileCallback(CompileCallback cb) {
        this.onCompiled = cb;
    }

    @Override
    public void onEvent(GraphCommand command, long sequence, boolean endOfBatch) {
        inFlight = command.type();
        try {
            switch (command.type()) {
                case TICK -> {
                    int n = graph.tick(command.dt(), command.input());
                    if (postTick != null)
                        postTick.onTick(graph, graph.evaluator().epoch(), n);
                }
                case COMPILE -> {
                    CompileResult result = graph.compile(command.text());
                    if (onCompiled != null)
                        onCompiled.onCompiled(result);
                }
                case LOAD -> graph.load(command.text());
            }
        } catch (Exception e) {
            failed(sequence, e);
        } finally {
            command.clear();
        }
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, GraphCommand command) {
        failed(sequence, ex);
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("Graph command consumer failed to start", ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("Graph command consumer failed to shut down", ex);
    }

    private void failed(long sequence, Throwable e) {
        failures++;
        if (!graph.evaluator().isHealthy()) {
            log.debug("Tick (seq {}) failed, resetting evaluator", sequence);
            graph.resetHealth();
        } else {
            errors.log("Command " + inFlight + " (seq " + sequence + ") failed: " + e, e);
        }
    }

    /** Number of commands that threw since the handler was created. */
    public long failures() {
        return failures;
    }

    /**
     * Callback interface for post-tick actions.
     */
    @FunctionalInterface
    public interface PostTickCallback {
        /**
         * Called after a tick completed.
         *
         * @param graph          The graph, safe to read on this thread.
         * @param epoch          The tick number.
         * @param nodesEvaluated Number of nodes evaluated.
         */
        void onTick(ToyGraph graph, long epoch, int nodesEvaluated);
    }

    @FunctionalInterface
    public interface CompileCallback {
        void onCompiled(CompileResult result);
    }
}
