package com.toycon.graph.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.toycon.graph.ToyGraph;
import com.toycon.graph.engine.InputSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a {@link ToyGraph} behind an LMAX Disruptor ring buffer.
 *
 * <p>
 * Any thread may publish TICK, COMPILE and LOAD commands; a single daemon
 * consumer thread applies them in publication order through a
 * {@link GraphCommandHandler}. Once started, the graph must only be read from
 * the handler's callbacks.
 *
 * <pre>
 * GraphHost host = new GraphHost(new ToyGraph());
 * host.handler().setPostTickCallback((g, epoch, n) -&gt; render(g));
 * host.start();
 * host.publishCompile("var x = 1;");
 * host.publishTick(1.0 / 60, input);
 * </pre>
 */
public final class GraphHost implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(GraphHost.class);

    private final ToyGraph graph;
    private final Disruptor<GraphCommand> disruptor;
    private final GraphCommandHandler handler;
    private volatile RingBuffer<GraphCommand> ringBuffer;

    public GraphHost(ToyGraph graph) {
        this.graph = graph;
        int size = graph.config().getRingBufferSize();
        if (Integer.bitCount(size) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of 2, was " + size);

        this.handler = new GraphCommandHandler(graph, graph.config().getErrorLogIntervalMillis());
        this.disruptor = new Disruptor<>(
                GraphCommand::new,
                size,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.setDefaultExceptionHandler(handler);
        disruptor.handleEventsWith(handler);
    }

    /**
     * Starts the consumer thread.
     *
     * @throws IllegalStateException if already started.
     */
    public synchronized void start() {
        if (ringBuffer != null)
            throw new IllegalStateException("GraphHost already started");
        ringBuffer = disruptor.start();
        log.info("GraphHost started (ring buffer size {})", ringBuffer.getBufferSize());
    }

    /**
     * Waits until every published command has been applied, then stops the
     * consumer thread.
     */
    public synchronized void stop() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        ringBuffer = null;
        log.info("GraphHost stopped after epoch {}", graph.evaluator().epoch());
    }

    @Override
    public void close() {
        stop();
    }

    public void publishTick(double dt, InputSnapshot input) {
        RingBuffer<GraphCommand> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setTick(dt, input, seq);
        } finally {
            rb.publish(seq);
        }
    }

    public void publishCompile(String script) {
        RingBuffer<GraphCommand> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setCompile(script, seq);
        } finally {
            rb.publish(seq);
        }
    }

    public void publishLoad(String graphText) {
        RingBuffer<GraphCommand> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setLoad(graphText, seq);
        } finally {
            rb.publish(seq);
        }
    }

    public GraphCommandHandler handler() {
        return handler;
    }

    public boolean isRunning() {
        return ringBuffer != null;
    }

    private RingBuffer<GraphCommand> requireStarted() {
        RingBuffer<GraphCommand> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("GraphHost is not running");
        return rb;
    }
}
