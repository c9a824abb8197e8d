package com.toycon.graph.wiring;

import com.toycon.graph.engine.InputSnapshot;

/**
 * A mutable command slot in the host's ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every command, carrying work from producer threads to the single consumer
 * thread that owns the graph. The consumer clears each slot after applying
 * it, so script text and input snapshots are not retained.
 *
 * Fields:
 * - type: which operation to apply.
 * - dt / input: payload of a TICK.
 * - text: script source for COMPILE, persisted graph text for LOAD.
 */
public final class GraphCommand {

    public enum Type {
        TICK, COMPILE, LOAD
    }

    private Type type;
    private double dt;
    private InputSnapshot input;
    private String text;
    private long sequenceId;

    /**
     * Configures the slot for one tick.
     *
     * @param dt    Seconds since the previous tick.
     * @param input Host input for the tick.
     * @param seqId Ring buffer sequence (for correlation/logging).
     */
    public void setTick(double dt, InputSnapshot input, long seqId) {
        this.type = Type.TICK;
        this.dt = dt;
        this.input = input;
        this.text = null;
        this.sequenceId = seqId;
    }

    public void setCompile(String script, long seqId) {
        this.type = Type.COMPILE;
        this.dt = 0;
        this.input = null;
        this.text = script;
        this.sequenceId = seqId;
    }

    public void setLoad(String graphText, long seqId) {
        this.type = Type.LOAD;
        this.dt = 0;
        this.input = null;
        this.text = graphText;
        this.sequenceId = seqId;
    }

    public Type type() {
        return type;
    }

    public double dt() {
        return dt;
    }

    public InputSnapshot input() {
        return input;
    }

    public String text() {
        return text;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        type = null;
        dt = 0;
        input = null;
        text = null;
        sequenceId = 0;
    }
}
