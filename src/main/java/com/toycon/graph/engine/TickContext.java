package com.toycon.graph.engine;

import java.util.Random;

/**
 * Per-tick runtime context handed to every node's evaluate().
 *
 * Pattern: Flyweight
 * One instance is owned by the Evaluator and refilled before each pass, so a
 * tick allocates nothing. Nodes must not keep a reference to it across ticks.
 */
public final class TickContext {
    private final Random random;
    private double dt;
    private InputSnapshot input = InputSnapshot.EMPTY;
    private long epoch;

    public TickContext(Random random) {
        this.random = random;
    }

    void begin(long epoch, double dt, InputSnapshot input) {
        this.epoch = epoch;
        this.dt = dt;
        this.input = input != null ? input : InputSnapshot.EMPTY;
    }

    /** Elapsed time since the previous tick, in seconds. */
    public double dt() {
        return dt;
    }

    public InputSnapshot input() {
        return input;
    }

    /** Shared, seedable random source. */
    public Random random() {
        return random;
    }

    public long epoch() {
        return epoch;
    }
}
