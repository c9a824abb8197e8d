package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

/**
 * Accumulates elapsed seconds. A high Reset input zeroes the accumulator
 * before the current tick's delta is added.
 */
public final class TimerNode extends AbstractNode {
    private double elapsed;

    public TimerNode(int id) {
        super(id, NodeKind.TIMER, "Timer");
        addInput("Reset");
        addOutput("Time");
    }

    @Override
    public void evaluate(TickContext ctx) {
        if (Signals.isHigh(in(0)))
            elapsed = 0;
        elapsed += ctx.dt();
        out(0, elapsed);
    }

    public double elapsed() {
        return elapsed;
    }
}
