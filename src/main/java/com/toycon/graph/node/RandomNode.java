package com.toycon.graph.node;

import com.toycon.graph.engine.TickContext;

/** Emits a uniform value in [0, 1) drawn from the evaluator's random source. */
public final class RandomNode extends AbstractNode {

    public RandomNode(int id) {
        super(id, NodeKind.RANDOM, "Random");
        addOutput("Out");
    }

    @Override
    public void evaluate(TickContext ctx) {
        out(0, ctx.random().nextDouble());
    }
}
