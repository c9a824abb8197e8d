package com.toycon.graph.node;

import com.toycon.graph.engine.TickContext;

/** Emits its stored value every tick. */
public final class ConstantNode extends AbstractNode {
    private double storedValue;

    public ConstantNode(int id, double value) {
        super(id, NodeKind.CONSTANT, "Constant");
        this.storedValue = value;
        addOutput("Out");
    }

    @Override
    public void evaluate(TickContext ctx) {
        out(0, storedValue);
    }

    public double storedValue() {
        return storedValue;
    }

    public void setStoredValue(double value) {
        this.storedValue = value;
    }

    @Override
    public String data() {
        return Double.toString(storedValue);
    }
}
