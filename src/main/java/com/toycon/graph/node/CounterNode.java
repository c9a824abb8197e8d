package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

/**
 * Up/down counter driven by rising edges.
 *
 * <ul>
 * <li>Up: +1 when the input goes from low to high between two ticks.</li>
 * <li>Down: -1 on its rising edge.</li>
 * <li>Reset: while high the count is forced to 0 and edges on Up/Down are
 * ignored for that tick. Edge memory is still updated, so an Up held through a
 * reset does not count again when the reset is released.</li>
 * </ul>
 */
public final class CounterNode extends AbstractNode {
    private double value;
    private boolean prevUp;
    private boolean prevDown;

    public CounterNode(int id) {
        this(id, 0.0);
    }

    public CounterNode(int id, double initialValue) {
        super(id, NodeKind.COUNTER, "Counter");
        this.value = initialValue;
        addInput("Up");
        addInput("Down");
        addInput("Reset");
        addOutput("Count");
    }

    @Override
    public void evaluate(TickContext ctx) {
        boolean up = Signals.isHigh(in(0));
        boolean down = Signals.isHigh(in(1));
        if (Signals.isHigh(in(2))) {
            value = 0;
        } else {
            if (up && !prevUp)
                value++;
            if (down && !prevDown)
                value--;
        }
        prevUp = up;
        prevDown = down;
        out(0, value);
    }

    public double value() {
        return value;
    }

    @Override
    public String data() {
        return Double.toString(value);
    }
}
