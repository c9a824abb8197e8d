package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

/**
 * Composite colour sink. Clamps R, G and B to [0, 1] each tick and exposes
 * the result for the presentation layer.
 */
public final class ColorOutputNode extends AbstractNode {
    private double red;
    private double green;
    private double blue;

    public ColorOutputNode(int id) {
        super(id, NodeKind.COLOR_OUTPUT, "Color Output");
        addInput("R");
        addInput("G");
        addInput("B");
    }

    @Override
    public void evaluate(TickContext ctx) {
        red = Signals.clamp(in(0), 0, 1);
        green = Signals.clamp(in(1), 0, 1);
        blue = Signals.clamp(in(2), 0, 1);
    }

    public double red() {
        return red;
    }

    public double green() {
        return green;
    }

    public double blue() {
        return blue;
    }

    /** Display colour packed as 0xRRGGBB. */
    public int rgb() {
        return ScreenNode.pack(red, green, blue);
    }
}
