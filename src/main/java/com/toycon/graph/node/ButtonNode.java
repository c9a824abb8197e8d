package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

/**
 * On-canvas push button. The host reports presses by node id in the
 * InputSnapshot.
 *
 * A momentary button outputs 1.0 while pressed. A toggle button flips its
 * latched state on every rising edge of the host press.
 */
public final class ButtonNode extends AbstractNode {
    private final boolean toggle;
    private boolean latched;
    private boolean prevPressed;

    public ButtonNode(int id, boolean toggle) {
        super(id, NodeKind.BUTTON, toggle ? "Button (Toggle)" : "Button");
        this.toggle = toggle;
        addOutput("Out");
    }

    @Override
    public void evaluate(TickContext ctx) {
        boolean pressed = ctx.input().isButtonPressed(id());
        boolean on;
        if (toggle) {
            if (pressed && !prevPressed)
                latched = !latched;
            on = latched;
        } else {
            on = pressed;
        }
        prevPressed = pressed;
        out(0, Signals.fromBoolean(on));
    }

    public boolean isToggle() {
        return toggle;
    }

    @Override
    public String data() {
        return Boolean.toString(toggle);
    }
}
