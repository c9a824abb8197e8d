package com.toycon.graph.script;

import com.toycon.graph.node.NodeKind;
import com.toycon.graph.node.ScreenNode;

/**
 * Dispatch table for call statements.
 *
 * A call spawns the sink kind, feeds its trigger slot (if it has one) from
 * the effective condition, and wires the arguments positionally into
 * {@code argSlots}.
 */
enum SinkCall {
    BEEP(NodeKind.BEEP_OUTPUT, 0, new int[] { 1, 2 }, "beep"),
    COLOR(NodeKind.COLOR_OUTPUT, -1, new int[] { 0, 1, 2 }, "ColorNode", "color"),
    DRAW(NodeKind.SCREEN, ScreenNode.DRAW_SLOT, new int[] { 0, 1, 2, 3, 4 }, "draw");

    private final NodeKind kind;
    private final int triggerSlot;
    private final int[] argSlots;
    private final String[] names;

    SinkCall(NodeKind kind, int triggerSlot, int[] argSlots, String... names) {
        this.kind = kind;
        this.triggerSlot = triggerSlot;
        this.argSlots = argSlots;
        this.names = names;
    }

    NodeKind kind() {
        return kind;
    }

    /** Input slot fed by the effective condition, or -1. */
    int triggerSlot() {
        return triggerSlot;
    }

    int argSlot(int i) {
        return argSlots[i];
    }

    int maxArgs() {
        return argSlots.length;
    }

    /** Case-sensitive lookup; null for an unknown name. */
    static SinkCall lookup(String name) {
        for (SinkCall c : values())
            for (String n : c.names)
                if (n.equals(name))
                    return c;
        return null;
    }
}
