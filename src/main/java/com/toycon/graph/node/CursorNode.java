package com.toycon.graph.node;

import com.toycon.graph.engine.InputSnapshot;
import com.toycon.graph.engine.TickContext;

/**
 * Pointer position normalized to the viewport: X and Y in [0, 1] while the
 * pointer is inside it. Outputs 0 on an axis whose viewport extent is zero.
 */
public final class CursorNode extends AbstractNode {

    public CursorNode(int id) {
        super(id, NodeKind.CURSOR, "Cursor");
        addOutput("X");
        addOutput("Y");
    }

    @Override
    public void evaluate(TickContext ctx) {
        InputSnapshot in = ctx.input();
        out(0, in.viewportWidth() > 0 ? in.pointerX() / in.viewportWidth() : 0.0);
        out(1, in.viewportHeight() > 0 ? in.pointerY() / in.viewportHeight() : 0.0);
    }
}
