package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

import java.util.Locale;

/** Outputs 1.0 while the named keyboard key is held. */
public final class KeyNode extends AbstractNode {
    public static final String DEFAULT_KEY = "SPACE";

    private final String key;

    public KeyNode(int id, String key) {
        super(id, NodeKind.KEY, "Key");
        if (key == null || key.isBlank() || key.indexOf(' ') >= 0)
            throw new IllegalArgumentException("Invalid key name: '" + key + "'");
        this.key = key.trim().toUpperCase(Locale.ROOT);
        rename("Key (" + this.key + ")");
        addOutput("Out");
    }

    @Override
    public void evaluate(TickContext ctx) {
        out(0, Signals.fromBoolean(ctx.input().isKeyDown(key)));
    }

    public String key() {
        return key;
    }

    @Override
    public String data() {
        return key;
    }
}
