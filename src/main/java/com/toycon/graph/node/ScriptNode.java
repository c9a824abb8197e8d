package com.toycon.graph.node;

import com.toycon.graph.engine.TickContext;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Holds script source on the canvas so it is saved with the graph. It has no
 * ports and does nothing when evaluated; the host compiles its text on demand
 * (see ToyGraph#compileScriptNode), which replaces the whole graph.
 *
 * The script is persisted as Base64 of its UTF-8 bytes so that it fits on one
 * NODE line.
 */
public final class ScriptNode extends AbstractNode {
    private String script;

    public ScriptNode(int id, String script) {
        super(id, NodeKind.SCRIPT, "Script Importer");
        this.script = script == null ? "" : script;
    }

    @Override
    public void evaluate(TickContext ctx) {
        // storage only
    }

    public String script() {
        return script;
    }

    public void setScript(String script) {
        this.script = script == null ? "" : script;
    }

    @Override
    public String data() {
        return Base64.getEncoder().encodeToString(script.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes persisted data back into script text.
     *
     * @throws IllegalArgumentException if the data is not valid Base64.
     */
    static String decode(String data) {
        return new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8);
    }
}
