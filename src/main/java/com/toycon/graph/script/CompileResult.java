package com.toycon.graph.script;

import com.toycon.graph.api.Node;
import com.toycon.graph.engine.Graph;

import java.util.List;
import java.util.Map;

/**
 * Outcome of compiling a script: either a complete graph or a positioned
 * error. A failed compilation never carries a partial graph.
 */
public final class CompileResult {
    private final Graph graph;
    private final int nodeCount;
    private final Map<String, Node> variables;
    private final List<String> warnings;
    private final ScriptException error;

    private CompileResult(Graph graph, Map<String, Node> variables, List<String> warnings, ScriptException error) {
        this.graph = graph;
        this.nodeCount = graph == null ? 0 : graph.size();
        this.variables = variables;
        this.warnings = List.copyOf(warnings);
        this.error = error;
    }

    static CompileResult success(Graph graph, Map<String, Node> variables, List<String> warnings) {
        return new CompileResult(graph, variables, warnings, null);
    }

    static CompileResult failure(ScriptException error, List<String> warnings) {
        return new CompileResult(null, Map.of(), warnings, error);
    }

    /**
     * The same successful result, with {@link #graph()} pointing at the graph
     * the compiled nodes were moved into.
     */
    public CompileResult installedIn(Graph live) {
        if (error != null)
            throw new IllegalStateException("Cannot install a failed compilation");
        return new CompileResult(live, variables, warnings, null);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * The compiled graph.
     *
     * @throws IllegalStateException if compilation failed.
     */
    public Graph graph() {
        if (error != null)
            throw new IllegalStateException("Compilation failed: " + error.getMessage());
        return graph;
    }

    /** Number of nodes the script compiled into, or 0 on failure. */
    public int nodeCount() {
        return nodeCount;
    }

    /**
     * Final producer of every variable at the end of the script. The nodes are
     * the ones in {@link #graph()}.
     */
    public Map<String, Node> variables() {
        return variables;
    }

    /** Producer bound to {@code name}, or null. */
    public Node variable(String name) {
        return variables.get(name);
    }

    /** Non-fatal diagnostics (unbound names, unknown calls, extra arguments). */
    public List<String> warnings() {
        return warnings;
    }

    /** The error, or null on success. */
    public ScriptException error() {
        return error;
    }

    public String errorMessage() {
        return error == null ? null : error.getMessage();
    }

    /** 1-based line of the error, or 0 on success. */
    public int errorLine() {
        return error == null ? 0 : error.line();
    }

    /** 1-based column of the error, or 0 on success. */
    public int errorColumn() {
        return error == null ? 0 : error.column();
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "CompileResult[ok, nodes=" + nodeCount + ", warnings=" + warnings.size() + "]"
                : "CompileResult[failed: " + error.getMessage() + "]";
    }
}
