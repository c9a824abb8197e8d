package com.toycon.graph.script;

/**
 * Malformed script. Carries the position of the offending token (or
 * character, for lexical errors).
 */
public class ScriptException extends RuntimeException {
    private final int tokenIndex;
    private final int line;
    private final int column;

    public ScriptException(String message, int tokenIndex, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.tokenIndex = tokenIndex;
        this.line = line;
        this.column = column;
    }

    static ScriptException at(Token t, String message) {
        return new ScriptException(message, t.index(), t.line(), t.column());
    }

    /** Index of the offending token, or -1 for lexical errors. */
    public int tokenIndex() {
        return tokenIndex;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
