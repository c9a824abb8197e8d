package com.toycon.graph.script;

/**
 * One lexeme of script source.
 *
 * @param type   Lexical class.
 * @param text   Exact source text.
 * @param index  Position in the token stream.
 * @param offset Character offset in the source.
 * @param line   1-based line number.
 * @param column 1-based column number.
 */
public record Token(Type type, String text, int index, int offset, int line, int column) {

    public enum Type {
        IDENTIFIER, NUMBER, OPERATOR, PUNCTUATION
    }

    public boolean is(String s) {
        return text.equals(s);
    }

    @Override
    public String toString() {
        return "'" + text + "'@" + line + ":" + column;
    }
}
