package com.toycon.graph.script;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits script source into a flat token stream with one combined pattern.
 *
 * <p>
 * Recognized, in order of preference:
 * <ul>
 * <li>operator runs such as {@code =}, {@code >}, {@code &&} (one token per
 * run)</li>
 * <li>single-character brackets and separators {@code ( ) { } , ;}</li>
 * <li>whitespace (dropped)</li>
 * <li>identifiers {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 * <li>numbers {@code [0-9.]+} (validated later, by the parser)</li>
 * </ul>
 * There are no comments and no string literals. Any other character is an
 * error.
 */
public final class ScriptLexer {
    private static final Pattern TOKEN = Pattern.compile(
            "(?<op>[=+\\-*/><&|^!]+)|(?<punct>[(){},;])|(?<ws>\\s+)|(?<id>[A-Za-z_][A-Za-z0-9_]*)|(?<num>[0-9.]+)");

    private ScriptLexer() {
        // Utility class
    }

    /**
     * Tokenizes {@code source}.
     *
     * @throws ScriptException on a character no token class accepts.
     */
    public static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(source);
        int pos = 0;
        int line = 1;
        int lineStart = 0;
        final int n = source.length();

        while (pos < n) {
            m.region(pos, n);
            if (!m.lookingAt())
                throw new ScriptException("Unexpected character '" + source.charAt(pos) + "'", -1, line,
                        pos - lineStart + 1);

            String text = m.group();
            if (m.group("ws") == null) {
                Token.Type type;
                if (m.group("op") != null)
                    type = Token.Type.OPERATOR;
                else if (m.group("punct") != null)
                    type = Token.Type.PUNCTUATION;
                else if (m.group("id") != null)
                    type = Token.Type.IDENTIFIER;
                else
                    type = Token.Type.NUMBER;
                tokens.add(new Token(type, text, tokens.size(), pos, line, pos - lineStart + 1));
            } else {
                for (int i = 0; i < text.length(); i++) {
                    if (text.charAt(i) == '\n') {
                        line++;
                        lineStart = pos + i + 1;
                    }
                }
            }
            pos = m.end();
        }
        return tokens;
    }
}
