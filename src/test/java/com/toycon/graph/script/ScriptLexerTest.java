package com.toycon.graph.script;

import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class ScriptLexerTest {

    private static List<String> texts(String source) {
        return ScriptLexer.tokenize(source).stream().map(Token::text).collect(Collectors.toList());
    }

    @Test
    public void testStatement() {
        assertEquals(List.of("var", "x", "=", "2", "+", "3", ";"), texts("var x = 2+3;"));
    }

    @Test
    public void testOperatorRunsAreOneToken() {
        assertEquals(List.of("a", ">=", "b", "&&", "c"), texts("a>=b&&c"));
    }

    @Test
    public void testBracketsAreAlwaysSingleTokens() {
        assertEquals(List.of("beep", "(", "(", "1", ")", ")", ";", "}"), texts("beep((1));}"));
        assertEquals(List.of("x", "=", "(", "-", "1", ")"), texts("x=(-1)"));
    }

    @Test
    public void testTokenTypes() {
        List<Token> tokens = ScriptLexer.tokenize("if (a_1 > 0.5) {");
        assertEquals(Token.Type.IDENTIFIER, tokens.get(0).type());
        assertEquals(Token.Type.PUNCTUATION, tokens.get(1).type());
        assertEquals(Token.Type.IDENTIFIER, tokens.get(2).type());
        assertEquals(Token.Type.OPERATOR, tokens.get(3).type());
        assertEquals(Token.Type.NUMBER, tokens.get(4).type());
    }

    @Test
    public void testPositions() {
        List<Token> tokens = ScriptLexer.tokenize("var x = 1;\n  if (x > 0) {\n}");
        Token ifToken = tokens.get(5);
        assertEquals("if", ifToken.text());
        assertEquals(5, ifToken.index());
        assertEquals(2, ifToken.line());
        assertEquals(3, ifToken.column());
        assertEquals(13, ifToken.offset());

        Token close = tokens.get(tokens.size() - 1);
        assertEquals(3, close.line());
        assertEquals(1, close.column());
    }

    @Test
    public void testEmptyAndBlank() {
        assertTrue(ScriptLexer.tokenize("").isEmpty());
        assertTrue(ScriptLexer.tokenize(" \n\t ").isEmpty());
    }

    @Test
    public void testUnknownCharacter() {
        try {
            ScriptLexer.tokenize("x = 1 @ 2");
            fail("'@' is not a token");
        } catch (ScriptException e) {
            assertEquals(1, e.line());
            assertEquals(7, e.column());
            assertEquals(-1, e.tokenIndex());
        }
    }
}
