package com.toycon.graph.script;

import com.toycon.graph.api.Node;
import com.toycon.graph.dsl.ColumnLayout;
import com.toycon.graph.dsl.GraphBuilder;
import com.toycon.graph.engine.Graph;
import com.toycon.graph.node.LogicNode;
import com.toycon.graph.node.MathNode;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Script Compiler -- turns script text into a freshly built {@link Graph}.
 *
 * <p>
 * Parsing and code generation are interleaved: every literal, operator,
 * condition and call spawns nodes through a {@link GraphBuilder} at the moment
 * it is recognized, so the order of the script is the evaluation order of the
 * graph.
 *
 * <h3>Expressions</h3>
 * Binary operators {@code + - * / > <} are folded strictly left to right with
 * no precedence: {@code 2 + 3 * 4} builds {@code (2 + 3) * 4}.
 *
 * <h3>Conditions</h3>
 * Inside {@code if (c) { ... }} the effective condition is {@code c}, or an AND
 * of the enclosing condition and {@code c}. Assigning to an already bound name
 * under a condition spawns a Select of (condition, new value, previous
 * producer), so the conditional becomes a dataflow multiplexer rather than
 * control flow.
 *
 * <h3>Error handling</h3>
 * Grammar errors throw {@link ScriptException} internally; {@link #compile}
 * reports them as a failed {@link CompileResult}. Unrecognized tokens at
 * statement position are skipped. Parentheses, {@code abs(...)} and
 * {@code if} blocks may nest at most {@link #DEFAULT_MAX_NESTING} levels deep
 * unless configured otherwise. The compiler never touches a live graph.
 *
 * Instances are stateless between calls; per-compilation state lives in a
 * private {@code Session}.
 */
@Log4j2
public final class ScriptCompiler {
    public static final int DEFAULT_MAX_NESTING = 256;

    private final Supplier<ColumnLayout> layouts;
    private final int maxNesting;

    public ScriptCompiler() {
        this(ColumnLayout::standard, DEFAULT_MAX_NESTING);
    }

    /**
     * @param layouts    Fresh layout per compilation, so every compiled graph
     *                   starts placing nodes at the same origin.
     * @param maxNesting Deepest allowed nesting of groups and blocks.
     */
    public ScriptCompiler(Supplier<ColumnLayout> layouts, int maxNesting) {
        if (maxNesting < 1)
            throw new IllegalArgumentException("maxNesting must be positive, was " + maxNesting);
        this.layouts = layouts;
        this.maxNesting = maxNesting;
    }

    /**
     * Compiles {@code source} into a new graph.
     *
     * @return success with the graph, final variable bindings and warnings, or
     *         failure with the position of the first error.
     */
    public CompileResult compile(String source) {
        List<String> warnings = new ArrayList<>();
        try {
            List<Token> tokens = ScriptLexer.tokenize(source == null ? "" : source);
            if (log.isDebugEnabled())
                log.debug("Tokens ({}): {}", tokens.size(), tokens);

            Graph graph = new Graph();
            Session session = new Session(tokens, GraphBuilder.on(graph, layouts.get()), warnings, maxNesting);
            session.parseBlock(null, false);

            log.debug("Compiled {} tokens into {} nodes", tokens.size(), graph.size());
            return CompileResult.success(graph, session.symbols.snapshot(), warnings);
        } catch (ScriptException e) {
            return CompileResult.failure(e, warnings);
        }
    }

    /**
     * Parser state for one compilation. The grammar is LL(1) with one extra
     * token of lookahead for IDENT '(' / IDENT '='.
     */
    private static final class Session {
        private final List<Token> tokens;
        private final GraphBuilder g;
        private final List<String> warnings;
        private final SymbolTable symbols = new SymbolTable();
        private final int maxNesting;
        private int pos;
        private int depth;

        Session(List<Token> tokens, GraphBuilder g, List<String> warnings, int maxNesting) {
            this.tokens = tokens;
            this.g = g;
            this.warnings = warnings;
            this.maxNesting = maxNesting;
        }

        // ── Statements ───────────────────────────────────────────────

        void parseBlock(Node condition, boolean nested) {
            while (!atEnd()) {
                Token t = peek();

                if (t.is("}")) {
                    if (!nested)
                        throw ScriptException.at(t, "Unmatched '}'");
                    pos++;
                    return;
                }

                if (t.type() == Token.Type.IDENTIFIER) {
                    switch (t.text()) {
                        case "var", "int", "float" -> {
                            parseDeclaration();
                            continue;
                        }
                        case "if" -> {
                            parseIf(condition);
                            continue;
                        }
                        case "new" -> {
                            pos++;
                            parseCall(expectIdentifier(), condition);
                            continue;
                        }
                        default -> {
                            if (peekIs(1, "(")) {
                                pos++;
                                parseCall(t, condition);
                                continue;
                            }
                            if (peekIs(1, "=")) {
                                pos++;
                                parseAssignment(t, condition);
                                continue;
                            }
                        }
                    }
                }

                // Not a statement start
                log.debug("Skipping token {}", t);
                pos++;
            }

            if (nested) {
                Token last = tokens.get(tokens.size() - 1);
                throw new ScriptException("Missing '}'", tokens.size(), last.line(),
                        last.column() + last.text().length());
            }
        }

        private void parseDeclaration() {
            pos++; // var | int | float
            Token name = expectIdentifier();
            if (peekIs(0, "=")) {
                pos++;
                symbols.bind(name.text(), parseExpression());
            }
            skipSemicolon();
        }

        private void parseIf(Node outer) {
            Token keyword = next();
            enter(keyword);
            expect("(");
            Node cond = parseExpression();
            expect(")");
            expect("{");

            Node effective = outer == null ? cond : g.logic(LogicNode.Operation.AND, outer, cond);
            parseBlock(effective, true);
            depth--;
        }

        private void parseAssignment(Token name, Node condition) {
            pos++; // =
            Node value = parseExpression();
            Node prior = symbols.resolve(name.text());

            if (condition != null && prior != null)
                symbols.bind(name.text(), g.select(condition, value, prior));
            else
                symbols.bind(name.text(), value);
            skipSemicolon();
        }

        private void parseCall(Token name, Node condition) {
            expect("(");
            List<Node> args = new ArrayList<>();
            while (!peekIs(0, ")")) {
                if (atEnd())
                    throw endOfInput("Unterminated argument list");
                args.add(parseExpression());
                if (peekIs(0, ","))
                    pos++;
                else if (!peekIs(0, ")"))
                    throw atCurrent("Expected ',' or ')'");
            }
            expect(")");
            skipSemicolon();

            SinkCall call = SinkCall.lookup(name.text());
            if (call == null) {
                warn(name, "Unknown call '" + name.text() + "'");
                return;
            }

            Node sink = g.spawn(call.kind(), "");
            if (call.triggerSlot() >= 0) {
                Node trigger = condition != null ? condition : g.constant(1.0);
                g.wire(trigger, sink, call.triggerSlot());
            }
            int wired = Math.min(args.size(), call.maxArgs());
            for (int i = 0; i < wired; i++)
                g.wire(args.get(i), sink, call.argSlot(i));
            if (args.size() > wired)
                warn(name, "'" + name.text() + "' ignores " + (args.size() - wired) + " extra argument(s)");
        }

        // ── Expressions ──────────────────────────────────────────────

        Node parseExpression() {
            Node left = parseTerm();
            while (!atEnd()) {
                Token op = peek();
                Node combined;
                switch (op.text()) {
                    case "+" -> combined = binary(MathNode.Operation.ADD, left);
                    case "-" -> combined = binary(MathNode.Operation.SUBTRACT, left);
                    case "*" -> combined = binary(MathNode.Operation.MULTIPLY, left);
                    case "/" -> combined = binary(MathNode.Operation.DIVIDE, left);
                    case ">" -> combined = binary(LogicNode.Operation.GREATER_THAN, left);
                    case "<" -> combined = binary(LogicNode.Operation.LESS_THAN, left);
                    default -> {
                        return left;
                    }
                }
                left = combined;
            }
            return left;
        }

        private Node binary(MathNode.Operation op, Node left) {
            pos++;
            Node right = parseTerm();
            return g.math(op, left, right);
        }

        private Node binary(LogicNode.Operation op, Node left) {
            pos++;
            Node right = parseTerm();
            return g.logic(op, left, right);
        }

        private Node parseTerm() {
            if (atEnd())
                throw endOfInput("Expected an expression");
            Token t = next();

            switch (t.type()) {
                case NUMBER -> {
                    try {
                        return g.constant(Double.parseDouble(t.text()));
                    } catch (NumberFormatException e) {
                        throw ScriptException.at(t, "Malformed number '" + t.text() + "'");
                    }
                }
                case IDENTIFIER -> {
                    Node bound = symbols.resolve(t.text());
                    if (bound != null)
                        return bound;
                    if (t.is("abs") && peekIs(0, "(")) {
                        enter(t);
                        pos++;
                        Node inner = parseExpression();
                        expect(")");
                        depth--;
                        return g.math(MathNode.Operation.ABS, inner);
                    }
                    warn(t, "Unbound identifier '" + t.text() + "' reads as 0");
                    return g.constant(0.0);
                }
                default -> {
                    if (t.is("(")) {
                        enter(t);
                        Node inner = parseExpression();
                        expect(")");
                        depth--;
                        return inner;
                    }
                    throw ScriptException.at(t, "Unexpected token '" + t.text() + "'");
                }
            }
        }

        // ── Token helpers ────────────────────────────────────────────

        private boolean atEnd() {
            return pos >= tokens.size();
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private boolean peekIs(int ahead, String text) {
            int i = pos + ahead;
            return i < tokens.size() && tokens.get(i).is(text);
        }

        private Token next() {
            return tokens.get(pos++);
        }

        private Token expect(String text) {
            if (atEnd())
                throw endOfInput("Expected '" + text + "'");
            Token t = peek();
            if (!t.is(text))
                throw ScriptException.at(t, "Expected '" + text + "' but found '" + t.text() + "'");
            pos++;
            return t;
        }

        private Token expectIdentifier() {
            if (atEnd())
                throw endOfInput("Expected an identifier");
            Token t = peek();
            if (t.type() != Token.Type.IDENTIFIER)
                throw ScriptException.at(t, "Expected an identifier but found '" + t.text() + "'");
            pos++;
            return t;
        }

        // Bounds parser recursion; deeper scripts fail instead of overflowing the stack
        private void enter(Token at) {
            if (++depth > maxNesting)
                throw ScriptException.at(at, "Nesting too deep (limit " + maxNesting + ")");
        }

        private void skipSemicolon() {
            if (peekIs(0, ";"))
                pos++;
        }

        private ScriptException atCurrent(String message) {
            return atEnd() ? endOfInput(message) : ScriptException.at(peek(), message);
        }

        private ScriptException endOfInput(String message) {
            if (tokens.isEmpty())
                return new ScriptException(message, 0, 1, 1);
            Token last = tokens.get(tokens.size() - 1);
            return new ScriptException(message + " (end of script)", tokens.size(), last.line(),
                    last.column() + last.text().length());
        }

        private void warn(Token at, String message) {
            String w = message + " at " + at.line() + ":" + at.column();
            warnings.add(w);
            log.warn(w);
        }
    }
}
