package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

/**
 * Arithmetic node, and the Select multiplexer used by the script compiler to
 * merge conditional assignments.
 *
 * <h3>Ports by operation</h3>
 * <ul>
 * <li>ABS: A</li>
 * <li>SELECT: Cond, True, False</li>
 * <li>all others: A, B</li>
 * </ul>
 *
 * <h3>Degenerate input</h3>
 * DIVIDE yields 0 when |B| is not above {@link Signals#EPSILON}; it never
 * produces an infinity or NaN.
 */
public final class MathNode extends AbstractNode {

    public enum Operation {
        ADD("Add"), SUBTRACT("Subtract"), MULTIPLY("Multiply"), DIVIDE("Divide"), ABS("Abs"), SELECT("Select");

        private final String label;

        Operation(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static Operation parse(String text) {
            for (Operation op : values()) {
                if (op.name().equalsIgnoreCase(text) || op.label.equalsIgnoreCase(text))
                    return op;
            }
            throw new IllegalArgumentException("Unknown math operation: " + text);
        }
    }

    private final Operation op;

    public MathNode(int id, Operation op) {
        super(id, NodeKind.MATH, "Math (" + op.label() + ")");
        this.op = op;
        switch (op) {
            case ABS -> addInput("A");
            case SELECT -> {
                addInput("Cond");
                addInput("True");
                addInput("False");
            }
            default -> {
                addInput("A");
                addInput("B");
            }
        }
        addOutput("Result");
    }

    @Override
    public void evaluate(TickContext ctx) {
        out(0, compute());
    }

    private double compute() {
        switch (op) {
            case ABS:
                return Math.abs(in(0));
            case SELECT:
                return Signals.isTruthy(in(0)) ? in(1) : in(2);
            default:
                break;
        }
        double a = in(0);
        double b = in(1);
        return switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> Signals.isTruthy(b) ? a / b : 0.0;
            default -> 0.0;
        };
    }

    public Operation operation() {
        return op;
    }

    @Override
    public String data() {
        return op.label();
    }
}
