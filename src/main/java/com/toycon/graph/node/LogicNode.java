package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

/**
 * Boolean logic and comparison. Outputs 1.0 or 0.0.
 *
 * AND, OR, XOR and NOT read their inputs as truthy (|x| > epsilon).
 * GREATER_THAN and LESS_THAN compare the raw values. NOT has a single input.
 */
public final class LogicNode extends AbstractNode {

    public enum Operation {
        AND("And"), OR("Or"), XOR("Xor"), NOT("Not"), GREATER_THAN("GreaterThan"), LESS_THAN("LessThan");

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
            throw new IllegalArgumentException("Unknown logic operation: " + text);
        }
    }

    private final Operation op;

    public LogicNode(int id, Operation op) {
        super(id, NodeKind.LOGIC, "Logic (" + op.label() + ")");
        this.op = op;
        addInput("In 1");
        if (op != Operation.NOT)
            addInput("In 2");
        addOutput("Result");
    }

    @Override
    public void evaluate(TickContext ctx) {
        double a = in(0);
        boolean result = switch (op) {
            case NOT -> !Signals.isTruthy(a);
            case AND -> Signals.isTruthy(a) && Signals.isTruthy(in(1));
            case OR -> Signals.isTruthy(a) || Signals.isTruthy(in(1));
            case XOR -> Signals.isTruthy(a) ^ Signals.isTruthy(in(1));
            case GREATER_THAN -> a > in(1);
            case LESS_THAN -> a < in(1);
        };
        out(0, Signals.fromBoolean(result));
    }

    public Operation operation() {
        return op;
    }

    @Override
    public String data() {
        return op.label();
    }
}
