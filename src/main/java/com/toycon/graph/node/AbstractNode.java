package com.toycon.graph.node;

import com.toycon.graph.api.Node;
import com.toycon.graph.core.InputPort;
import com.toycon.graph.core.OutputPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract base class for all node kinds.
 *
 * Handles the boilerplate of identity, port construction and layout position
 * so that each kind only declares its ports in its constructor and implements
 * evaluate().
 *
 * Ports are declared once, in constructor order, through
 * {@link #addInput(String)} and {@link #addOutput(String)}, and are never
 * reordered or resized afterwards.
 */
public abstract class AbstractNode implements Node {
    private final int id;
    private final NodeKind kind;
    private final List<InputPort> inputs = new ArrayList<>(3);
    private final List<OutputPort> outputs = new ArrayList<>(1);
    private final List<InputPort> inputsView = Collections.unmodifiableList(inputs);
    private final List<OutputPort> outputsView = Collections.unmodifiableList(outputs);
    private String name;
    private int x;
    private int y;

    protected AbstractNode(int id, NodeKind kind, String name) {
        this.id = id;
        this.kind = kind;
        this.name = name;
    }

    protected final InputPort addInput(String portName) {
        var port = new InputPort(portName, id, inputs.size());
        inputs.add(port);
        return port;
    }

    protected final OutputPort addOutput(String portName) {
        var port = new OutputPort(portName, id, outputs.size());
        outputs.add(port);
        return port;
    }

    /** Merged value of input {@code slot}. */
    protected final double in(int slot) {
        return inputs.get(slot).value();
    }

    /** Writes output {@code slot}. */
    protected final void out(int slot, double value) {
        outputs.get(slot).set(value);
    }

    protected final void rename(String name) {
        this.name = name;
    }

    @Override
    public final int id() {
        return id;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final NodeKind kind() {
        return kind;
    }

    @Override
    public final List<InputPort> inputs() {
        return inputsView;
    }

    @Override
    public final List<OutputPort> outputs() {
        return outputsView;
    }

    @Override
    public String data() {
        return "";
    }

    @Override
    public final int x() {
        return x;
    }

    @Override
    public final int y() {
        return y;
    }

    @Override
    public final void moveTo(int x, int y) {
        this.x = x;
        this.y = y;
    }

    /** Convenience accessor for the first output, 0.0 for sink kinds. */
    public final double outputValue() {
        return outputs.isEmpty() ? 0.0 : outputs.get(0).value();
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
