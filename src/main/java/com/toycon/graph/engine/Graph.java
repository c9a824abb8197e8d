package com.toycon.graph.engine;

import com.toycon.graph.api.Node;
import com.toycon.graph.core.InputPort;
import com.toycon.graph.core.OutputPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The ordered node collection and its fan-in wiring.
 *
 * Ordering:
 * The list order IS the evaluation order. There is no topological sort: the
 * Evaluator walks this list front to back once per tick, so an edge from a
 * later node to an earlier node carries a one-tick delay. Insertion order is
 * therefore part of the observable behaviour and is preserved by persistence.
 *
 * Ownership:
 * The graph owns its nodes. Connections live inside the target InputPorts;
 * removing a node scrubs every input that still references one of its
 * outputs.
 *
 * Thread Safety:
 * Not thread-safe. All mutation and evaluation must happen on the single
 * owning thread (see ToyGraph and GraphHost).
 */
public final class Graph {
    private final List<Node> nodes = new ArrayList<>();
    private final Map<Integer, Node> nodesById = new HashMap<>();
    private int nextId;

    /**
     * Reserves a fresh node id. Factories call this before constructing a node
     * so that its ports can carry the owner id.
     */
    public int allocateId() {
        return nextId++;
    }

    /**
     * Appends a node to the end of the evaluation order.
     *
     * @throws IllegalArgumentException if a node with the same id is present.
     */
    public <N extends Node> N add(N node) {
        Objects.requireNonNull(node, "node");
        if (nodesById.containsKey(node.id()))
            throw new IllegalArgumentException("Duplicate node id: " + node.id());
        nodes.add(node);
        nodesById.put(node.id(), node);
        if (node.id() >= nextId)
            nextId = node.id() + 1;
        return node;
    }

    /**
     * Wires {@code source.outputs[sourceSlot]} into
     * {@code target.inputs[targetSlot]}. A connection already present is left
     * as is.
     *
     * @return true if a new connection was made.
     * @throws IllegalArgumentException  if either node is not in this graph.
     * @throws IndexOutOfBoundsException if a slot is out of range.
     */
    public boolean connect(Node source, int sourceSlot, Node target, int targetSlot) {
        requireOwned(source);
        requireOwned(target);
        Objects.checkIndex(sourceSlot, source.outputs().size());
        Objects.checkIndex(targetSlot, target.inputs().size());
        OutputPort out = source.outputs().get(sourceSlot);
        return target.inputs().get(targetSlot).connect(out);
    }

    /**
     * Id-based variant of {@link #connect(Node, int, Node, int)}.
     *
     * @throws IllegalArgumentException if either id is unknown.
     */
    public boolean connect(int sourceId, int sourceSlot, int targetId, int targetSlot) {
        return connect(require(sourceId), sourceSlot, require(targetId), targetSlot);
    }

    public boolean disconnect(Node source, int sourceSlot, Node target, int targetSlot) {
        requireOwned(source);
        requireOwned(target);
        Objects.checkIndex(sourceSlot, source.outputs().size());
        Objects.checkIndex(targetSlot, target.inputs().size());
        return target.inputs().get(targetSlot).disconnect(source.outputs().get(sourceSlot));
    }

    /**
     * Removes a node and every connection that reads from it.
     *
     * @return true if the node was present.
     */
    public boolean remove(Node node) {
        if (node == null || nodesById.get(node.id()) != node)
            return false;
        nodes.remove(node);
        nodesById.remove(node.id());
        for (Node n : nodes)
            for (InputPort in : n.inputs())
                in.disconnectOwner(node.id());
        return true;
    }

    public boolean remove(int nodeId) {
        return remove(nodesById.get(nodeId));
    }

    /** Drops every node and resets id allocation. */
    public void clear() {
        nodes.clear();
        nodesById.clear();
        nextId = 0;
    }

    /**
     * Replaces this graph's content with the content of {@code other}, which
     * is emptied. Used to install a freshly compiled or loaded graph in one
     * step.
     */
    public void replaceWith(Graph other) {
        if (other == this)
            return;
        clear();
        for (Node n : other.nodes)
            add(n);
        nextId = Math.max(nextId, other.nextId);
        other.clear();
    }

    /** Returns the node with the given id, or null. */
    public Node node(int id) {
        return nodesById.get(id);
    }

    /**
     * Returns the node with the given id.
     *
     * @throws IllegalArgumentException if no such node exists.
     */
    public Node require(int id) {
        Node n = nodesById.get(id);
        if (n == null)
            throw new IllegalArgumentException("Unknown node id: " + id);
        return n;
    }

    /** Position of the node in evaluation order, or -1. */
    public int indexOf(Node node) {
        return nodes.indexOf(node);
    }

    public boolean contains(Node node) {
        return node != null && nodesById.get(node.id()) == node;
    }

    /** Nodes in evaluation order (read-only view). */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Lists every connection, grouped by target node in evaluation order, then
     * by target slot, then by connection order.
     */
    public List<Connection> connections() {
        List<Connection> out = new ArrayList<>();
        for (Node target : nodes) {
            List<InputPort> inputs = target.inputs();
            for (int slot = 0; slot < inputs.size(); slot++) {
                for (OutputPort src : inputs.get(slot).sources())
                    out.add(new Connection(src.ownerId(), src.slot(), target.id(), slot));
            }
        }
        return out;
    }

    /** Collects every node of the given type, in evaluation order. */
    public <T extends Node> List<T> nodesOfType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Node n : nodes)
            if (type.isInstance(n))
                out.add(type.cast(n));
        return out;
    }

    private void requireOwned(Node node) {
        if (!contains(node))
            throw new IllegalArgumentException("Node is not part of this graph: "
                    + (node == null ? "null" : node.name() + "#" + node.id()));
    }
}
