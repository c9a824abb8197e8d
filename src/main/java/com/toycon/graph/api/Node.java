package com.toycon.graph.api;

import com.toycon.graph.core.InputPort;
import com.toycon.graph.core.OutputPort;
import com.toycon.graph.engine.TickContext;
import com.toycon.graph.node.NodeKind;

import java.util.List;

/**
 * A node in the signal graph.
 *
 * This interface represents the fundamental unit of computation in the ToyCon
 * engine. Every node -- whether it reads host input, transforms signals, or
 * drives a sink such as a beeper or a pixel screen -- implements this
 * interface.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every node has a stable integer id, unique within its graph.
 * Ids are used for wiring, persistence (NODE/CONN lines) and for host input
 * routing (button presses are addressed by node id).
 *
 * 2. Ports: A node owns an ordered list of input ports and an ordered list of
 * output ports, both fixed at construction. Slot indices used by
 * {@code Graph.connect} refer to positions in these lists.
 *
 * 3. Computation: {@link #evaluate(TickContext)} reads the current input
 * values and writes the output ports. It is called exactly once per tick by
 * the Evaluator, in graph list order.
 *
 * 4. Kind: Every node belongs to exactly one {@link NodeKind} of the closed
 * kind set, and can describe its kind-specific data for persistence.
 */
public interface Node {

    /**
     * Returns the stable id of this node within its graph.
     *
     * @return The node id.
     */
    int id();

    /**
     * Returns the human-readable display name (e.g. "Math (ADD)").
     *
     * @return The display name.
     */
    String name();

    /**
     * Returns the kind discriminant of this node.
     *
     * @return The node kind.
     */
    NodeKind kind();

    /**
     * Ordered input ports. The returned list is unmodifiable.
     */
    List<InputPort> inputs();

    /**
     * Ordered output ports. The returned list is unmodifiable.
     */
    List<OutputPort> outputs();

    /**
     * Recomputes the node's outputs from its inputs and private state.
     *
     * Ordering Contract:
     * Inputs wired from a node placed earlier in the graph carry this tick's
     * value; inputs wired from a node placed later carry the previous tick's
     * value. Implementations must not assume any other ordering.
     *
     * @param ctx The tick context (time delta, host input, random source).
     */
    void evaluate(TickContext ctx);

    /**
     * Returns the kind-specific data persisted after the position on a NODE
     * line. Never null; empty when the kind carries no data.
     *
     * @return The serialized kind data.
     */
    String data();

    /**
     * Layout column used by presentation collaborators.
     */
    int x();

    /**
     * Layout row used by presentation collaborators.
     */
    int y();

    /**
     * Moves the node on the presentation canvas. Has no effect on evaluation.
     */
    void moveTo(int x, int y);
}
