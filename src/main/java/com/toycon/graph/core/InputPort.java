package com.toycon.graph.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input attachment point of a node.
 *
 * An input may be fed by any number of output ports (fan-in). The merged
 * value is the MAXIMUM of all connected sources, and 0.0 when nothing is
 * connected. Sources are kept in connection order; the same output is never
 * held twice.
 */
public final class InputPort {
    private final String name;
    private final int ownerId;
    private final int slot;
    private final List<OutputPort> sources = new ArrayList<>(2);

    public InputPort(String name, int ownerId, int slot) {
        this.name = name;
        this.ownerId = ownerId;
        this.slot = slot;
    }

    public String name() {
        return name;
    }

    /** Id of the node that owns this port. */
    public int ownerId() {
        return ownerId;
    }

    /** Index of this port in the owner's input list. */
    public int slot() {
        return slot;
    }

    /**
     * Merged value of all connected sources.
     *
     * @return 0.0 with no sources, otherwise the largest source value; NaN if
     *         any source is NaN, whatever the connection order.
     */
    public double value() {
        final int n = sources.size();
        if (n == 0)
            return 0.0;
        double max = sources.get(0).value();
        for (int i = 1; i < n; i++)
            max = Math.max(max, sources.get(i).value());
        return max;
    }

    /**
     * Adds a source unless it is already connected.
     *
     * @return true if the source was added.
     */
    public boolean connect(OutputPort source) {
        if (sources.contains(source))
            return false;
        sources.add(source);
        return true;
    }

    public boolean disconnect(OutputPort source) {
        return sources.remove(source);
    }

    /**
     * Removes every source owned by the given node.
     *
     * @return The number of sources removed.
     */
    public int disconnectOwner(int ownerId) {
        int before = sources.size();
        sources.removeIf(s -> s.ownerId() == ownerId);
        return before - sources.size();
    }

    public boolean isConnected() {
        return !sources.isEmpty();
    }

    /** Read-only view of the connected sources, in connection order. */
    public List<OutputPort> sources() {
        return Collections.unmodifiableList(sources);
    }
}
