package com.toycon.graph.core;

/**
 * Output attachment point of a node.
 *
 * Holds the last value written by the owning node's evaluate(). The owner is
 * referenced by id only, so ports never form a second ownership edge back to
 * their node.
 */
public final class OutputPort {
    private final String name;
    private final int ownerId;
    private final int slot;
    private double value;

    public OutputPort(String name, int ownerId, int slot) {
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

    /** Index of this port in the owner's output list. */
    public int slot() {
        return slot;
    }

    public double value() {
        return value;
    }

    public void set(double value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "OutputPort[" + ownerId + ":" + slot + " " + name + "=" + value + "]";
    }
}
