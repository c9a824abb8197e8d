package com.toycon.graph.engine;

/**
 * One wire: output {@code sourceSlot} of node {@code sourceId} feeds input
 * {@code targetSlot} of node {@code targetId}.
 */
public record Connection(int sourceId, int sourceSlot, int targetId, int targetSlot) {
}
