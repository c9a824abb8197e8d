package com.toycon.graph.util;

import com.toycon.graph.api.TickListener;

/**
 * Profiles tick passes: wall time per tick plus the slowest node of the most
 * recent tick, so a host frame budget overrun can be traced to one node.
 *
 * <p>
 * A tick that stops at a failing node still counts towards the timings and
 * is recorded in {@link #failedTicks()}. Failures are not logged here; the
 * evaluator owns that.
 */
public final class TickLatencyListener implements TickListener {
    private long startedAt;
    private long ticks;
    private long failedTicks;
    private long sumNanos;
    private long fastestNanos = Long.MAX_VALUE;
    private long slowestNanos;
    private long lastTickNanos;
    private int lastNodesEvaluated;

    // Hottest node of the tick in progress
    private int scanIndex = -1;
    private String scanName;
    private long scanNanos = -1;
    private boolean scanFailed;

    // Hottest node of the last completed tick
    private int hotIndex = -1;
    private String hotName;
    private long hotNanos;

    private String lastFailedNode;

    @Override
    public void onTickStart(long epoch) {
        scanIndex = -1;
        scanName = null;
        scanNanos = -1;
        scanFailed = false;
        startedAt = System.nanoTime();
    }

    @Override
    public void onNodeEvaluated(long epoch, int index, String nodeName, long durationNanos) {
        if (durationNanos > scanNanos) {
            scanNanos = durationNanos;
            scanIndex = index;
            scanName = nodeName;
        }
    }

    @Override
    public void onNodeError(long epoch, int index, String nodeName, Throwable error) {
        scanFailed = true;
        lastFailedNode = nodeName + " [" + index + "]";
    }

    @Override
    public void onTickEnd(long epoch, int nodesEvaluated) {
        long elapsed = System.nanoTime() - startedAt;
        ticks++;
        if (scanFailed)
            failedTicks++;
        sumNanos += elapsed;
        fastestNanos = Math.min(fastestNanos, elapsed);
        slowestNanos = Math.max(slowestNanos, elapsed);
        lastTickNanos = elapsed;
        lastNodesEvaluated = nodesEvaluated;

        hotIndex = scanIndex;
        hotName = scanName;
        hotNanos = Math.max(scanNanos, 0);
    }

    public long ticks() {
        return ticks;
    }

    /** Ticks that stopped at a failing node. */
    public long failedTicks() {
        return failedTicks;
    }

    public long lastTickNanos() {
        return lastTickNanos;
    }

    public int lastNodesEvaluated() {
        return lastNodesEvaluated;
    }

    public double averageNanos() {
        return ticks == 0 ? 0.0 : (double) sumNanos / ticks;
    }

    public long fastestNanos() {
        return ticks == 0 ? 0 : fastestNanos;
    }

    public long slowestNanos() {
        return slowestNanos;
    }

    /** List index of the slowest node in the last tick, or -1 if none ran. */
    public int slowestNodeIndex() {
        return hotIndex;
    }

    /** Name of the slowest node in the last tick, or null if none ran. */
    public String slowestNodeName() {
        return hotName;
    }

    public long slowestNodeNanos() {
        return hotNanos;
    }

    /** "name [index]" of the node that failed most recently, or null. */
    public String lastFailedNode() {
        return lastFailedNode;
    }

    public void reset() {
        ticks = failedTicks = sumNanos = slowestNanos = lastTickNanos = hotNanos = 0;
        fastestNanos = Long.MAX_VALUE;
        lastNodesEvaluated = 0;
        hotIndex = -1;
        hotName = null;
        lastFailedNode = null;
    }

    @Override
    public String toString() {
        String hot = hotIndex < 0 ? "none" : String.format("%s [%d] %.1fus", hotName, hotIndex, hotNanos / 1000.0);
        return String.format("%d ticks (%d failed), avg %.1fus, last %.1fus over %d nodes, slowest node %s",
                ticks, failedTicks, averageNanos() / 1000.0, lastTickNanos / 1000.0, lastNodesEvaluated, hot);
    }
}
