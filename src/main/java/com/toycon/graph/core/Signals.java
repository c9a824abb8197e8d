package com.toycon.graph.core;

/**
 * Thresholds and helpers shared by every node kind.
 *
 * Signals are plain doubles. Two different notions of "on" exist and both are
 * observable:
 * - truthy: |x| > EPSILON. Used by boolean logic, Select and Divide guards.
 * - high: x > 0. Used by edge detectors and trigger/reset inputs.
 */
public final class Signals {
    private Signals() {
        // Utility class
    }

    /** Magnitude below which a signal counts as zero. */
    public static final double EPSILON = 0.001;

    public static boolean isTruthy(double v) {
        return Math.abs(v) > EPSILON;
    }

    public static boolean isHigh(double v) {
        return v > 0;
    }

    public static double fromBoolean(boolean b) {
        return b ? 1.0 : 0.0;
    }

    public static double clamp(double v, double min, double max) {
        if (v < min)
            return min;
        if (v > max)
            return max;
        return v;
    }
}
