package com.toycon.graph.dsl;

/**
 * Deterministic column/row placement for generated nodes.
 *
 * Nodes are stacked downwards from the origin in steps of {@code rowStep};
 * once y passes {@code maxY} placement wraps back to the top of the next
 * column, {@code columnStep} to the right. Positions only matter to
 * presentation and persistence, never to evaluation.
 */
public final class ColumnLayout {
    private final int originY;
    private final int rowStep;
    private final int maxY;
    private final int columnStep;
    private int x;
    private int y;

    public ColumnLayout(int originX, int originY, int rowStep, int maxY, int columnStep) {
        if (rowStep <= 0 || columnStep <= 0)
            throw new IllegalArgumentException("Layout steps must be positive");
        this.originY = originY;
        this.rowStep = rowStep;
        this.maxY = maxY;
        this.columnStep = columnStep;
        this.x = originX;
        this.y = originY;
    }

    /** Layout used when no configuration is supplied. */
    public static ColumnLayout standard() {
        return new ColumnLayout(100, 100, 80, 400, 200);
    }

    /**
     * Returns the next free position and advances the cursor.
     *
     * @return {x, y}
     */
    public int[] next() {
        int[] pos = { x, y };
        y += rowStep;
        if (y > maxY) {
            y = originY;
            x += columnStep;
        }
        return pos;
    }
}
