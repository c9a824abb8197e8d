package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

import java.util.Arrays;

/**
 * Fixed-size pixel buffer sink.
 *
 * Each tick: if Clear is high the buffer is blanked to black; then if Draw is
 * high the pixel at (int X, int Y) is painted with the clamped R, G, B colour,
 * provided it lies inside the buffer. Pixels are packed 0xRRGGBB, row-major.
 */
public final class ScreenNode extends AbstractNode {
    public static final int WIDTH = 64;
    public static final int HEIGHT = 64;

    /** Input slot of the Draw trigger. */
    public static final int DRAW_SLOT = 5;

    private final int[] pixels = new int[WIDTH * HEIGHT];

    public ScreenNode(int id) {
        super(id, NodeKind.SCREEN, "Screen");
        addInput("X");
        addInput("Y");
        addInput("R");
        addInput("G");
        addInput("B");
        addInput("Draw");
        addInput("Clear");
    }

    @Override
    public void evaluate(TickContext ctx) {
        if (Signals.isHigh(in(6)))
            Arrays.fill(pixels, 0);

        if (Signals.isHigh(in(DRAW_SLOT))) {
            int px = (int) in(0);
            int py = (int) in(1);
            if (px >= 0 && px < WIDTH && py >= 0 && py < HEIGHT)
                pixels[py * WIDTH + px] = pack(in(2), in(3), in(4));
        }
    }

    /** Packed colour at (x, y). */
    public int pixel(int x, int y) {
        return pixels[y * WIDTH + x];
    }

    /** Copy of the whole buffer. */
    public int[] pixels() {
        return pixels.clone();
    }

    static int pack(double r, double g, double b) {
        int ri = (int) Math.round(Signals.clamp(r, 0, 1) * 255);
        int gi = (int) Math.round(Signals.clamp(g, 0, 1) * 255);
        int bi = (int) Math.round(Signals.clamp(b, 0, 1) * 255);
        return (ri << 16) | (gi << 8) | bi;
    }
}
