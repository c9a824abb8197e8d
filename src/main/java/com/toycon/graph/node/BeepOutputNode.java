package com.toycon.graph.node;

import com.toycon.graph.core.Signals;
import com.toycon.graph.engine.TickContext;

/**
 * One-shot sound trigger sink.
 *
 * <p>
 * {@link #shouldPlay()} is true only on the tick where Trigger rises from low
 * to high. Pitch (clamped to [-1, 1]) and Volume (clamped to [0, 1]) are
 * latched on that tick and keep their values until the next trigger, so a
 * host reading them later in the same frame sees what was asked for.
 *
 * <p>
 * The engine never plays audio; the host reads the side channel after each
 * tick.
 */
public final class BeepOutputNode extends AbstractNode {
    public static final String DEFAULT_SOUND = "KICK-01";
    public static final double MIN_PITCH = -1.0;
    public static final double MAX_PITCH = 1.0;

    private final String soundName;
    private boolean shouldPlay;
    private boolean prevTrigger;
    private double pitch;
    private double volume = 1.0;

    public BeepOutputNode(int id, String soundName) {
        super(id, NodeKind.BEEP_OUTPUT, "Beep");
        if (soundName == null || soundName.isBlank() || soundName.indexOf(' ') >= 0)
            throw new IllegalArgumentException("Invalid sound name: '" + soundName + "'");
        this.soundName = soundName;
        addInput("Trigger");
        addInput("Pitch");
        addInput("Volume");
    }

    @Override
    public void evaluate(TickContext ctx) {
        boolean trigger = Signals.isHigh(in(0));
        shouldPlay = trigger && !prevTrigger;
        if (shouldPlay) {
            pitch = Signals.clamp(in(1), MIN_PITCH, MAX_PITCH);
            volume = Signals.clamp(in(2), 0, 1);
        }
        prevTrigger = trigger;
    }

    public boolean shouldPlay() {
        return shouldPlay;
    }

    public double pitch() {
        return pitch;
    }

    public double volume() {
        return volume;
    }

    public String soundName() {
        return soundName;
    }

    @Override
    public String data() {
        return soundName;
    }
}
