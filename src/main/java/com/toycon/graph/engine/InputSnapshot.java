package com.toycon.graph.engine;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable snapshot of host input state, supplied once per tick.
 *
 * Sensor nodes (cursor, key, button) read only from this snapshot; the engine
 * never polls devices itself.
 *
 * @param pointerX       Pointer x in viewport pixels.
 * @param pointerY       Pointer y in viewport pixels.
 * @param viewportWidth  Viewport width in pixels (0 if unknown).
 * @param viewportHeight Viewport height in pixels (0 if unknown).
 * @param pressedButtons Ids of button nodes the host currently reports pressed.
 * @param keysDown       Names of keys currently held, upper case (e.g. "SPACE").
 */
public record InputSnapshot(double pointerX, double pointerY, double viewportWidth, double viewportHeight,
        Set<Integer> pressedButtons, Set<String> keysDown) {

    /** No pointer, no buttons, no keys. */
    public static final InputSnapshot EMPTY = new InputSnapshot(0, 0, 0, 0, Set.of(), Set.of());

    public InputSnapshot {
        pressedButtons = Set.copyOf(pressedButtons);
        Set<String> keys = new HashSet<>();
        for (String k : keysDown)
            keys.add(normalizeKey(k));
        keysDown = Set.copyOf(keys);
    }

    public boolean isButtonPressed(int nodeId) {
        return pressedButtons.contains(nodeId);
    }

    public boolean isKeyDown(String key) {
        return keysDown.contains(normalizeKey(key));
    }

    public InputSnapshot withPointer(double x, double y, double width, double height) {
        return new InputSnapshot(x, y, width, height, pressedButtons, keysDown);
    }

    public InputSnapshot withButtonPressed(int nodeId) {
        Set<Integer> buttons = new HashSet<>(pressedButtons);
        buttons.add(nodeId);
        return new InputSnapshot(pointerX, pointerY, viewportWidth, viewportHeight, buttons, keysDown);
    }

    public InputSnapshot withKeyDown(String key) {
        Set<String> keys = new HashSet<>(keysDown);
        keys.add(key);
        return new InputSnapshot(pointerX, pointerY, viewportWidth, viewportHeight, pressedButtons, keys);
    }

    static String normalizeKey(String key) {
        return key.trim().toUpperCase(Locale.ROOT);
    }
}
