package io.github.manjago.automaton.core;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Head movement direction of a state.
 */
public enum Direction {

    LEFT(-1, "L"),
    RIGHT(+1, "R");

    private final int delta;
    private final String shortName;

    Direction(int delta, String shortName) {
        this.delta = delta;
        this.shortName = shortName;
    }

    public int getDelta() {
        return delta;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * Parse a direction word ({@code left}, {@code l}, {@code right}, {@code r}).
     *
     * @return direction or null if the word is not a direction
     */
    public static @Nullable Direction fromWord(String word) {
        return switch (word.trim().toLowerCase(Locale.ROOT)) {
            case "left", "l" -> LEFT;
            case "right", "r" -> RIGHT;
            default -> null;
        };
    }
}
