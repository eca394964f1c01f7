package io.github.manjago.automaton.core;

import java.util.Locale;

/**
 * What a failed pop (empty stack, or a gate not matching the top) means.
 */
public enum PopFailurePolicy {

    /** The input is rejected. */
    REJECT,

    /** The machine is defective: {@link MachineException.Kind#STACK_UNDERFLOW} or {@link MachineException.Kind#STACK_MISMATCH}. */
    ERROR;

    /**
     * Parse a configuration value ({@code reject} / {@code error}).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static PopFailurePolicy fromString(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "reject" -> REJECT;
            case "error" -> ERROR;
            default -> throw new IllegalArgumentException(
                    "Unknown pop-failure policy '" + value + "' (expected reject|error)");
        };
    }
}
