package io.github.manjago.automaton.core;

/**
 * Reserved symbols of the tape alphabet.
 */
public final class Symbols {

    /** Sentinel at both ends of every tape. */
    public static final char BOUNDARY = '#';

    /** Edge key of a print state's unconditional successor. */
    public static final char PLACEHOLDER = '_';

    /** "No symbol configured" for write, gate and print parameters. */
    public static final char NONE = '\0';

    private Symbols() {
        // Utility class
    }

    public static boolean isBoundary(char symbol) {
        return symbol == BOUNDARY;
    }

    /**
     * Printable form of a symbol for dumps and traces.
     */
    public static String show(char symbol) {
        return symbol == NONE ? "-" : String.valueOf(symbol);
    }
}
