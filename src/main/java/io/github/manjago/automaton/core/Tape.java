package io.github.manjago.automaton.core;

/**
 * Helpers for boundary-wrapped tapes.
 */
public final class Tape {

    /** Index where the head starts: just inside the opening boundary. */
    public static final int START_HEAD = 1;

    private Tape() {
        // Utility class
    }

    /**
     * Check that a tape is wrapped by the boundary marker.
     *
     * @param tape tape text such as {@code "#abba#"}
     * @return the tape cells
     * @throws IllegalArgumentException if the tape is not wrapped
     */
    public static char[] parse(String tape) {
        String s = tape.trim();
        if (s.length() < 2 || !Symbols.isBoundary(s.charAt(0)) || !Symbols.isBoundary(s.charAt(s.length() - 1))) {
            throw new IllegalArgumentException("Tape must be wrapped with " + Symbols.BOUNDARY + "..."
                    + Symbols.BOUNDARY + ": '" + tape + "'");
        }
        return s.toCharArray();
    }

    /**
     * Wrap interior symbols with the boundary marker.
     */
    public static String wrap(String interior) {
        return Symbols.BOUNDARY + interior + Symbols.BOUNDARY;
    }

    /**
     * Interior symbols of a wrapped tape.
     */
    public static String interior(String tape) {
        return tape.substring(1, tape.length() - 1);
    }

    /**
     * Render a tape with the cell under the head in brackets: {@code #a[b]ba#}.
     * An out-of-range head leaves the tape unmarked.
     */
    public static String highlight(CharSequence tape, int head) {
        if (head < 0 || head >= tape.length()) {
            return tape.toString();
        }
        StringBuilder sb = new StringBuilder(tape.length() + 2);
        sb.append(tape, 0, head);
        sb.append('[').append(tape.charAt(head)).append(']');
        sb.append(tape, head + 1, tape.length());
        return sb.toString();
    }
}
