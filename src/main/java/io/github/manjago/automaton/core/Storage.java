package io.github.manjago.automaton.core;

/**
 * Auxiliary storage a machine kind may declare active.
 */
public enum Storage {

    /** Tape cells may be overwritten. */
    WRITABLE_TAPE,

    STACK1,

    STACK2,

    /** Append-only output sequence. */
    OUTPUT
}
