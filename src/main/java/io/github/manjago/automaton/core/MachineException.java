package io.github.manjago.automaton.core;

/**
 * Fatal error during a run.
 * <p>
 * Distinct from rejection: a run that throws has neither accepted nor
 * rejected its input.
 */
public class MachineException extends AutomatonException {

    /**
     * What went wrong.
     */
    public enum Kind {
        /** Head left the tape. */
        OUT_OF_BOUNDS,

        /** Pop from an empty stack (under {@link PopFailurePolicy#ERROR}). */
        STACK_UNDERFLOW,

        /** Gated pop found another symbol on top (under {@link PopFailurePolicy#ERROR}). */
        STACK_MISMATCH,

        /** Step cap exhausted. */
        NON_HALTING,

        /** Print state without a resolvable successor or print symbol. */
        MALFORMED_PRINT_STATE
    }

    private final Kind kind;
    private final int stateId;

    public MachineException(Kind kind, int stateId, String details) {
        super(kind + " at state " + stateId + ": " + details);
        this.kind = kind;
        this.stateId = stateId;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStateId() {
        return stateId;
    }
}
