package io.github.manjago.automaton.core;

import org.jetbrains.annotations.Nullable;

/**
 * Result of executing a single step.
 *
 * @param outcome   continue, accept or reject
 * @param successor state entered, or null when the step ended without one
 *                  (missing transition, failed pop, boundary shortcut)
 * @param read      symbol read this step
 * @param head      head position the symbol was read at
 */
public record StepResult(Outcome outcome, @Nullable State successor, char read, int head) {

    /**
     * Outcome of a step.
     */
    public enum Outcome {

        /** Keep stepping from the successor. */
        CONTINUE(false),

        ACCEPT(true),

        REJECT(true);

        private final boolean halting;

        Outcome(boolean halting) {
            this.halting = halting;
        }

        /**
         * @return true if the run stops after this outcome
         */
        public boolean isHalting() {
            return halting;
        }
    }

    public static StepResult proceed(State successor, char read, int head) {
        return new StepResult(Outcome.CONTINUE, successor, read, head);
    }

    public static StepResult halt(Outcome outcome, @Nullable State successor, char read, int head) {
        return new StepResult(outcome, successor, read, head);
    }

    public boolean isHalting() {
        return outcome.isHalting();
    }

    /**
     * @return id of the successor, or -1 if there is none
     */
    public int successorId() {
        return successor != null ? successor.id() : -1;
    }
}
