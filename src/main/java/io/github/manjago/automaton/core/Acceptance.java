package io.github.manjago.automaton.core;

/**
 * Predicate applied when an accepting state is entered.
 */
public enum Acceptance {

    /** Entering an accepting state accepts. */
    FINAL_STATE {
        @Override
        public boolean accepts(RuntimeContext context) {
            return true;
        }
    },

    /** Stack 1 must be empty. */
    EMPTY_STACK {
        @Override
        public boolean accepts(RuntimeContext context) {
            return context.stack1().isEmpty();
        }
    },

    /** Both stacks must be empty. */
    EMPTY_STACKS {
        @Override
        public boolean accepts(RuntimeContext context) {
            return context.stack1().isEmpty() && context.stack2().isEmpty();
        }
    };

    public abstract boolean accepts(RuntimeContext context);
}
