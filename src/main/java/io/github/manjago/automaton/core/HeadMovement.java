package io.github.manjago.automaton.core;

/**
 * How the head moves after a transition.
 */
public enum HeadMovement {

    /**
     * Two-way: every step moves by the direction of the state being entered.
     */
    SUCCESSOR_DIRECTION {
        @Override
        public int nextHead(int head, char read, State current, State successor) {
            return head + successor.direction().getDelta();
        }
    },

    /**
     * One-way: advance right unless the boundary marker was read, so the
     * final boundary is never consumed and the last step can empty a stack
     * without moving.
     */
    ONE_WAY {
        @Override
        public int nextHead(int head, char read, State current, State successor) {
            return Symbols.isBoundary(read) ? head : head + 1;
        }
    },

    /**
     * Transducer: advance right only when the current state scanned a
     * non-boundary symbol; print states never move the head.
     */
    SCAN_ONLY {
        @Override
        public int nextHead(int head, char read, State current, State successor) {
            if (current.action() == Action.PRINT || Symbols.isBoundary(read)) {
                return head;
            }
            return head + 1;
        }
    };

    /**
     * @param head      head position the symbol was read at
     * @param read      symbol read
     * @param current   state that read it
     * @param successor state being entered
     * @return new head position (may be out of range; the caller checks)
     */
    public abstract int nextHead(int head, char read, State current, State successor);
}
