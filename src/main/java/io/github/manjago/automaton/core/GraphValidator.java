package io.github.manjago.automaton.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Kind-specific structural checks run before any tape is.
 * <p>
 * Checks, per state:
 * <ul>
 *   <li>every edge target exists;</li>
 *   <li>the action only uses storage the kind declares (stack actions
 *       need a pushdown kind, {@code push2}/{@code pop2} the two-stack one,
 *       tape writes the Turing machine, print the transducer);</li>
 *   <li>pushdown kinds: a push state has no edge on the boundary marker,
 *       because the boundary is reserved for the empty-stack check;</li>
 *   <li>print states have a print symbol and exactly one resolvable successor.</li>
 * </ul>
 * Unreachable states are logged, not rejected.
 */
public class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    /**
     * Validate a graph for a kind.
     *
     * @throws ValidationException naming the first offending state
     */
    public void validate(TransitionGraph graph, MachineKind kind) throws ValidationException {
        if (!graph.contains(TransitionGraph.START_ID)) {
            throw new ValidationException(TransitionGraph.START_ID, "start state is not defined");
        }

        VariantDescriptor variant = kind.descriptor();
        for (State state : graph.states()) {
            checkTargets(graph, state);
            checkStorage(variant, kind, state);
            checkPushOnBoundary(variant, state);
            checkPrint(state);
        }

        List<State> unreachable = graph.unreachable();
        if (!unreachable.isEmpty()) {
            log.warn("{} state(s) unreachable from state {}: {}", unreachable.size(), TransitionGraph.START_ID,
                    unreachable.stream().map(State::id).toList());
        }
        log.debug("Graph valid for {} ({} states)", kind, graph.size());
    }

    private void checkTargets(TransitionGraph graph, State state) throws ValidationException {
        for (Map.Entry<Character, Integer> edge : state.transitions().entrySet()) {
            if (!graph.contains(edge.getValue())) {
                throw new ValidationException(state.id(),
                        "edge on '" + edge.getKey() + "' targets undefined state " + edge.getValue());
            }
        }
    }

    private void checkStorage(VariantDescriptor variant, MachineKind kind, State state) throws ValidationException {
        if (!variant.permits(state.action())) {
            throw new ValidationException(state.id(), "action " + state.action().getDisplayName()
                    + " needs " + state.action().getStorage() + ", which a " + kind.getDisplayName()
                    + " does not have");
        }
    }

    private void checkPushOnBoundary(VariantDescriptor variant, State state) throws ValidationException {
        boolean pushdown = variant.declares(Storage.STACK1) || variant.declares(Storage.STACK2);
        if (pushdown && state.action().isPush() && state.targetOn(Symbols.BOUNDARY) != null) {
            throw new ValidationException(state.id(), "push state has a transition on the boundary marker '"
                    + Symbols.BOUNDARY + "'");
        }
    }

    private void checkPrint(State state) throws ValidationException {
        if (state.action() != Action.PRINT) {
            return;
        }
        if (state.printSymbol() == Symbols.NONE) {
            throw new ValidationException(state.id(), "print state has no print symbol");
        }
        if (state.targetOn(Symbols.PLACEHOLDER) == null && state.transitions().size() != 1) {
            throw new ValidationException(state.id(), "print state needs exactly one successor, has "
                    + state.transitions().size());
        }
    }

    // ========== Helper classes ==========

    /**
     * A graph that the kind cannot run.
     */
    public static class ValidationException extends AutomatonException {
        private final int stateId;
        private final String reason;

        public ValidationException(int stateId, String reason) {
            super("State " + stateId + ": " + reason);
            this.stateId = stateId;
            this.reason = reason;
        }

        public int getStateId() {
            return stateId;
        }

        public String getReason() {
            return reason;
        }
    }
}
