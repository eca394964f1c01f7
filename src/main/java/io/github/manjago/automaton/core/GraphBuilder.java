package io.github.manjago.automaton.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves parsed rules into a {@link TransitionGraph}.
 * <p>
 * Every id referenced anywhere (as source or as target) gets a state,
 * defaulting to direction RIGHT and action SCAN. Rules are then applied in
 * source order:
 * <ol>
 *   <li>accept / reject flags;</li>
 *   <li>direction and action, only when the rule has edges or an explicit action;</li>
 *   <li>push: the gate symbol is the first pair's symbol;</li>
 *   <li>print / write-tape: the literal symbol of the rule;</li>
 *   <li>each {@code (symbol, target)} pair becomes an edge (later pairs win).</li>
 * </ol>
 * Either a complete graph is returned or a {@link GraphException} is thrown.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    /**
     * Build the graph for a parsed rule set.
     *
     * @param ruleSet output of {@link RuleParser}
     * @return graph with state 1 as start
     * @throws GraphException if state 1 is not defined or a state is both accepting and rejecting
     */
    public TransitionGraph build(RuleSet ruleSet) throws GraphException {
        Map<Integer, Draft> drafts = allocate(ruleSet);

        for (RawRule rule : ruleSet.rules()) {
            apply(drafts.get(rule.id()), rule);
        }

        if (!drafts.containsKey(TransitionGraph.START_ID)) {
            throw new GraphException("Start state " + TransitionGraph.START_ID + " is not defined");
        }

        List<State> states = new ArrayList<>(drafts.size());
        for (Draft draft : drafts.values()) {
            if (draft.accept && draft.reject) {
                throw new GraphException("State " + draft.id + " is marked both accept and reject");
            }
            states.add(draft.freeze());
        }

        TransitionGraph graph = TransitionGraph.of(states);
        log.debug("Built graph: {} states, {} edges, max id {}",
                graph.size(), graph.edges().size(), graph.maxId());
        return graph;
    }

    /**
     * One draft per id referenced anywhere, ordered by id.
     */
    private Map<Integer, Draft> allocate(RuleSet ruleSet) {
        Map<Integer, Draft> drafts = new TreeMap<>();
        for (RawRule rule : ruleSet.rules()) {
            drafts.computeIfAbsent(rule.id(), Draft::new);
            for (RawRule.Edge edge : rule.edges()) {
                drafts.computeIfAbsent(edge.target(), Draft::new);
            }
        }
        return drafts;
    }

    private void apply(Draft draft, RawRule rule) {
        if (rule.accept()) {
            draft.accept = true;
        }
        if (rule.reject()) {
            draft.reject = true;
        }

        Action action = rule.action();
        if (!rule.edges().isEmpty() || action != null) {
            draft.direction = rule.direction();
        }

        if (action != null) {
            draft.action = action;
            draft.writeSymbol = Symbols.NONE;
            draft.gateSymbol = Symbols.NONE;
            draft.printSymbol = Symbols.NONE;

            if (action.isPush() && !rule.edges().isEmpty()) {
                draft.gateSymbol = rule.edges().get(0).symbol();
            }
            if (action == Action.PRINT) {
                draft.printSymbol = rule.printSymbol();
            }
            if (action == Action.WRITE_TAPE) {
                draft.writeSymbol = rule.writeSymbol();
            }
        }

        for (RawRule.Edge edge : rule.edges()) {
            Integer previous = draft.transitions.put(edge.symbol(), edge.target());
            if (previous != null && previous != edge.target()) {
                log.warn("Line {}: state {} on '{}' redirected from {} to {}",
                        rule.lineNum(), rule.id(), edge.symbol(), previous, edge.target());
            }
        }
    }

    // ========== Helper classes ==========

    /**
     * Mutable state under construction.
     */
    private static final class Draft {
        private final int id;
        private Direction direction = Direction.RIGHT;
        private Action action = Action.SCAN;
        private char writeSymbol = Symbols.NONE;
        private char gateSymbol = Symbols.NONE;
        private char printSymbol = Symbols.NONE;
        private boolean accept;
        private boolean reject;
        private final Map<Character, Integer> transitions = new LinkedHashMap<>();

        Draft(int id) {
            this.id = id;
        }

        State freeze() {
            return new State(id, direction, action, writeSymbol, gateSymbol, printSymbol,
                    accept, reject, transitions);
        }
    }

    /**
     * Parsed rules that do not form a usable graph.
     */
    public static class GraphException extends AutomatonException {

        public GraphException(String reason) {
            super(reason);
        }

        public String getReason() {
            return getMessage();
        }
    }
}
