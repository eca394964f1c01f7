package io.github.manjago.automaton.debug;

import io.github.manjago.automaton.core.State;
import io.github.manjago.automaton.core.TransitionGraph;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Textual listing of a transition graph.
 * <p>
 * One line per state, in id order:
 * <pre>
 * 1] dir=R action=Scan [ACCEPT]  (a->2) (#->3)
 * </pre>
 * Isolated states (no edges, not terminal) are left out.
 */
public final class GraphPrinter {

    public static final String HEADER = "=== FSM (node graph) ===";

    private GraphPrinter() {
        // Utility class
    }

    /**
     * Render one state.
     */
    public static @NotNull String describe(State state) {
        StringBuilder sb = new StringBuilder();
        sb.append(state.id()).append("] dir=").append(state.direction().getShortName())
          .append(" action=").append(state.action().getDisplayName());
        if (state.accept()) {
            sb.append(" [ACCEPT]");
        }
        if (state.reject()) {
            sb.append(" [REJECT]");
        }
        sb.append(' ');
        for (Map.Entry<Character, Integer> edge : state.transitions().entrySet()) {
            sb.append(" (").append(edge.getKey()).append("->").append(edge.getValue()).append(')');
        }
        return sb.toString().stripTrailing();
    }

    /**
     * Render the whole graph with a header line.
     */
    public static @NotNull String dump(TransitionGraph graph) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        for (State state : graph.states()) {
            if (state.isIsolated()) {
                continue;
            }
            sb.append(describe(state)).append('\n');
        }
        return sb.toString();
    }
}
