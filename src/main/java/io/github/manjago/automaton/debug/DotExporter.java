package io.github.manjago.automaton.debug;

import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.State;
import io.github.manjago.automaton.core.TransitionGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Graphviz DOT rendering of a transition graph.
 * <p>
 * Accepting states are green double circles, rejecting states red octagons.
 * Labels carry the action, and the direction for kinds that move by it.
 * Isolated states are omitted.
 */
public class DotExporter {

    private static final Logger log = LoggerFactory.getLogger(DotExporter.class);

    private final MachineKind kind;

    public DotExporter(MachineKind kind) {
        this.kind = kind;
    }

    /**
     * Render the graph as DOT source.
     */
    public String render(TransitionGraph graph) {
        boolean showDirection = kind.descriptor().usesDirections();

        StringBuilder sb = new StringBuilder();
        sb.append("digraph FSM {\n");
        sb.append("  rankdir=LR; node [shape=circle, fontname=\"Arial\"];\n");

        for (State state : graph.states()) {
            if (state.isIsolated()) {
                continue;
            }
            sb.append(String.format("  %d [label=\"%s\", shape=%s%s];\n",
                    state.id(), label(state, showDirection), shape(state), color(state)));
            for (Map.Entry<Character, Integer> edge : state.transitions().entrySet()) {
                sb.append(String.format("  %d -> %d [label=\"%s\"];\n",
                        state.id(), edge.getValue(), escape(edge.getKey())));
            }
        }

        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Render the graph and write it to a file, creating parent directories.
     */
    public void write(TransitionGraph graph, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, render(graph));
        log.info("DOT graph written to {}", file);
    }

    private String label(State state, boolean showDirection) {
        String action = state.action().getDisplayName();
        if (showDirection) {
            return state.id() + "\\n[" + action + "," + state.direction().getShortName() + "]";
        }
        return state.id() + "\\n[" + action + "]";
    }

    private String shape(State state) {
        if (state.reject()) {
            return "octagon";
        }
        return state.accept() ? "doublecircle" : "circle";
    }

    private String color(State state) {
        if (state.reject()) {
            return ", color=\"red\"";
        }
        return state.accept() ? ", color=\"green\"" : "";
    }

    private String escape(char symbol) {
        return switch (symbol) {
            case '"' -> "\\\"";
            case '\\' -> "\\\\";
            default -> String.valueOf(symbol);
        };
    }
}
