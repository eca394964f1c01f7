package io.github.manjago.automaton.core;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One parsed rule line, before ids are resolved into states.
 *
 * @param lineNum     1-based source line
 * @param id          source state id
 * @param direction   direction from the mode (RIGHT when the line has none)
 * @param action      action from the mode, or null for accept/reject lines
 * @param edges       {@code (symbol, target)} pairs in source order
 * @param accept      line marks the state accepting
 * @param reject      line marks the state rejecting
 * @param printSymbol symbol emitted by a print line, {@link Symbols#NONE} otherwise
 * @param writeSymbol symbol written by a write-tape line, {@link Symbols#NONE} otherwise
 */
public record RawRule(
    int lineNum,
    int id,
    Direction direction,
    @Nullable Action action,
    List<Edge> edges,
    boolean accept,
    boolean reject,
    char printSymbol,
    char writeSymbol
) {

    public RawRule {
        edges = List.copyOf(edges);
    }

    /**
     * A single {@code (symbol,target)} pair.
     */
    public record Edge(char symbol, int target) {}

    static RawRule accept(int lineNum, int id) {
        return new RawRule(lineNum, id, Direction.RIGHT, null, List.of(), true, false, Symbols.NONE, Symbols.NONE);
    }

    static RawRule reject(int lineNum, int id) {
        return new RawRule(lineNum, id, Direction.RIGHT, null, List.of(), false, true, Symbols.NONE, Symbols.NONE);
    }

    static RawRule print(int lineNum, int id, char printSymbol, int target) {
        return new RawRule(lineNum, id, Direction.RIGHT, Action.PRINT,
                List.of(new Edge(Symbols.PLACEHOLDER, target)), false, false, printSymbol, Symbols.NONE);
    }

    static RawRule transitions(int lineNum, int id, Direction direction, Action action,
                               List<Edge> edges, char writeSymbol) {
        return new RawRule(lineNum, id, direction, action, edges, false, false, Symbols.NONE, writeSymbol);
    }
}
