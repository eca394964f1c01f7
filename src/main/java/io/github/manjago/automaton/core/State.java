package io.github.manjago.automaton.core;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the transition graph.
 * <p>
 * Immutable. Edges map a symbol to the id of the target state in the owning
 * {@link TransitionGraph}; cycles and shared targets are ordinary edges.
 *
 * @param id          positive state id
 * @param direction   movement applied when this state is entered (two-way kinds)
 * @param action      side effect performed on the symbol this state reads
 * @param writeSymbol symbol written by {@link Action#WRITE_TAPE}
 * @param gateSymbol  push/pop fires only on this symbol (push) or stack top (pop);
 *                    {@link Symbols#NONE} means ungated
 * @param printSymbol symbol emitted by {@link Action#PRINT}
 * @param accept      entering this state accepts (subject to the kind's acceptance rule)
 * @param reject      entering this state rejects
 * @param transitions symbol to target id, in registration order
 */
public record State(
    int id,
    Direction direction,
    Action action,
    char writeSymbol,
    char gateSymbol,
    char printSymbol,
    boolean accept,
    boolean reject,
    Map<Character, Integer> transitions
) {

    public State {
        if (id < 1) {
            throw new IllegalArgumentException("State id must be positive: " + id);
        }
        if (accept && reject) {
            throw new IllegalArgumentException("State " + id + " cannot both accept and reject");
        }
        transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
    }

    /**
     * @return target id for the symbol, or null if there is no such transition
     */
    public @Nullable Integer targetOn(char symbol) {
        return transitions.get(symbol);
    }

    public boolean isTerminal() {
        return accept || reject;
    }

    public boolean hasGate() {
        return gateSymbol != Symbols.NONE;
    }

    /**
     * A state with no edges and no terminal flag, i.e. one only ever referenced.
     */
    public boolean isIsolated() {
        return transitions.isEmpty() && !isTerminal();
    }
}
