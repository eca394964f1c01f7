package io.github.manjago.automaton.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Arena of states addressed by id.
 * <p>
 * Slot {@code i} holds the state with id {@code i}; unused ids are empty
 * slots. State 1 is the start state. Read-only after construction and safe to
 * share between runs on different threads.
 */
public final class TransitionGraph {

    public static final int START_ID = 1;

    /** Largest state id an arena accepts. */
    public static final int MAX_ID = 1_000_000;

    /** Index = state id; index 0 is always empty. */
    private final List<State> slots;
    private final int stateCount;

    private TransitionGraph(List<State> slots, int stateCount) {
        this.slots = Collections.unmodifiableList(slots);
        this.stateCount = stateCount;
    }

    /**
     * Place states into an arena by id.
     * <p>
     * Does not check edge targets or the start state; {@link GraphBuilder}
     * and {@link GraphValidator} do.
     *
     * @throws IllegalArgumentException on duplicate ids or ids outside {@code 1..MAX_ID}
     */
    public static TransitionGraph of(Collection<State> states) {
        int maxId = START_ID;
        for (State s : states) {
            if (s.id() < 1 || s.id() > MAX_ID) {
                throw new IllegalArgumentException("State id out of range 1.." + MAX_ID + ": " + s.id());
            }
            maxId = Math.max(maxId, s.id());
        }

        List<State> slots = new ArrayList<>(Collections.nCopies(maxId + 1, null));
        for (State s : states) {
            if (slots.get(s.id()) != null) {
                throw new IllegalArgumentException("Duplicate state id: " + s.id());
            }
            slots.set(s.id(), s);
        }
        return new TransitionGraph(slots, states.size());
    }

    /**
     * @throws IllegalStateException if the arena has no state 1
     */
    public @NotNull State start() {
        State start = slots.get(START_ID);
        if (start == null) {
            throw new IllegalStateException("Start state " + START_ID + " is not defined");
        }
        return start;
    }

    /**
     * @return state with the id, or null if the id is unused or out of range
     */
    public @Nullable State state(int id) {
        if (id < 0 || id >= slots.size()) {
            return null;
        }
        return slots.get(id);
    }

    /**
     * Resolve an edge target. Edge targets always exist in a built graph.
     */
    public @NotNull State target(State from, char symbol) {
        Integer targetId = from.targetOn(symbol);
        State target = targetId != null ? state(targetId) : null;
        if (target == null) {
            throw new IllegalStateException("State " + from.id() + " has no resolvable target on '" + symbol + "'");
        }
        return target;
    }

    public boolean contains(int id) {
        return state(id) != null;
    }

    /**
     * @return largest id slot in the arena
     */
    public int maxId() {
        return slots.size() - 1;
    }

    public int size() {
        return stateCount;
    }

    /**
     * All defined states, ordered by id.
     */
    public List<State> states() {
        List<State> result = new ArrayList<>(stateCount);
        for (State s : slots) {
            if (s != null) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * All labeled edges, ordered by source id then registration order.
     */
    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>();
        for (State s : states()) {
            for (Map.Entry<Character, Integer> e : s.transitions().entrySet()) {
                result.add(new Edge(s.id(), e.getKey(), e.getValue()));
            }
        }
        return result;
    }

    /**
     * Ids of states reachable from the start state (start included).
     */
    public BitSet reachable() {
        BitSet seen = new BitSet(slots.size());
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(START_ID);
        seen.set(START_ID);

        while (!queue.isEmpty()) {
            State s = state(queue.poll());
            if (s == null) {
                continue;
            }
            for (int target : s.transitions().values()) {
                if (!seen.get(target)) {
                    seen.set(target);
                    queue.add(target);
                }
            }
        }
        return seen;
    }

    /**
     * Defined states that cannot be reached from the start state.
     */
    public List<State> unreachable() {
        BitSet seen = reachable();
        List<State> result = new ArrayList<>();
        for (State s : states()) {
            if (!seen.get(s.id())) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * A labeled edge for exporters.
     */
    public record Edge(int from, char symbol, int to) {}
}
