package io.github.manjago.automaton.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Mutable state of one run.
 * <p>
 * Contains:
 * - the tape (boundary-wrapped, fixed length) and the head index
 * - stack 1 and stack 2 (used only by kinds that declare them)
 * - the output sequence (used only by kinds that declare it)
 * <p>
 * Created fresh for every run and owned by it; not thread-safe.
 */
public final class RuntimeContext {

    private final MachineKind kind;

    private final char[] tape;

    /** Always within [0, tape.length - 1] once a step has completed. */
    private int head;

    private final Deque<Character> stack1 = new ArrayDeque<>();
    private final Deque<Character> stack2 = new ArrayDeque<>();

    private final StringBuilder output = new StringBuilder();

    /**
     * Create a context with the head just inside the opening boundary.
     *
     * @param kind machine kind being run
     * @param tape boundary-wrapped tape, e.g. {@code "#abba#"}
     * @throws IllegalArgumentException if the tape is not wrapped
     */
    public RuntimeContext(MachineKind kind, String tape) {
        this.kind = kind;
        this.tape = Tape.parse(tape);
        this.head = Tape.START_HEAD;
    }

    public MachineKind getKind() {
        return kind;
    }

    public VariantDescriptor descriptor() {
        return kind.descriptor();
    }

    // ========== Tape & Head ==========

    public int getHead() {
        return head;
    }

    public void setHead(int head) {
        this.head = head;
    }

    public int tapeLength() {
        return tape.length;
    }

    public boolean inBounds(int index) {
        return index >= 0 && index < tape.length;
    }

    public boolean atLastIndex() {
        return head == tape.length - 1;
    }

    /**
     * Symbol under the head. The caller checks bounds first.
     */
    public char read() {
        return tape[head];
    }

    /**
     * Overwrite the cell under the head.
     */
    public void write(char symbol) {
        tape[head] = symbol;
    }

    public String tapeContents() {
        return new String(tape);
    }

    // ========== Stacks ==========

    public Deque<Character> stack1() {
        return stack1;
    }

    public Deque<Character> stack2() {
        return stack2;
    }

    /**
     * Stack used by a push/pop action.
     */
    public Deque<Character> stackFor(Action action) {
        return switch (action) {
            case PUSH1, POP1 -> stack1;
            case PUSH2, POP2 -> stack2;
            default -> throw new IllegalArgumentException("Not a stack action: " + action);
        };
    }

    // ========== Output ==========

    public void emit(char symbol) {
        output.append(symbol);
    }

    public String outputContents() {
        return output.toString();
    }

    // ========== Utility ==========

    /**
     * Stack contents bottom-to-top, e.g. {@code "aab"} with {@code b} on top.
     */
    public static String render(Deque<Character> stack) {
        StringBuilder sb = new StringBuilder(stack.size());
        Iterator<Character> it = stack.descendingIterator();
        while (it.hasNext()) {
            sb.append(it.next());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RuntimeContext{kind=" + kind
                + ", tape=" + Tape.highlight(new String(tape), head)
                + ", head=" + head
                + ", stack1=" + render(stack1)
                + ", stack2=" + render(stack2)
                + ", output=" + output
                + '}';
    }
}
