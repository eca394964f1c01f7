package io.github.manjago.automaton.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Side effect a state performs on the symbol it reads.
 * <p>
 * Each action lists the words that select it in a rule file and the
 * storage a machine kind must declare for the action to be legal.
 * {@link #WRITE_TAPE} has no plain word: it is written as
 * {@code write-tape:<sym>} (see {@link RuleParser}).
 */
public enum Action {

    // ========== Read-only ==========

    /** Do nothing. */
    NONE("None", null, "none"),

    /** Read the current symbol; the default action. */
    SCAN("Scan", null, "scan"),

    // ========== Tape ==========

    /** Overwrite the cell under the head with the write symbol. */
    WRITE_TAPE("WTape", Storage.WRITABLE_TAPE),

    // ========== Stacks ==========

    /** Push the gate symbol onto stack 1 (only when the read symbol matches the gate). */
    PUSH1("Push1", Storage.STACK1, "write", "write1", "push", "push1"),

    /** Pop stack 1; skipped on the boundary marker. */
    POP1("Pop1", Storage.STACK1, "read", "read1", "pop", "pop1"),

    PUSH2("Push2", Storage.STACK2, "write2", "push2"),

    POP2("Pop2", Storage.STACK2, "read2", "pop2"),

    // ========== Output ==========

    /** Append the print symbol to the output and move on unconditionally. */
    PRINT("Print", Storage.OUTPUT, "print");

    // ========== Fields & Constructor ==========

    private final String displayName;
    private final @Nullable Storage storage;
    private final String[] words;

    Action(String displayName, @Nullable Storage storage, String... words) {
        this.displayName = displayName;
        this.storage = storage;
        this.words = words;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return storage this action touches, or null for read-only actions
     */
    public @Nullable Storage getStorage() {
        return storage;
    }

    public boolean isPush() {
        return this == PUSH1 || this == PUSH2;
    }

    public boolean isPop() {
        return this == POP1 || this == POP2;
    }

    // ========== Lookup ==========

    private static final Map<String, Action> BY_WORD = new HashMap<>();

    static {
        for (Action action : values()) {
            for (String word : action.words) {
                BY_WORD.put(word, action);
            }
        }
    }

    /**
     * Find the action selected by a rule-file word (case-insensitive).
     *
     * @return action or null if the word is not an action
     */
    @Contract(pure = true)
    public static @Nullable Action fromWord(String word) {
        return BY_WORD.get(word.trim().toLowerCase(Locale.ROOT));
    }
}
