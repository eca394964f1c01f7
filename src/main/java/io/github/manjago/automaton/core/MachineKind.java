package io.github.manjago.automaton.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The supported execution semantics.
 * <p>
 * Each kind is just a name plus a {@link VariantDescriptor}. A new kind is a
 * new constant here; {@link Stepper} does not change.
 */
public enum MachineKind {

    /** Two-way finite automaton over a read-only tape. */
    TWO_WAY("Two-way automaton",
            new VariantDescriptor(HeadMovement.SUCCESSOR_DIRECTION, Acceptance.FINAL_STATE,
                    EnumSet.noneOf(Storage.class), false),
            "twa"),

    /** Turing machine: two-way with a writable tape. */
    TURING("Turing machine",
            new VariantDescriptor(HeadMovement.SUCCESSOR_DIRECTION, Acceptance.FINAL_STATE,
                    EnumSet.of(Storage.WRITABLE_TAPE), false),
            "tm"),

    /** One-way pushdown automaton, accepting on empty stack. */
    PUSHDOWN("Pushdown automaton",
            new VariantDescriptor(HeadMovement.ONE_WAY, Acceptance.EMPTY_STACK,
                    EnumSet.of(Storage.STACK1), false),
            "pda"),

    /** One-way automaton with two stacks, accepting when both are empty. */
    TWO_STACK_PUSHDOWN("Two-stack pushdown automaton",
            new VariantDescriptor(HeadMovement.ONE_WAY, Acceptance.EMPTY_STACKS,
                    EnumSet.of(Storage.STACK1, Storage.STACK2), false),
            "2pda", "two_pda", "twopda"),

    /** One-way transducer emitting symbols to an output sequence. */
    TRANSDUCER("Transducer",
            new VariantDescriptor(HeadMovement.SCAN_ONLY, Acceptance.FINAL_STATE,
                    EnumSet.of(Storage.OUTPUT), true),
            "transducer", "trans", "gtrans", "gt");

    // ========== Fields & Constructor ==========

    private final String displayName;
    private final VariantDescriptor descriptor;
    private final List<String> names;

    MachineKind(String displayName, VariantDescriptor descriptor, String... names) {
        this.displayName = displayName;
        this.descriptor = descriptor;
        this.names = List.of(names);
    }

    public String getDisplayName() {
        return displayName;
    }

    public VariantDescriptor descriptor() {
        return descriptor;
    }

    /**
     * @return command-line names, the first being the canonical one
     */
    public List<String> getNames() {
        return names;
    }

    public String getShortName() {
        return names.get(0);
    }

    // ========== Lookup ==========

    private static final Map<String, MachineKind> BY_NAME = new HashMap<>();

    static {
        for (MachineKind kind : values()) {
            for (String name : kind.names) {
                BY_NAME.put(name, kind);
            }
        }
    }

    /**
     * Find a kind by one of its command-line names (case-insensitive).
     *
     * @return kind or null if unknown
     */
    @Contract(pure = true)
    public static @Nullable MachineKind fromName(String name) {
        return BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    }
}
