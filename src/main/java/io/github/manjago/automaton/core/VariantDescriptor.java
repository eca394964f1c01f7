package io.github.manjago.automaton.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Everything that distinguishes one machine kind from another.
 * <p>
 * {@link Stepper} reads only this record; it never asks which kind it runs.
 *
 * @param headMovement     head movement after each transition
 * @param acceptance       check applied on entering an accepting state
 * @param storage          storage the kind may touch
 * @param boundaryShortcut accept as soon as a non-print state reads the
 *                         boundary marker at the last tape index
 */
public record VariantDescriptor(
    HeadMovement headMovement,
    Acceptance acceptance,
    Set<Storage> storage,
    boolean boundaryShortcut
) {

    public VariantDescriptor {
        storage = storage.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(storage));
    }

    public boolean declares(Storage s) {
        return storage.contains(s);
    }

    /**
     * @return true if the action's storage (if any) is declared
     */
    public boolean permits(Action action) {
        Storage needed = action.getStorage();
        return needed == null || storage.contains(needed);
    }

    /**
     * Whether state directions matter, i.e. are worth showing in dumps.
     */
    public boolean usesDirections() {
        return headMovement == HeadMovement.SUCCESSOR_DIRECTION;
    }
}
