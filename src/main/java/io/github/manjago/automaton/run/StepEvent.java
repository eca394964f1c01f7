package io.github.manjago.automaton.run;

import io.github.manjago.automaton.core.Action;
import io.github.manjago.automaton.core.StepResult;

/**
 * One completed step, as reported to a {@link StepListener}.
 *
 * @param step        1-based step number
 * @param stateId     state that read the symbol
 * @param action      action of that state
 * @param read        symbol under the head
 * @param successorId state entered, or -1 when the step ended without one
 * @param head        head position the symbol was read at
 * @param outcome     continue, accept or reject
 */
public record StepEvent(
    long step,
    int stateId,
    Action action,
    char read,
    int successorId,
    int head,
    StepResult.Outcome outcome
) {

    public boolean isHalting() {
        return outcome.isHalting();
    }
}
