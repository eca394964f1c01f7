package io.github.manjago.automaton.run;

import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.StepResult;

/**
 * Result of a halted run.
 *
 * @param kind         machine kind that ran
 * @param outcome      ACCEPT or REJECT
 * @param steps        steps taken, the halting one included
 * @param finalStateId state the run halted in (the last state entered, or the one
 *                     that found no transition)
 * @param tape         final tape contents, boundary markers included
 * @param output       emitted output (transducer), empty otherwise
 * @param stack1       stack 1, bottom to top
 * @param stack2       stack 2, bottom to top
 */
public record RunResult(
    MachineKind kind,
    StepResult.Outcome outcome,
    long steps,
    int finalStateId,
    String tape,
    String output,
    String stack1,
    String stack2
) {

    public RunResult {
        if (!outcome.isHalting()) {
            throw new IllegalArgumentException("Run result needs a halting outcome, got " + outcome);
        }
    }

    public boolean accepted() {
        return outcome == StepResult.Outcome.ACCEPT;
    }

    /**
     * Get formatted summary.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s after %,d steps (state %d)", outcome, steps, finalStateId));
        switch (kind) {
            case TURING -> sb.append(", tape ").append(tape);
            case TRANSDUCER -> sb.append(", output \"").append(output).append('"');
            case PUSHDOWN -> sb.append(", stack [").append(stack1).append(']');
            case TWO_STACK_PUSHDOWN -> sb.append(", stacks [").append(stack1).append("] [")
                    .append(stack2).append(']');
            default -> { }
        }
        return sb.toString();
    }
}
