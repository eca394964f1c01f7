package io.github.manjago.automaton.debug;

import io.github.manjago.automaton.core.RuntimeContext;
import io.github.manjago.automaton.run.StepEvent;

/**
 * Snapshot of a run right after one step.
 *
 * @param event  what the step did
 * @param tape   tape contents after the step
 * @param head   head position after the step
 * @param stack1 stack 1, bottom to top
 * @param stack2 stack 2, bottom to top
 * @param output output emitted so far
 */
public record TraceFrame(
    StepEvent event,
    String tape,
    int head,
    String stack1,
    String stack2,
    String output
) {

    public static TraceFrame capture(StepEvent event, RuntimeContext context) {
        return new TraceFrame(
            event,
            context.tapeContents(),
            context.getHead(),
            RuntimeContext.render(context.stack1()),
            RuntimeContext.render(context.stack2()),
            context.outputContents()
        );
    }
}
