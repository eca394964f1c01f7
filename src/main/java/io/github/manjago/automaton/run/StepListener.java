package io.github.manjago.automaton.run;

import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.RuntimeContext;

import java.util.List;

/**
 * Listener for run events.
 *
 * Implement this interface to watch a run step by step, for example
 * to record a trace or slow the run down.
 * The context passed in belongs to the running machine: read it, don't change it.
 */
public interface StepListener {

    /**
     * Called once before the first step.
     *
     * @param kind    machine kind being run
     * @param context initial run state
     */
    default void onStart(MachineKind kind, RuntimeContext context) {}

    /**
     * Called after every completed step, including the halting one.
     *
     * @param event   what the step did
     * @param context run state after the step
     */
    default void onStep(StepEvent event, RuntimeContext context) {}

    /**
     * Called once when the run accepts or rejects.
     * Not called when the run fails with an exception.
     *
     * @param result final result
     */
    default void onHalt(RunResult result) {}

    /**
     * No-op listener that does nothing.
     */
    StepListener NOOP = new StepListener() {};

    /**
     * Listener forwarding every event to each of the given ones, in order.
     */
    static StepListener composite(StepListener... listeners) {
        List<StepListener> all = List.of(listeners);
        return new StepListener() {
            @Override
            public void onStart(MachineKind kind, RuntimeContext context) {
                all.forEach(l -> l.onStart(kind, context));
            }

            @Override
            public void onStep(StepEvent event, RuntimeContext context) {
                all.forEach(l -> l.onStep(event, context));
            }

            @Override
            public void onHalt(RunResult result) {
                all.forEach(l -> l.onHalt(result));
            }
        };
    }
}
