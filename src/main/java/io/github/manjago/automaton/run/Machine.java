package io.github.manjago.automaton.run;

import io.github.manjago.automaton.config.MachineConfig;
import io.github.manjago.automaton.core.AutomatonException;
import io.github.manjago.automaton.core.GraphBuilder;
import io.github.manjago.automaton.core.GraphValidator;
import io.github.manjago.automaton.core.MachineException;
import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.RuleParser;
import io.github.manjago.automaton.core.RuleSet;
import io.github.manjago.automaton.core.RuntimeContext;
import io.github.manjago.automaton.core.State;
import io.github.manjago.automaton.core.StepResult;
import io.github.manjago.automaton.core.Stepper;
import io.github.manjago.automaton.core.TransitionGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * A validated graph bound to a machine kind, ready to run tapes.
 * <p>
 * Construction validates the graph, so a {@code Machine} that exists can run.
 * Immutable: every {@link #run} gets its own {@link RuntimeContext}, so one
 * instance can run several tapes concurrently.
 */
public final class Machine {

    private static final Logger log = LoggerFactory.getLogger(Machine.class);

    private final MachineKind kind;
    private final TransitionGraph graph;
    private final MachineConfig config;
    private final Stepper stepper;

    /**
     * @throws GraphValidator.ValidationException if the kind cannot run the graph
     */
    public Machine(MachineKind kind, TransitionGraph graph, MachineConfig config)
            throws GraphValidator.ValidationException {
        new GraphValidator().validate(graph, kind);
        this.kind = kind;
        this.graph = graph;
        this.config = config;
        this.stepper = new Stepper(graph, config.popFailurePolicy());
        log.debug("{} ready: {} states, max {} steps, pop failure {}",
                kind.getDisplayName(), graph.size(), config.maxSteps(), config.popFailurePolicy());
    }

    /**
     * Parse, build and validate a rule file.
     */
    public static Machine load(MachineKind kind, Path rules, MachineConfig config) throws AutomatonException {
        return assemble(kind, new RuleParser().parseFile(rules), config);
    }

    /**
     * Parse, build and validate rule text.
     */
    public static Machine fromSource(MachineKind kind, String rules, MachineConfig config)
            throws AutomatonException {
        return assemble(kind, new RuleParser().parse(rules), config);
    }

    private static Machine assemble(MachineKind kind, RuleSet ruleSet, MachineConfig config)
            throws AutomatonException {
        TransitionGraph graph = new GraphBuilder().build(ruleSet);
        return new Machine(kind, graph, config);
    }

    /**
     * Run a tape to completion without a listener.
     *
     * @see #run(String, StepListener)
     */
    public RunResult run(String tape) throws MachineException {
        return run(tape, StepListener.NOOP);
    }

    /**
     * Run a tape until it is accepted or rejected.
     *
     * @param tape     boundary-wrapped tape, e.g. {@code "#aabb#"}
     * @param listener notified of every step
     * @return accept or reject result
     * @throws MachineException on a runtime error, including exhausting the step limit
     * @throws IllegalArgumentException if the tape is not boundary-wrapped
     */
    public RunResult run(String tape, StepListener listener) throws MachineException {
        RuntimeContext context = new RuntimeContext(kind, tape);
        State current = graph.start();
        long maxSteps = config.maxSteps();

        log.info("Running {} on {}", kind.getShortName(), tape);
        listener.onStart(kind, context);

        long steps = 0;
        while (true) {
            if (steps >= maxSteps) {
                log.warn("Step limit {} reached in state {}", maxSteps, current.id());
                throw new MachineException(MachineException.Kind.NON_HALTING, current.id(),
                        String.format("no halt after %,d steps", steps));
            }

            StepResult result = stepper.step(context, current);
            steps++;

            listener.onStep(new StepEvent(steps, current.id(), current.action(), result.read(),
                    result.successorId(), result.head(), result.outcome()), context);

            if (result.isHalting()) {
                int finalStateId = result.successor() != null ? result.successorId() : current.id();
                RunResult runResult = new RunResult(kind, result.outcome(), steps, finalStateId,
                        context.tapeContents(), context.outputContents(),
                        RuntimeContext.render(context.stack1()), RuntimeContext.render(context.stack2()));
                log.info("Run finished: {}", runResult.summary());
                listener.onHalt(runResult);
                return runResult;
            }

            current = result.successor();
        }
    }

    // ========== Getters ==========

    public MachineKind getKind() {
        return kind;
    }

    public TransitionGraph getGraph() {
        return graph;
    }

    public MachineConfig getConfig() {
        return config;
    }
}
