package io.github.manjago.automaton.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;

import static io.github.manjago.automaton.core.StepResult.Outcome.ACCEPT;
import static io.github.manjago.automaton.core.StepResult.Outcome.REJECT;

/**
 * Executes one transition at a time for every machine kind.
 * <p>
 * The kind only contributes its {@link VariantDescriptor}; the order of a
 * step is the same for all of them:
 * <ol>
 *   <li>head must be on the tape, else {@link MachineException.Kind#OUT_OF_BOUNDS};</li>
 *   <li>boundary shortcut (transducer): a non-print state reading the last
 *       boundary marker accepts;</li>
 *   <li>print states emit their symbol and enter their single successor
 *       without moving the head;</li>
 *   <li>otherwise the edge on the read symbol is taken; no edge rejects;</li>
 *   <li>the current state's action runs (write, push, pop);</li>
 *   <li>the head moves per the descriptor;</li>
 *   <li>the successor's reject / accept flags are checked, accept being
 *       subject to the descriptor's acceptance rule.</li>
 * </ol>
 * Stateless apart from the read-only graph, so one instance can serve
 * concurrent runs.
 */
public final class Stepper {

    private static final Logger log = LoggerFactory.getLogger(Stepper.class);

    private final TransitionGraph graph;

    private final PopFailurePolicy popFailurePolicy;

    public Stepper(TransitionGraph graph) {
        this(graph, PopFailurePolicy.REJECT);
    }

    public Stepper(TransitionGraph graph, PopFailurePolicy popFailurePolicy) {
        this.graph = graph;
        this.popFailurePolicy = popFailurePolicy;
    }

    /**
     * Execute a single step.
     *
     * @param context run state (tape, head, stacks, output)
     * @param current state about to read
     * @return outcome and the state entered
     * @throws MachineException on out-of-bounds head, malformed print state,
     *                          or failed pop under {@link PopFailurePolicy#ERROR}
     */
    public StepResult step(RuntimeContext context, State current) throws MachineException {
        VariantDescriptor variant = context.descriptor();
        int head = context.getHead();

        // Bounds check for head
        if (!context.inBounds(head)) {
            throw outOfBounds(current, head, context);
        }

        char read = context.read();

        if (variant.boundaryShortcut() && Symbols.isBoundary(read)
                && context.atLastIndex() && current.action() != Action.PRINT) {
            log.trace("State {} reached the right boundary at {}: accept", current.id(), head);
            return StepResult.halt(ACCEPT, null, read, head);
        }

        if (current.action() == Action.PRINT) {
            return executePrint(context, variant, current, read, head);
        }

        if (current.targetOn(read) == null) {
            log.trace("State {} has no transition on '{}': reject", current.id(), read);
            return StepResult.halt(REJECT, null, read, head);
        }
        State successor = graph.target(current, read);

        if (!executeAction(context, variant, current, read)) {
            return StepResult.halt(REJECT, null, read, head);
        }

        int nextHead = variant.headMovement().nextHead(head, read, current, successor);
        return enter(context, variant, current, successor, read, head, nextHead);
    }

    /**
     * Evaluate the successor's flags; commit the head move only if the run goes on.
     */
    private StepResult enter(RuntimeContext context, VariantDescriptor variant, State current,
                             State successor, char read, int head, int nextHead) throws MachineException {
        log.trace("{} --{}--> {} (head {} -> {})", current.id(), read, successor.id(), head, nextHead);

        if (successor.reject()) {
            return StepResult.halt(REJECT, successor, read, head);
        }
        if (successor.accept()) {
            boolean accepted = variant.acceptance().accepts(context);
            if (!accepted) {
                log.trace("State {} is accepting but {} does not hold", successor.id(), variant.acceptance());
            }
            return StepResult.halt(accepted ? ACCEPT : REJECT, successor, read, head);
        }

        if (!context.inBounds(nextHead)) {
            throw outOfBounds(current, nextHead, context);
        }
        context.setHead(nextHead);
        return StepResult.proceed(successor, read, head);
    }

    /**
     * PRINT - emit the print symbol and enter the single successor; the head stays.
     */
    private StepResult executePrint(RuntimeContext context, VariantDescriptor variant, State current,
                                    char read, int head) throws MachineException {
        State successor = printSuccessor(current);
        if (successor == null) {
            throw new MachineException(MachineException.Kind.MALFORMED_PRINT_STATE, current.id(),
                    "no successor (expected one '" + Symbols.PLACEHOLDER + "' edge or a single edge)");
        }
        if (current.printSymbol() == Symbols.NONE) {
            throw new MachineException(MachineException.Kind.MALFORMED_PRINT_STATE, current.id(),
                    "no print symbol");
        }

        context.emit(current.printSymbol());
        return enter(context, variant, current, successor, read, head, head);
    }

    private State printSuccessor(State current) {
        Integer targetId = current.targetOn(Symbols.PLACEHOLDER);
        if (targetId == null && current.transitions().size() == 1) {
            targetId = current.transitions().values().iterator().next();
        }
        return targetId != null ? graph.state(targetId) : null;
    }

    /**
     * Run the current state's side effect on the symbol just read.
     *
     * @return false if a failed pop rejects the input
     */
    private boolean executeAction(RuntimeContext context, VariantDescriptor variant, State current, char read)
            throws MachineException {
        Action action = current.action();
        if (!variant.permits(action)) {
            throw new IllegalStateException("Action " + action + " of state " + current.id()
                    + " is not permitted for " + context.getKind());
        }

        switch (action) {
            case NONE, SCAN -> {
                return true;
            }

            case WRITE_TAPE -> {
                if (current.writeSymbol() != Symbols.NONE) {
                    context.write(current.writeSymbol());
                }
                return true;
            }

            case PUSH1, PUSH2 -> {
                executePush(context.stackFor(action), current, read);
                return true;
            }

            case POP1, POP2 -> {
                return executePop(context.stackFor(action), current, read);
            }

            default -> throw new IllegalStateException("Unexpected action " + action + " at state " + current.id());
        }
    }

    /**
     * PUSH - conditional on the gate: fires when no gate is set or the read symbol equals it.
     */
    private void executePush(Deque<Character> stack, State current, char read) {
        if (current.hasGate() && read != current.gateSymbol()) {
            return;
        }
        char symbol = current.hasGate() ? current.gateSymbol() : read;
        stack.push(symbol);
    }

    /**
     * POP - skipped on the boundary marker, whose stack check belongs to acceptance.
     *
     * @return false if the pop failed under {@link PopFailurePolicy#REJECT}
     */
    private boolean executePop(Deque<Character> stack, State current, char read) throws MachineException {
        if (Symbols.isBoundary(read)) {
            return true;
        }
        if (stack.isEmpty()) {
            return popFailed(MachineException.Kind.STACK_UNDERFLOW, current, "pop on empty stack");
        }
        char top = stack.peek();
        if (current.hasGate() && top != current.gateSymbol()) {
            return popFailed(MachineException.Kind.STACK_MISMATCH, current,
                    "expected '" + current.gateSymbol() + "' on top, found '" + top + "'");
        }
        stack.pop();
        return true;
    }

    private boolean popFailed(MachineException.Kind kind, State current, String details) throws MachineException {
        if (popFailurePolicy == PopFailurePolicy.ERROR) {
            throw new MachineException(kind, current.id(), details);
        }
        log.debug("State {}: {} ({}), rejecting", current.id(), details, kind);
        return false;
    }

    private MachineException outOfBounds(State current, int head, RuntimeContext context) {
        return new MachineException(MachineException.Kind.OUT_OF_BOUNDS, current.id(),
                "head " + head + " outside [0, " + (context.tapeLength() - 1) + "]");
    }

    // ========== Getters ==========

    public TransitionGraph getGraph() {
        return graph;
    }

    public PopFailurePolicy getPopFailurePolicy() {
        return popFailurePolicy;
    }
}
