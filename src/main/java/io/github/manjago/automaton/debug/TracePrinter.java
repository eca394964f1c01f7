package io.github.manjago.automaton.debug;

import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.RuntimeContext;
import io.github.manjago.automaton.core.Symbols;
import io.github.manjago.automaton.core.Tape;
import io.github.manjago.automaton.run.RunResult;
import io.github.manjago.automaton.run.StepEvent;
import io.github.manjago.automaton.run.StepListener;

import java.io.PrintWriter;
import java.util.List;

/**
 * Prints run traces in human-readable format.
 * <p>
 * Works on recorded frames ({@link #printAll}, {@link #printSummary}) or
 * live, as a listener passed to the run.
 */
public class TracePrinter implements StepListener {

    private final PrintWriter out;
    private boolean showStacks = true;
    private boolean showOutput = true;
    private long limit = Long.MAX_VALUE;

    private long printed = 0;

    public TracePrinter() {
        this(new PrintWriter(System.out, true));
    }

    public TracePrinter(PrintWriter out) {
        this.out = out;
    }

    public TracePrinter showStacks(boolean show) {
        this.showStacks = show;
        return this;
    }

    public TracePrinter showOutput(boolean show) {
        this.showOutput = show;
        return this;
    }

    /**
     * Stop printing live steps after this many; the halt line is still printed.
     */
    public TracePrinter limit(long maxSteps) {
        this.limit = maxSteps;
        return this;
    }

    /**
     * Print all frames.
     */
    public void printAll(List<TraceFrame> frames) {
        for (TraceFrame frame : frames) {
            printFrame(frame);
        }
    }

    /**
     * Print a single frame: step line, then the tape with the head marked.
     */
    public void printFrame(TraceFrame frame) {
        StepEvent e = frame.event();
        out.printf("%6d | %3d --%s--> %-4s | %-6s | %s%n",
            e.step(), e.stateId(), Symbols.show(e.read()), successor(e),
            e.action().getDisplayName(), outcome(e));
        out.printf("       | %s%n", Tape.highlight(frame.tape(), frame.head()));

        if (showStacks && (!frame.stack1().isEmpty() || !frame.stack2().isEmpty())) {
            out.printf("       | stack1=[%s] stack2=[%s]%n", frame.stack1(), frame.stack2());
        }
        if (showOutput && !frame.output().isEmpty()) {
            out.printf("       | output=\"%s\"%n", frame.output());
        }
    }

    /**
     * Print frame summary (one line per frame).
     */
    public void printSummary(List<TraceFrame> frames) {
        out.println("  Step | State | Read | Next | Head | Outcome");
        out.println("-------+-------+------+------+------+---------");

        for (TraceFrame f : frames) {
            StepEvent e = f.event();
            out.printf("%6d | %5d | %4s | %4s | %4d | %s%n",
                e.step(), e.stateId(), Symbols.show(e.read()), successor(e), e.head(), e.outcome());
        }
    }

    // ========== Live tracing ==========

    @Override
    public void onStart(MachineKind kind, RuntimeContext context) {
        printed = 0;
        out.printf("%s, start: %s%n", kind.getDisplayName(), Tape.highlight(context.tapeContents(), context.getHead()));
    }

    @Override
    public void onStep(StepEvent event, RuntimeContext context) {
        if (printed < limit) {
            printFrame(TraceFrame.capture(event, context));
        } else if (printed == limit) {
            out.printf("... trace limit of %,d steps reached%n", limit);
        }
        printed++;
    }

    @Override
    public void onHalt(RunResult result) {
        out.println(result.summary());
        out.flush();
    }

    // ========== Private helpers ==========

    private String successor(StepEvent e) {
        return e.successorId() < 0 ? "-" : String.valueOf(e.successorId());
    }

    private String outcome(StepEvent e) {
        return switch (e.outcome()) {
            case CONTINUE -> "";
            case ACCEPT -> "ACCEPT";
            case REJECT -> "REJECT";
        };
    }
}
