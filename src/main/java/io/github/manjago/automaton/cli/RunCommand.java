package io.github.manjago.automaton.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.automaton.config.MachineConfig;
import io.github.manjago.automaton.core.AutomatonException;
import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.PopFailurePolicy;
import io.github.manjago.automaton.core.Tape;
import io.github.manjago.automaton.debug.DotExporter;
import io.github.manjago.automaton.debug.GraphPrinter;
import io.github.manjago.automaton.debug.PacingListener;
import io.github.manjago.automaton.debug.TracePrinter;
import io.github.manjago.automaton.debug.TraceRecorder;
import io.github.manjago.automaton.run.Machine;
import io.github.manjago.automaton.run.RunResult;
import io.github.manjago.automaton.run.StepListener;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Run a tape through a machine.
 *
 * Examples:
 *   automaton run pda anbn.txt '#aabb#'         # Accept / reject, exit code 0 / 1
 *   automaton run tm rewrite.txt -w ab          # Wrap the tape, print the final tape
 *   automaton run twa pal.txt '#abba#' -t       # Trace every step
 *   automaton run pda anbn.txt '#abb#' --pop-failure error
 */
@Command(
    name = "run",
    description = "Run a tape and report accept / reject",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "KIND", converter = MachineKindConverter.class,
            description = "Machine kind: twa, tm, pda, 2pda, transducer")
    private MachineKind kind;

    @Parameters(index = "1", paramLabel = "RULES", description = "Rule file")
    private Path rulesFile;

    @Parameters(index = "2", paramLabel = "TAPE", description = "Tape wrapped in #, e.g. '#aabb#'")
    private String tape;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"--max-steps"}, description = "Step limit before the run fails as non-halting")
    private Long maxSteps;

    @Option(names = {"--pop-failure"}, description = "Failed pop in pda / 2pda: ${COMPLETION-CANDIDATES}")
    private PopFailurePolicy popFailurePolicy;

    @Option(names = {"-t", "--trace"}, description = "Print every step")
    private boolean trace;

    @Option(names = {"--delay"}, description = "Pause after each traced step (milliseconds)")
    private Long delayMillis;

    @Option(names = {"--table"}, description = "Print a step table after the run")
    private boolean table;

    @Option(names = {"-w", "--wrap"}, description = "Wrap the tape in # before running")
    private boolean wrap;

    @Option(names = {"--dump"}, description = "Print the node graph before running")
    private boolean dump;

    @Option(names = {"--dot"}, description = "Write the graph as Graphviz DOT to this file")
    private Path dotFile;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (result only)")
    private boolean quiet;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        MachineConfig config;
        try {
            config = buildConfig();
        } catch (ConfigException | IllegalArgumentException e) {
            err.println(e instanceof ConfigException ce ? AutomatonCli.describe(ce) : e.getMessage());
            return AutomatonCli.EXIT_ERROR;
        }

        TraceRecorder recorder = null;
        try {
            if (table) {
                recorder = new TraceRecorder(config.maxTraceEvents());
            }
            Machine machine = Machine.load(kind, rulesFile, config);

            if (dump) {
                out.print(GraphPrinter.dump(machine.getGraph()));
            }
            if (dotFile != null) {
                new DotExporter(kind).write(machine.getGraph(), dotFile);
                if (!quiet) {
                    out.println("DOT graph written to " + dotFile);
                }
            }

            String input = wrap ? Tape.wrap(tape) : tape;
            if (!quiet) {
                out.printf("%s, %s%n", kind.getDisplayName(), rulesFile);
            }

            RunResult result = machine.run(input, buildListener(config, out, recorder));

            if (recorder != null) {
                printTable(out, recorder);
            }
            printResult(out, result);
            return result.accepted() ? AutomatonCli.EXIT_ACCEPT : AutomatonCli.EXIT_REJECT;

        } catch (AutomatonException e) {
            if (recorder != null) {
                printTable(out, recorder);
            }
            err.println("Error: " + e.getMessage());
            return AutomatonCli.EXIT_ERROR;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return AutomatonCli.EXIT_ERROR;
        } finally {
            out.flush();
        }
    }

    private MachineConfig buildConfig() {
        MachineConfig.Builder builder = AutomatonCli.loadConfig(configFile).toBuilder();

        // Override from CLI options
        if (maxSteps != null) builder.maxSteps(maxSteps);
        if (popFailurePolicy != null) builder.popFailurePolicy(popFailurePolicy);
        if (trace) builder.traceEnabled(true);
        if (delayMillis != null) builder.stepDelay(Duration.ofMillis(delayMillis));

        return builder.build();
    }

    private StepListener buildListener(MachineConfig config, PrintWriter out, @Nullable TraceRecorder recorder) {
        List<StepListener> listeners = new ArrayList<>();
        if (config.traceEnabled()) {
            listeners.add(new TracePrinter(out).limit(config.maxTraceEvents()));
            if (!config.stepDelay().isZero()) {
                listeners.add(new PacingListener(config.stepDelay()));
            }
        }
        if (recorder != null) {
            listeners.add(recorder);
        }

        if (listeners.isEmpty()) {
            return StepListener.NOOP;
        }
        return listeners.size() == 1
                ? listeners.get(0)
                : StepListener.composite(listeners.toArray(new StepListener[0]));
    }

    private void printTable(PrintWriter out, TraceRecorder recorder) {
        new TracePrinter(out).printSummary(recorder.getFrames());
        if (recorder.getDroppedCount() > 0) {
            out.printf("(%,d more steps not recorded)%n", recorder.getDroppedCount());
        }
    }

    private void printResult(PrintWriter out, RunResult result) {
        if (quiet) {
            out.println(result.outcome());
            return;
        }
        out.printf("Result:      %s (%,d steps, state %d)%n", result.outcome(), result.steps(), result.finalStateId());
        switch (kind) {
            case TURING -> out.printf("Final tape:  %s%n", result.tape());
            case TRANSDUCER -> out.printf("Output:      %s%n", result.output());
            case PUSHDOWN -> out.printf("Stack:       [%s]%n", result.stack1());
            case TWO_STACK_PUSHDOWN -> out.printf("Stacks:      [%s] [%s]%n", result.stack1(), result.stack2());
            default -> { }
        }
    }
}
