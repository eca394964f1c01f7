package io.github.manjago.automaton.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.automaton.core.AutomatonException;
import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.State;
import io.github.manjago.automaton.core.TransitionGraph;
import io.github.manjago.automaton.debug.GraphPrinter;
import io.github.manjago.automaton.run.Machine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Parse, build and validate a rule file without running it.
 *
 * Examples:
 *   automaton check pda anbn.txt        # Print the node graph
 *   automaton check 2pda rules.txt -q   # Exit code only
 */
@Command(
    name = "check",
    description = "Validate a rule file for a machine kind and print its graph",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "KIND", converter = MachineKindConverter.class,
            description = "Machine kind: twa, tm, pda, 2pda, transducer")
    private MachineKind kind;

    @Parameters(index = "1", paramLabel = "RULES", description = "Rule file")
    private Path rulesFile;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (errors only)")
    private boolean quiet;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Machine machine = Machine.load(kind, rulesFile, AutomatonCli.loadConfig(configFile));
            TransitionGraph graph = machine.getGraph();

            if (!quiet) {
                out.print(GraphPrinter.dump(graph));
                List<State> unreachable = graph.unreachable();
                for (State state : unreachable) {
                    out.printf("Warning: state %d is unreachable%n", state.id());
                }
                out.printf("OK: %d states, valid for %s%n", graph.size(), kind.getDisplayName());
            }
            return AutomatonCli.EXIT_ACCEPT;

        } catch (AutomatonException e) {
            err.println("Error: " + e.getMessage());
            return AutomatonCli.EXIT_ERROR;
        } catch (ConfigException e) {
            err.println(AutomatonCli.describe(e));
            return AutomatonCli.EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return AutomatonCli.EXIT_ERROR;
        } finally {
            out.flush();
        }
    }
}
