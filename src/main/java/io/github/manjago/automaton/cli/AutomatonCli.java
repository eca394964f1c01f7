package io.github.manjago.automaton.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.automaton.config.MachineConfig;
import io.github.manjago.automaton.core.MachineKind;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Automaton CLI - runs rule files as two-way automata, Turing machines,
 * pushdown automata and transducers.
 *
 * Usage:
 *   automaton run &lt;kind&gt; &lt;rules&gt; &lt;tape&gt;   - Run a tape
 *   automaton check &lt;kind&gt; &lt;rules&gt;        - Validate rules, print the graph
 *   automaton dot &lt;kind&gt; &lt;rules&gt;          - Export the graph as Graphviz DOT
 *   automaton info                         - Show version, kinds and config
 *   automaton &lt;rules&gt; &lt;tape&gt;              - Short form, runs a two-way automaton
 *
 * Exit codes: 0 accept (or success), 1 reject, 2 error.
 */
@Command(
    name = "automaton",
    description = "Automaton interpreter - two-way, Turing, pushdown and transducer machines",
    mixinStandardHelpOptions = true,
    version = AutomatonCli.VERSION,
    subcommands = {
        RunCommand.class,
        CheckCommand.class,
        DotCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class AutomatonCli implements Callable<Integer> {

    public static final String VERSION = "Automaton 1.0.0";

    public static final int EXIT_ACCEPT = 0;
    public static final int EXIT_REJECT = 1;
    public static final int EXIT_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..2", paramLabel = "ARGS",
            description = "Short form: <rules> <tape>, run as a two-way automaton")
    private List<String> args;

    @Override
    public Integer call() {
        if (args == null || args.isEmpty()) {
            // If no subcommand, show help
            spec.commandLine().usage(spec.commandLine().getOut());
            return EXIT_ACCEPT;
        }
        if (args.size() != 2) {
            spec.commandLine().getErr().println("Expected <rules> <tape>, got: " + args);
            spec.commandLine().usage(spec.commandLine().getErr());
            return EXIT_ERROR;
        }

        return spec.commandLine().getSubcommands().get("run")
                .execute(MachineKind.TWO_WAY.getShortName(), args.get(0), args.get(1));
    }

    /**
     * Create the command line with the settings every entry point uses.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new AutomatonCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    /**
     * Defaults, or a HOCON file merged over them.
     */
    static MachineConfig loadConfig(@Nullable Path configFile) {
        if (configFile != null) {
            return MachineConfig.fromFile(configFile);
        }
        return MachineConfig.defaults();
    }

    /**
     * Message for a configuration that could not be loaded.
     */
    static String describe(ConfigException e) {
        return "Bad configuration: " + e.getMessage();
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
