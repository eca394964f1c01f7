package io.github.manjago.automaton.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.automaton.config.MachineConfig;
import io.github.manjago.automaton.core.AutomatonException;
import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.debug.DotExporter;
import io.github.manjago.automaton.run.Machine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Export a rule file's graph as Graphviz DOT.
 *
 * Examples:
 *   automaton dot twa pal.txt                # Writes dots/pal.dot
 *   automaton dot pda anbn.txt -o anbn.dot
 *   automaton dot tm rules.txt --stdout | dot -Tpng > rules.png
 */
@Command(
    name = "dot",
    description = "Export the transition graph as Graphviz DOT",
    mixinStandardHelpOptions = true
)
public class DotCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "KIND", converter = MachineKindConverter.class,
            description = "Machine kind: twa, tm, pda, 2pda, transducer")
    private MachineKind kind;

    @Parameters(index = "1", paramLabel = "RULES", description = "Rule file")
    private Path rulesFile;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "Output file (default: <dot-directory>/<rules>.dot)")
    private Path outputFile;

    @Option(names = {"--stdout"}, description = "Print DOT source instead of writing a file")
    private boolean stdout;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            MachineConfig config = AutomatonCli.loadConfig(configFile);
            Machine machine = Machine.load(kind, rulesFile, config);
            DotExporter exporter = new DotExporter(kind);

            if (stdout) {
                out.print(exporter.render(machine.getGraph()));
                return AutomatonCli.EXIT_ACCEPT;
            }

            Path target = outputFile != null ? outputFile : defaultTarget(config);
            exporter.write(machine.getGraph(), target);
            out.println("DOT graph written to " + target);
            return AutomatonCli.EXIT_ACCEPT;

        } catch (AutomatonException | IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return AutomatonCli.EXIT_ERROR;
        } catch (ConfigException e) {
            err.println(AutomatonCli.describe(e));
            return AutomatonCli.EXIT_ERROR;
        } finally {
            out.flush();
        }
    }

    private Path defaultTarget(MachineConfig config) {
        String name = rulesFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return config.dotDirectory().resolve(base + ".dot");
    }
}
