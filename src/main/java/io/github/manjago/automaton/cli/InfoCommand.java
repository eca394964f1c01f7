package io.github.manjago.automaton.cli;

import io.github.manjago.automaton.config.MachineConfig;
import io.github.manjago.automaton.core.MachineKind;
import io.github.manjago.automaton.core.VariantDescriptor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Show information about the interpreter.
 */
@Command(
    name = "info",
    description = "Show version, machine kinds and default configuration",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        out.println(AutomatonCli.VERSION);
        out.println();

        out.println("Machine kinds:");
        for (MachineKind kind : MachineKind.values()) {
            VariantDescriptor d = kind.descriptor();
            out.printf("  %-30s %-28s head=%s, accept=%s, storage=%s%n",
                    kind.getDisplayName(), String.join(", ", kind.getNames()),
                    d.headMovement(), d.acceptance(), d.storage());
        }
        out.println();

        out.println("Default Configuration:");
        out.println(MachineConfig.defaults());
        out.flush();

        return AutomatonCli.EXIT_ACCEPT;
    }
}
