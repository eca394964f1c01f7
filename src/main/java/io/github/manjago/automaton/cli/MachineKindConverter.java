package io.github.manjago.automaton.cli;

import io.github.manjago.automaton.core.MachineKind;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Converts a kind name or alias ({@code twa}, {@code tm}, {@code pda}, {@code 2pda},
 * {@code gt}, ...) to a {@link MachineKind}.
 */
public class MachineKindConverter implements ITypeConverter<MachineKind> {

    @Override
    public MachineKind convert(String value) {
        MachineKind kind = MachineKind.fromName(value);
        if (kind == null) {
            throw new TypeConversionException("Unknown machine kind '" + value + "', expected one of: "
                    + Arrays.stream(MachineKind.values())
                            .map(k -> String.join("/", k.getNames()))
                            .collect(Collectors.joining(", ")));
        }
        return kind;
    }
}
