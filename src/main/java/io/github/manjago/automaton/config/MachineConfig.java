package io.github.manjago.automaton.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.automaton.core.PopFailurePolicy;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for running machines.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record MachineConfig(
    // Limits
    long maxSteps,

    // Stacks
    PopFailurePolicy popFailurePolicy,

    // Tracing
    boolean traceEnabled,
    Duration stepDelay,
    int maxTraceEvents,

    // Export
    Path dotDirectory
) {

    public MachineConfig {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("max-steps must be positive: " + maxSteps);
        }
        if (stepDelay.isNegative()) {
            throw new IllegalArgumentException("step-delay must not be negative: " + stepDelay);
        }
        if (maxTraceEvents <= 0) {
            throw new IllegalArgumentException("trace.max-events must be positive: " + maxTraceEvents);
        }
    }

    /**
     * Load default configuration.
     */
    public static MachineConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static MachineConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load()).resolve();
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static MachineConfig fromConfig(Config config) {
        Config c = config.getConfig("automaton");

        return new MachineConfig(
            c.getLong("limits.max-steps"),
            PopFailurePolicy.fromString(c.getString("stack.pop-failure")),
            c.getBoolean("trace.enabled"),
            c.getDuration("trace.step-delay"),
            c.getInt("trace.max-events"),
            Path.of(c.getString("export.dot-directory"))
        );
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxSteps(maxSteps)
                .popFailurePolicy(popFailurePolicy)
                .traceEnabled(traceEnabled)
                .stepDelay(stepDelay)
                .maxTraceEvents(maxTraceEvents)
                .dotDirectory(dotDirectory);
    }

    public static class Builder {
        private long maxSteps = 10_000_000;
        private PopFailurePolicy popFailurePolicy = PopFailurePolicy.REJECT;
        private boolean traceEnabled = false;
        private Duration stepDelay = Duration.ZERO;
        private int maxTraceEvents = 100_000;
        private Path dotDirectory = Path.of("dots");

        public Builder maxSteps(long max) { this.maxSteps = max; return this; }
        public Builder popFailurePolicy(PopFailurePolicy policy) { this.popFailurePolicy = policy; return this; }
        public Builder traceEnabled(boolean enabled) { this.traceEnabled = enabled; return this; }
        public Builder stepDelay(Duration delay) { this.stepDelay = delay; return this; }
        public Builder maxTraceEvents(int max) { this.maxTraceEvents = max; return this; }
        public Builder dotDirectory(Path dir) { this.dotDirectory = dir; return this; }

        public MachineConfig build() {
            return new MachineConfig(
                maxSteps, popFailurePolicy, traceEnabled, stepDelay, maxTraceEvents, dotDirectory
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            MachineConfig:
              limits.max-steps:       %,d
              stack.pop-failure:      %s
              trace.enabled:          %s
              trace.step-delay:       %d ms
              trace.max-events:       %,d
              export.dot-directory:   %s
            """,
            maxSteps,
            popFailurePolicy.name().toLowerCase(),
            traceEnabled,
            stepDelay.toMillis(),
            maxTraceEvents,
            dotDirectory
        );
    }
}
