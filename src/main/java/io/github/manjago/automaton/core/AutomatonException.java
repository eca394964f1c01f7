package io.github.manjago.automaton.core;

/**
 * Base of every error the interpreter reports to callers.
 * <p>
 * Parse, graph and validation errors are raised while a machine is being
 * defined and stop it from ever running; {@link MachineException} is raised
 * during a run. A missing transition is not an error: it rejects the input.
 */
public abstract class AutomatonException extends Exception {

    protected AutomatonException(String message) {
        super(message);
    }

    protected AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
