package org.sfgen.diagnostics;

/**
 * A single diagnostic message (error, warning, info) raised while preparing
 * or printing a source file.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param origin The entity or component the message originates from, e.g. a function name.
 */
public record Diagnostic(
        Type type,
        String message,
        String origin
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that aborts generation. */
        ERROR,
        /** A warning that does not prevent generation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, origin, message);
    }
}
