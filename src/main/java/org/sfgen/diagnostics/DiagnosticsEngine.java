package org.sfgen.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostic messages that occur while generating a source file.
 * <p>
 * Errors are additionally written to the log. Fatal structural errors raised while
 * composing entities are not collected here but thrown as exceptions.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param origin  The origin of the error.
     */
    public void reportError(String message, String origin) {
        LOG.error("{}: {}", origin, message);
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, origin));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param origin  The origin of the warning.
     */
    public void reportWarning(String message, String origin) {
        LOG.debug("{}: {}", origin, message);
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, origin));
    }

    public void reportInfo(String message, String origin) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, message, origin));
    }

    /**
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
