package org.sfgen.api;

import org.sfgen.context.SourceFileContext;
import org.sfgen.diagnostics.DiagnosticsEngine;

/**
 * Turns a populated {@link SourceFileContext} into header and implementation text.
 */
public interface ISourceFileGenerator {

    /**
     * Runs the postprocessing pass on every entity of the context and prints the files.
     *
     * @param context The file context holding all registered declarations.
     * @return The generated text artifacts.
     * @throws GenerationException if any fatal error occurs; no partial output is returned.
     */
    GeneratedSources generate(SourceFileContext context) throws GenerationException;

    /**
     * @return The diagnostics collected during the last call to {@link #generate(SourceFileContext)}.
     */
    DiagnosticsEngine diagnostics();
}
