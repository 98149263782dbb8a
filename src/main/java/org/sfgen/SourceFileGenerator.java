package org.sfgen;

import org.sfgen.api.GeneratedSources;
import org.sfgen.api.GenerationException;
import org.sfgen.api.ISourceFileGenerator;
import org.sfgen.config.GeneratorConfig;
import org.sfgen.config.OutputSpec;
import org.sfgen.context.SourceFileContext;
import org.sfgen.diagnostics.DiagnosticsEngine;
import org.sfgen.emit.HeaderPrinter;
import org.sfgen.emit.ImplPrinter;
import org.sfgen.ir.entities.CppClass;
import org.sfgen.ir.entities.Function;
import org.sfgen.ir.entities.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main generator implementation. It collects the postprocessing warnings of all
 * entities, prints the header and the implementation file and reports failures as a
 * single {@link GenerationException}. It is not thread-safe.
 */
public class SourceFileGenerator implements ISourceFileGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFileGenerator.class);

    private final GeneratorConfig config;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    public SourceFileGenerator() {
        this(GeneratorConfig.load());
    }

    public SourceFileGenerator(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * Creates a file context matching this generator's configuration.
     *
     * @return A new, empty context.
     */
    public SourceFileContext newContext() {
        SourceFileContext ctx = new SourceFileContext(config.output().namespace(), config.kernelNamespace(),
                config.castIndexingSymbols());
        if (!config.output().prelude().isEmpty()) {
            ctx.appendPrelude(config.output().prelude());
        }
        return ctx;
    }

    public GeneratorConfig config() {
        return config;
    }

    @Override
    public GeneratedSources generate(SourceFileContext context) throws GenerationException {
        diagnostics = new DiagnosticsEngine();
        OutputSpec output = config.output();
        collectWarnings(context);

        // Both files are printed even if one of them fails.
        RuntimeException firstFailure = null;
        String header = null;
        String impl = null;
        try {
            header = new HeaderPrinter(config.codeStyle(), output).print(context);
        } catch (RuntimeException e) {
            diagnostics.reportError(e.getMessage(), output.headerFilename());
            firstFailure = e;
        }
        if (!output.headerOnly()) {
            try {
                impl = new ImplPrinter(config.codeStyle(), output).print(context);
            } catch (RuntimeException e) {
                diagnostics.reportError(e.getMessage(), output.implFilename());
                firstFailure = firstFailure == null ? e : firstFailure;
            }
        }

        if (diagnostics.hasErrors()) {
            throw new GenerationException("Generation of " + output.basename() + " failed:\n"
                    + diagnostics.summary(), firstFailure);
        }
        LOG.debug("Generated {} with {} warning(s)", output.basename(), diagnostics.warnings().size());
        return output.headerOnly()
                ? GeneratedSources.headerOnly(output.headerFilename(), header)
                : new GeneratedSources(output.headerFilename(), header, output.implFilename(), impl);
    }

    private void collectWarnings(SourceFileContext context) {
        for (Function f : context.functions()) {
            f.warnings().forEach(w -> diagnostics.reportWarning(w, f.name()));
        }
        for (CppClass cls : context.classes()) {
            for (Method m : cls.methods()) {
                m.warnings().forEach(w -> diagnostics.reportWarning(w, cls.name() + "::" + m.name()));
            }
        }
    }

    @Override
    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }
}
