package org.sfgen.emit;

import org.sfgen.config.CodeStyle;
import org.sfgen.config.OutputSpec;
import org.sfgen.context.CustomDefinition;
import org.sfgen.context.Declaration;
import org.sfgen.context.SourceFileContext;
import org.sfgen.ir.entities.CppClass;
import org.sfgen.ir.entities.Function;
import org.sfgen.kernel.KernelNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints the public header.
 * <p>
 * In standalone mode the header declares functions and methods and defines only inline
 * ones; kernels are left to the implementation file. In header-only mode the header
 * holds all kernels and definitions, and free functions are printed {@code inline}.
 */
public class HeaderPrinter extends AbstractPrinter {

    private static final Logger LOG = LoggerFactory.getLogger(HeaderPrinter.class);

    public HeaderPrinter(CodeStyle style, OutputSpec output) {
        super(style, output);
    }

    @Override
    public String print(SourceFileContext context) {
        boolean headerOnly = output.headerOnly();
        LOG.debug("Printing header {}", output.headerFilename());

        StringBuilder code = new StringBuilder(prelude(context));
        if (output.includeGuard() == OutputSpec.IncludeGuard.PRAGMA) {
            code.append("#pragma once\n\n");
        } else {
            code.append("#ifndef ").append(output.guardMacro()).append('\n')
                    .append("#define ").append(output.guardMacro()).append("\n\n");
        }
        code.append(includes(new IncludeCollector(context, headerOnly).headerIncludes()));

        List<String> elements = new ArrayList<>();
        if (headerOnly) {
            for (KernelNamespace kns : context.kernelNamespaces()) {
                if (!kns.isEmpty()) {
                    elements.add(kernelNamespace(kns, true));
                }
            }
        }
        for (Declaration decl : context.declarations()) {
            if (decl instanceof CustomDefinition def) {
                elements.add(def.text());
            } else if (decl instanceof Function f) {
                elements.add(headerOnly || f.isInline() ? functionDefinition(f, headerOnly) : functionDeclaration(f));
            } else if (decl instanceof CppClass cls) {
                elements.add(classDefinition(cls, headerOnly));
            }
        }
        code.append(body(context, elements));

        if (output.includeGuard() == OutputSpec.IncludeGuard.MACRO) {
            code.append("\n#endif // ").append(output.guardMacro()).append('\n');
        }
        return code.toString();
    }
}
