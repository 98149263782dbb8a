package org.sfgen.emit;

import org.sfgen.config.CodeStyle;
import org.sfgen.config.OutputSpec;
import org.sfgen.context.Declaration;
import org.sfgen.context.SourceFileContext;
import org.sfgen.ir.entities.CppClass;
import org.sfgen.ir.entities.Function;
import org.sfgen.kernel.KernelNamespace;
import org.sfgen.lang.SfgException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints the implementation file: its own header, the private includes, the kernel
 * namespaces and every function and method body not already defined in the header.
 */
public class ImplPrinter extends AbstractPrinter {

    private static final Logger LOG = LoggerFactory.getLogger(ImplPrinter.class);

    public ImplPrinter(CodeStyle style, OutputSpec output) {
        super(style, output);
    }

    @Override
    public String print(SourceFileContext context) {
        if (output.headerOnly()) {
            throw new SfgException("No implementation file is printed in header-only mode.");
        }
        LOG.debug("Printing implementation file {}", output.implFilename());

        StringBuilder code = new StringBuilder(prelude(context));
        code.append("#include \"").append(output.headerFilename()).append("\"\n\n");
        code.append(includes(new IncludeCollector(context, false).implIncludes()));

        List<String> elements = new ArrayList<>();
        for (KernelNamespace kns : context.kernelNamespaces()) {
            if (!kns.isEmpty()) {
                elements.add(kernelNamespace(kns, false));
            }
        }
        for (Declaration decl : context.declarations()) {
            if (decl instanceof Function f && !f.isInline()) {
                elements.add(functionDefinition(f, false));
            } else if (decl instanceof CppClass cls) {
                elements.add(cls.methods().stream()
                        .filter(m -> !m.isInline())
                        .map(m -> methodDefinition(m, false))
                        .collect(Collectors.joining("\n\n")));
            }
        }
        code.append(body(context, elements));
        return code.toString();
    }
}
