package org.sfgen.emit;

import org.sfgen.config.CodeStyle;
import org.sfgen.config.OutputSpec;
import org.sfgen.context.SourceFileContext;
import org.sfgen.ir.Scopes;
import org.sfgen.ir.entities.ClassMember;
import org.sfgen.ir.entities.Constructor;
import org.sfgen.ir.entities.CppClass;
import org.sfgen.ir.entities.Function;
import org.sfgen.ir.entities.FunctionSignature;
import org.sfgen.ir.entities.InClassDefinition;
import org.sfgen.ir.entities.MemberVariable;
import org.sfgen.ir.entities.Method;
import org.sfgen.ir.entities.MethodSignature;
import org.sfgen.ir.entities.Visibility;
import org.sfgen.ir.entities.VisibilityBlock;
import org.sfgen.kernel.KernelHandle;
import org.sfgen.kernel.KernelNamespace;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.SfgException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared printing logic for header and implementation files.
 * <p>
 * A file consists of an optional prelude comment, the file frame (include guard),
 * include directives and the elements of the file, separated by blank lines and
 * optionally wrapped into the outer namespace.
 */
public abstract class AbstractPrinter {

    protected final CodeStyle style;
    protected final OutputSpec output;

    protected AbstractPrinter(CodeStyle style, OutputSpec output) {
        this.style = style;
        this.output = output;
    }

    /**
     * Prints the file for the given context.
     *
     * @param context The file context.
     * @return The file text, ending in a single line break.
     */
    public abstract String print(SourceFileContext context);

    protected String prelude(SourceFileContext context) {
        String text = context.prelude().isEmpty() ? output.prelude() : context.prelude();
        if (text.isEmpty()) {
            return "";
        }
        String body = text.lines().map(l -> l.isEmpty() ? " *" : " * " + l).collect(Collectors.joining("\n"));
        return "/**\n" + body + "\n */\n\n";
    }

    protected String includes(Collection<HeaderFile> headers) {
        if (headers.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (HeaderFile h : headers) {
            sb.append("#include ").append(h.includeArgument()).append('\n');
        }
        return sb.append('\n').toString();
    }

    /**
     * Joins the elements with blank lines and wraps them into the outer namespace, if any.
     *
     * @param context The file context.
     * @param elements The printed elements.
     * @return The file body, ending in a line break.
     */
    protected String body(SourceFileContext context, List<String> elements) {
        String joined = elements.stream().filter(e -> !e.isEmpty()).collect(Collectors.joining("\n\n"));
        String ns = context.outerNamespace();
        if (ns.isEmpty()) {
            return joined.isEmpty() ? "" : joined + "\n";
        }
        return Scopes.braced("namespace " + ns + " ", joined, style) + " // namespace " + ns + "\n";
    }

    protected String kernelNamespace(KernelNamespace kns, boolean inline) {
        List<String> defs = new ArrayList<>();
        for (KernelHandle k : kns.kernels()) {
            String def = k.kernel().renderDefinition(style, k.name());
            defs.add(inline ? "inline " + def : def);
        }
        return Scopes.braced("namespace " + kns.name() + " ", String.join("\n\n", defs), style)
                + " // namespace " + kns.name();
    }

    protected String functionDeclaration(Function f) {
        return FunctionSignature.render(f, false) + ";";
    }

    protected String functionDefinition(Function f, boolean forceInline) {
        return FunctionSignature.render(f, forceInline) + "\n" + Scopes.braced("", f.tree().render(style), style);
    }

    protected String methodDefinition(Method m, boolean inClass) {
        return MethodSignature.render(m, inClass) + "\n" + Scopes.braced("", m.tree().render(style), style);
    }

    /**
     * Prints the full class body.
     *
     * @param cls The class.
     * @param defineAllMethods Whether all methods are defined in the class, not only inline ones.
     * @return The class definition.
     */
    protected String classDefinition(CppClass cls, boolean defineAllMethods) {
        StringBuilder sb = new StringBuilder(cls.keyword().keyword()).append(' ').append(cls.name());
        if (!cls.baseClasses().isEmpty()) {
            sb.append(" : ").append(String.join(", ", cls.baseClasses()));
        }
        sb.append(" {\n");
        List<String> blocks = new ArrayList<>();
        for (VisibilityBlock block : cls.visibilityBlocks()) {
            if (block.isEmpty() && block.visibility() == Visibility.DEFAULT) {
                continue;
            }
            String prefix = block.visibility() == Visibility.DEFAULT ? "" : block.visibility().keyword() + ":\n";
            String members = block.members().stream()
                    .map(m -> classMember(m, defineAllMethods))
                    .collect(Collectors.joining("\n"));
            blocks.add(prefix + style.indent(members));
        }
        if (!blocks.isEmpty()) {
            sb.append(String.join("\n\n", blocks)).append('\n');
        }
        return sb.append("};").toString();
    }

    private String classMember(ClassMember member, boolean defineAllMethods) {
        if (member instanceof MemberVariable mv) {
            String init = mv.defaultInit().map(args -> "{" + String.join(", ", args) + "}").orElse("");
            return mv.type().cString() + " " + mv.name() + init + ";";
        }
        if (member instanceof Constructor c) {
            return constructorDefinition(c);
        }
        if (member instanceof Method m) {
            return m.isInline() || defineAllMethods ? methodDefinition(m, true) : MethodSignature.render(m, true) + ";";
        }
        if (member instanceof InClassDefinition d) {
            return d.text();
        }
        throw new SfgException("Unsupported class member: " + member);
    }

    protected String constructorDefinition(Constructor c) {
        StringBuilder sb = new StringBuilder(c.owningClass().name())
                .append('(').append(FunctionSignature.parameterList(c.parameters())).append(')');
        if (!c.initializers().isEmpty()) {
            sb.append("\n:").append(c.initializers().stream()
                    .map(Constructor.Initializer::toString)
                    .collect(Collectors.joining(",\n")));
        }
        return sb.append('\n').append(Scopes.braced("", c.body(), style)).toString();
    }
}
