package org.sfgen.emit;

import org.sfgen.context.HeaderInclude;
import org.sfgen.context.SourceFileContext;
import org.sfgen.ir.entities.Constructor;
import org.sfgen.ir.entities.CppClass;
import org.sfgen.ir.entities.Function;
import org.sfgen.ir.entities.MemberVariable;
import org.sfgen.ir.entities.Method;
import org.sfgen.kernel.KernelNamespace;
import org.sfgen.lang.CppType;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.Variable;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Determines which headers the header file and the implementation file include.
 * <p>
 * The header includes all non-private registered includes plus the headers of every type
 * appearing in a declaration. The implementation file includes the private registered
 * includes, the kernels' headers and the headers required by function and method bodies,
 * unless the header already includes them. In header-only mode everything goes into the header.
 */
public class IncludeCollector {

    private final SourceFileContext context;
    private final boolean headerOnly;

    public IncludeCollector(SourceFileContext context, boolean headerOnly) {
        this.context = context;
        this.headerOnly = headerOnly;
    }

    public Set<HeaderFile> headerIncludes() {
        Set<HeaderFile> out = new LinkedHashSet<>();
        for (HeaderInclude incl : context.includes()) {
            if (!incl.privateInclude()) {
                out.add(incl.header());
            }
        }
        for (Function f : context.functions()) {
            addType(out, f.returnType());
            addVariables(out, f.parameters());
        }
        for (CppClass cls : context.classes()) {
            for (MemberVariable mv : cls.memberVariables()) {
                addType(out, mv.type());
            }
            for (Method m : cls.methods()) {
                addType(out, m.returnType());
                addVariables(out, m.parameters());
            }
            for (Constructor c : cls.constructors()) {
                addVariables(out, c.parameters());
            }
        }
        if (headerOnly) {
            out.addAll(definitionIncludes());
        }
        return out;
    }

    /**
     * @return Includes of the implementation file, excluding its own header.
     */
    public Set<HeaderFile> implIncludes() {
        Set<HeaderFile> out = definitionIncludes();
        out.removeAll(headerIncludes());
        return out;
    }

    private Set<HeaderFile> definitionIncludes() {
        Set<HeaderFile> out = new LinkedHashSet<>();
        for (HeaderInclude incl : context.includes()) {
            if (incl.privateInclude()) {
                out.add(incl.header());
            }
        }
        for (KernelNamespace kns : context.kernelNamespaces()) {
            out.addAll(kns.requiredHeaders());
        }
        for (Function f : context.functions()) {
            out.addAll(f.tree().requiredIncludes());
        }
        for (CppClass cls : context.classes()) {
            for (Method m : cls.methods()) {
                out.addAll(m.tree().requiredIncludes());
            }
        }
        return out;
    }

    private static void addVariables(Set<HeaderFile> out, Collection<Variable> vars) {
        vars.forEach(v -> out.addAll(v.includes()));
    }

    private static void addType(Set<HeaderFile> out, CppType type) {
        out.addAll(type.headers());
    }
}
