package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.Variable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A literal piece of code, annotated with the variables it defines and the variables it reads.
 * <p>
 * The code is not parsed. Callers are responsible for keeping the annotations consistent
 * with the text.
 *
 * @param code The code text.
 * @param defines Variables newly visible to subsequent code in the same scope.
 * @param depends Variables that must be visible before this code.
 * @param includes Headers this code requires.
 */
public record Statements(String code, Set<Variable> defines, Set<Variable> depends, Set<HeaderFile> includes)
        implements CallTreeLeaf {

    public Statements {
        Objects.requireNonNull(code, "code");
        defines = frozen(defines);
        depends = frozen(depends);
        includes = frozen(includes);
    }

    public Statements(String code, Collection<Variable> defines, Collection<Variable> depends) {
        this(code, new LinkedHashSet<>(defines), new LinkedHashSet<>(depends), Set.of());
    }

    /**
     * @param code The code text.
     * @return Statements that neither define nor read any variables.
     */
    public static Statements of(String code) {
        return new Statements(code, Set.of(), Set.of(), Set.of());
    }

    private static <T> Set<T> frozen(Collection<T> items) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(items));
    }

    @Override
    public String render(CodeStyle style) {
        return code;
    }

    @Override
    public Set<HeaderFile> ownIncludes() {
        return includes;
    }
}
