package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.Variable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Renders nothing and requires no variables; only contributes headers.
 *
 * @param includes The required headers.
 */
public record RequireIncludes(Set<HeaderFile> includes) implements CallTreeLeaf {

    public RequireIncludes {
        includes = Collections.unmodifiableSet(new LinkedHashSet<>(includes));
    }

    @Override
    public Set<Variable> depends() {
        return Set.of();
    }

    @Override
    public Set<HeaderFile> ownIncludes() {
        return includes;
    }

    @Override
    public String render(CodeStyle style) {
        return "";
    }
}
