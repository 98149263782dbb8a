package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.lang.Variable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Renders nothing but requires the given variables, forcing them onto the enclosing function's
 * parameter list.
 *
 * @param depends The variables to require.
 */
public record FunctionParams(Set<Variable> depends) implements CallTreeLeaf {

    public FunctionParams {
        depends = Collections.unmodifiableSet(new LinkedHashSet<>(depends));
    }

    @Override
    public String render(CodeStyle style) {
        return "";
    }
}
