package org.sfgen.lang;

import java.util.Set;

/**
 * A piece of code together with the variables it reads and the headers it needs.
 *
 * @param code The code string.
 * @param depends Variables the code depends on.
 * @param includes Headers the code requires.
 */
public record DependentExpression(String code, Set<Variable> depends, Set<HeaderFile> includes) {

    public DependentExpression {
        depends = Set.copyOf(depends);
        includes = Set.copyOf(includes);
    }

    @Override
    public String toString() {
        return code;
    }
}
