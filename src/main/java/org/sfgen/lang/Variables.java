package org.sfgen.lang;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Conversions of variable-like objects into canonical {@link Variable}s.
 */
public final class Variables {

    private Variables() {
        // Private constructor to prevent instantiation
    }

    /**
     * Converts a variable-like object into its canonical variable.
     * <p>
     * Accepted are {@link Variable}s themselves, {@link Expression}s bound as a
     * variable and typed {@link Symbol}s.
     *
     * @param obj The object to convert.
     * @return The canonical variable.
     * @throws SfgException if the object is not variable-like or carries no resolvable type.
     */
    public static Variable canonicalize(Object obj) {
        if (obj instanceof Variable v) {
            return v;
        }
        if (obj instanceof Expression e) {
            return e.asVariable();
        }
        if (obj instanceof Symbol s) {
            CppType type = s.dataType().orElseThrow(() -> new SfgException(
                    "Unable to convert symbol '" + s.name() + "' to a variable: it has no resolvable data type."));
            return new Variable(s.name(), type);
        }
        throw new SfgException("Object of type " + (obj == null ? "null" : obj.getClass().getSimpleName())
                + " cannot be converted to a variable: " + obj);
    }

    /**
     * Collects the variables an argument depends on. Plain values (numbers, strings)
     * depend on nothing.
     *
     * @param obj A variable-like object, an expression or a plain value.
     * @return The set of variables.
     */
    public static Set<Variable> dependsOf(Object obj) {
        if (obj instanceof Expression e) {
            return e.depends();
        }
        if (obj instanceof DependentExpression d) {
            return d.depends();
        }
        if (obj instanceof Variable || obj instanceof Symbol) {
            return Set.of(canonicalize(obj));
        }
        if (obj instanceof SymbolicExpression se) {
            Set<Variable> out = new LinkedHashSet<>();
            for (Symbol s : se.freeSymbols()) {
                out.add(canonicalizeFreeSymbol(s, se));
            }
            return out;
        }
        return Set.of();
    }

    /**
     * Collects the headers an argument requires.
     *
     * @param obj Any expression argument.
     * @return The set of headers.
     */
    public static Set<HeaderFile> includesOf(Object obj) {
        if (obj instanceof Expression e) {
            return e.includes();
        }
        if (obj instanceof DependentExpression d) {
            return d.includes();
        }
        if (obj instanceof Variable v) {
            return v.includes();
        }
        if (obj instanceof CppType t) {
            return t.headers();
        }
        return Set.of();
    }

    static Variable canonicalizeFreeSymbol(Symbol s, SymbolicExpression owner) {
        if (s.dataType().isEmpty()) {
            throw new SfgException("Unable to use expression '" + owner.text()
                    + "': free symbol '" + s.name() + "' has no resolvable data type.");
        }
        return canonicalize(s);
    }
}
