package org.sfgen.lang;

import java.util.Objects;
import java.util.Set;

/**
 * Canonical, immutable representation of a typed variable in generated code.
 * <p>
 * Two variables denote the same variable iff name and type match exactly. The
 * set of headers the variable pulls in is carried along but ignored by
 * {@link #equals(Object)}.
 *
 * @param name The variable name.
 * @param type The data type.
 * @param includes Headers required to declare this variable.
 */
public record Variable(String name, CppType type, Set<HeaderFile> includes) {

    public Variable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be empty");
        }
        includes = Set.copyOf(includes);
    }

    public Variable(String name, CppType type) {
        this(name, type, type.headers());
    }

    /**
     * @return {@code name: type}, used in diagnostics.
     */
    public String nameAndType() {
        return name + ": " + type.cString();
    }

    /**
     * @return The declaration of this variable as a parameter, e.g. {@code const double x}.
     */
    public String declaration() {
        return type.cString() + " " + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable other)) return false;
        return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name;
    }
}
