package org.sfgen.lang;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A C++ data type as it is spelled in generated code, together with its
 * const qualification and the headers required to use it.
 * <p>
 * Two types are equal iff their spelled names and const qualifications match.
 * Required headers do not take part in equality.
 */
public final class CppType {

    public static final CppType VOID = new CppType("void", false, Set.of());
    public static final CppType BOOL = new CppType("bool", false, Set.of());
    public static final CppType INT32 = new CppType("int32_t", false, Set.of(HeaderFile.system("cstdint")));
    public static final CppType INT64 = new CppType("int64_t", false, Set.of(HeaderFile.system("cstdint")));
    public static final CppType UINT64 = new CppType("uint64_t", false, Set.of(HeaderFile.system("cstdint")));
    public static final CppType FLOAT = new CppType("float", false, Set.of());
    public static final CppType DOUBLE = new CppType("double", false, Set.of());

    private final String name;
    private final boolean isConst;
    private final Set<HeaderFile> headers;

    private CppType(String name, boolean isConst, Set<HeaderFile> headers) {
        this.name = Objects.requireNonNull(name, "name").strip();
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("Type name must not be empty");
        }
        this.isConst = isConst;
        this.headers = Collections.unmodifiableSet(new LinkedHashSet<>(headers));
    }

    /**
     * Creates a non-const custom type.
     * @param name The spelled name of the type, e.g. {@code std::vector< double >}.
     * @param headers The headers required by this type.
     * @return The new type.
     */
    public static CppType of(String name, HeaderFile... headers) {
        return new CppType(name, false, Set.of(headers));
    }

    /**
     * Parses a type string. A leading {@code const} qualifier and, for pointer
     * types, a trailing {@code const} are recognized.
     *
     * @param spec The type string, e.g. {@code const double} or {@code float * const}.
     * @return The parsed type.
     */
    public static CppType parse(String spec) {
        String s = spec.strip();
        boolean c = false;
        if (s.startsWith("const ")) {
            c = true;
            s = s.substring("const ".length());
        } else if (s.endsWith(" const") && s.contains("*")) {
            c = true;
            s = s.substring(0, s.length() - " const".length());
        }
        return new CppType(s, c, builtinHeaders(s));
    }

    /**
     * @param pointee The pointee type.
     * @return A non-const pointer type to the given type.
     */
    public static CppType pointerTo(CppType pointee) {
        return new CppType(pointee.cString() + " *", false, pointee.headers);
    }

    private static Set<HeaderFile> builtinHeaders(String name) {
        if (name.matches("u?int(8|16|32|64)_t")) {
            return Set.of(HeaderFile.system("cstdint"));
        }
        return Set.of();
    }

    public String name() {
        return name;
    }

    public boolean isConst() {
        return isConst;
    }

    public Set<HeaderFile> headers() {
        return headers;
    }

    public boolean isPointer() {
        return name.endsWith("*");
    }

    public CppType constQualified() {
        return isConst ? this : new CppType(name, true, headers);
    }

    public CppType deconstified() {
        return isConst ? new CppType(name, false, headers) : this;
    }

    /**
     * @param other The type to compare to.
     * @return {@code true} if both types are equal after removing const qualification.
     */
    public boolean sameIgnoringConst(CppType other) {
        return name.equals(other.name);
    }

    /**
     * @return The type as spelled in C++ code. Const pointers carry the qualifier on the right.
     */
    public String cString() {
        if (!isConst) {
            return name;
        }
        return isPointer() ? name + " const" : "const " + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CppType other)) return false;
        return isConst == other.isConst && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, isConst);
    }

    @Override
    public String toString() {
        return cString();
    }
}
