package org.sfgen.lang;

import java.util.Optional;

/**
 * Plain symbol with an optional data type.
 *
 * @param name The symbol name.
 * @param type The data type, or {@code null} for an untyped symbol.
 */
public record TypedSymbol(String name, CppType type) implements Symbol {

    public static TypedSymbol untyped(String name) {
        return new TypedSymbol(name, null);
    }

    @Override
    public Optional<CppType> dataType() {
        return Optional.ofNullable(type);
    }

    @Override
    public String toString() {
        return name;
    }
}
