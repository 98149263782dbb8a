package org.sfgen.lang;

import java.util.Optional;

/**
 * A variable-like object from a foreign representation (for example a kernel
 * parameter or a symbol of a mathematical expression). It has a name and may
 * or may not carry a resolvable data type.
 */
public interface Symbol {

    String name();

    /**
     * @return The data type of this symbol, or empty if the symbol is untyped or dynamically typed.
     */
    Optional<CppType> dataType();
}
