package org.sfgen.kernel;

import org.sfgen.lang.Variable;

/**
 * One entry of a field's shape or strides: either a symbol resolved at runtime
 * or a compile-time constant.
 */
public sealed interface Extent permits Extent.Symbolic, Extent.Fixed {

    static Extent of(Variable symbol) {
        return new Symbolic(symbol);
    }

    static Extent of(long value) {
        return new Fixed(value);
    }

    /**
     * @param symbol The kernel parameter holding the value.
     */
    record Symbolic(Variable symbol) implements Extent {
        @Override
        public String toString() {
            return symbol.name();
        }
    }

    /**
     * @param value The constant value.
     */
    record Fixed(long value) implements Extent {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }
}
