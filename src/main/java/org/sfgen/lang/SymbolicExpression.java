package org.sfgen.lang;

import java.util.List;

/**
 * A mathematical expression from a foreign representation, given by its
 * printed text and the free symbols occurring in it.
 *
 * @param text The printed form of the expression.
 * @param freeSymbols The free symbols of the expression.
 */
public record SymbolicExpression(String text, List<Symbol> freeSymbols) {

    public SymbolicExpression {
        freeSymbols = List.copyOf(freeSymbols);
    }

    @Override
    public String toString() {
        return text;
    }
}
