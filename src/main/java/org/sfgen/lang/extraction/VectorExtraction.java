package org.sfgen.lang.extraction;

import org.sfgen.lang.Expression;

import java.util.Optional;

/**
 * Extraction capability of a fixed-size vector-like data structure.
 */
public interface VectorExtraction {

    /**
     * @param coordinate The component index.
     * @return An expression for the component, or empty if it cannot be extracted.
     */
    Optional<Expression> extractComponent(int coordinate);
}
