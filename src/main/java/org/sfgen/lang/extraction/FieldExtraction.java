package org.sfgen.lang.extraction;

import org.sfgen.lang.Expression;

import java.util.Optional;

/**
 * Extraction capability of a data structure that can be mapped onto a field.
 * <p>
 * Every method may decline by returning an empty optional, in which case the
 * corresponding property is not extracted.
 */
public interface FieldExtraction {

    /**
     * @return An expression for the base pointer of the data.
     */
    Optional<Expression> extractPointer();

    /**
     * @param coordinate The coordinate index.
     * @return An expression for the extent along the given coordinate.
     */
    Optional<Expression> extractSize(int coordinate);

    /**
     * @param coordinate The coordinate index.
     * @return An expression for the stride along the given coordinate.
     */
    Optional<Expression> extractStride(int coordinate);
}
