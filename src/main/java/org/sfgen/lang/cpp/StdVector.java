package org.sfgen.lang.cpp;

import org.sfgen.kernel.FieldDescription;
import org.sfgen.lang.CppType;
import org.sfgen.lang.Expression;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.extraction.FieldExtraction;
import org.sfgen.lang.extraction.VectorExtraction;

import java.util.Optional;

/**
 * A {@code std::vector} source object. It can be mapped onto one-dimensional scalar fields
 * and onto vectors of scalars.
 */
public class StdVector extends Expression implements FieldExtraction, VectorExtraction {

    private static final HeaderFile HEADER = HeaderFile.system("vector");

    private final CppType elementType;
    private final boolean unsafe;

    /**
     * @param elementType The element type.
     * @param unsafe Whether components are accessed unchecked via {@code operator[]} instead of {@code at()}.
     * @param ref Whether the object is a reference.
     * @param isConst Whether the object is const.
     */
    public StdVector(CppType elementType, boolean unsafe, boolean ref, boolean isConst) {
        super(vectorType(elementType, ref, isConst));
        this.elementType = elementType;
        this.unsafe = unsafe;
    }

    private static CppType vectorType(CppType elementType, boolean ref, boolean isConst) {
        CppType t = CppType.of("std::vector< " + elementType.cString() + " >" + (ref ? " &" : ""), HEADER);
        return isConst ? t.constQualified() : t;
    }

    /**
     * Creates a reference to a vector named after the given field.
     *
     * @param field A one-dimensional scalar field.
     * @return The vector object, bound to a variable of the field's name.
     * @throws IllegalArgumentException if the field has more than one dimension.
     */
    public static StdVector fromField(FieldDescription field) {
        if (field.mappedRank() > 1) {
            throw new IllegalArgumentException(
                    "Cannot create std::vector from more-than-one-dimensional field " + field.name());
        }
        StdVector v = new StdVector(field.elementType(), false, true, false);
        v.var(field.name());
        return v;
    }

    public CppType elementType() {
        return elementType;
    }

    @Override
    public Optional<Expression> extractPointer() {
        return Optional.of(Expression.format("{}.data()", this));
    }

    @Override
    public Optional<Expression> extractSize(int coordinate) {
        return coordinate > 0 ? Optional.empty() : Optional.of(Expression.format("{}.size()", this));
    }

    @Override
    public Optional<Expression> extractStride(int coordinate) {
        return coordinate > 0 ? Optional.empty() : Optional.of(Expression.format("1"));
    }

    @Override
    public Optional<Expression> extractComponent(int coordinate) {
        return Optional.of(unsafe
                ? Expression.format("{}[{}]", this, coordinate)
                : Expression.format("{}.at({})", this, coordinate));
    }
}
