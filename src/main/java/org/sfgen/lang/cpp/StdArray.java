package org.sfgen.lang.cpp;

import org.sfgen.lang.CppType;
import org.sfgen.lang.Expression;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.extraction.VectorExtraction;

import java.util.Optional;

/**
 * A {@code std::array} source object that can be mapped onto a vector of scalars.
 */
public class StdArray extends Expression implements VectorExtraction {

    private static final HeaderFile HEADER = HeaderFile.system("array");

    private final int size;
    private final boolean unsafe;

    public StdArray(CppType elementType, int size, boolean unsafe, boolean ref, boolean isConst) {
        super(arrayType(elementType, size, ref, isConst));
        if (size <= 0) {
            throw new IllegalArgumentException("Array size must be positive: " + size);
        }
        this.size = size;
        this.unsafe = unsafe;
    }

    private static CppType arrayType(CppType elementType, int size, boolean ref, boolean isConst) {
        CppType t = CppType.of("std::array< " + elementType.cString() + ", " + size + " >" + (ref ? " &" : ""), HEADER);
        return isConst ? t.constQualified() : t;
    }

    public int size() {
        return size;
    }

    @Override
    public Optional<Expression> extractComponent(int coordinate) {
        if (coordinate < 0 || coordinate >= size) {
            return Optional.empty();
        }
        return Optional.of(unsafe
                ? Expression.format("{}[{}]", this, coordinate)
                : Expression.format("{}.at({})", this, coordinate));
    }
}
