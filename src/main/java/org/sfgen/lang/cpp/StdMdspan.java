package org.sfgen.lang.cpp;

import org.sfgen.kernel.Extent;
import org.sfgen.kernel.FieldDescription;
import org.sfgen.lang.CppType;
import org.sfgen.lang.Expression;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.extraction.FieldExtraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A {@code std::mdspan} source object that can be mapped onto fields of any rank.
 */
public class StdMdspan extends Expression implements FieldExtraction {

    public static final String DYNAMIC_EXTENT = "std::dynamic_extent";
    private static final HeaderFile HEADER = HeaderFile.system("experimental/mdspan");

    private final List<String> extents;

    /**
     * @param elementType The element type.
     * @param extents Static extents or {@link #DYNAMIC_EXTENT}, one per dimension.
     * @param extentsType The index type of the extents.
     * @param ref Whether the object is a reference.
     */
    public StdMdspan(CppType elementType, List<String> extents, CppType extentsType, boolean ref) {
        super(mdspanType(elementType, extents, extentsType, ref));
        if (extents.isEmpty()) {
            throw new IllegalArgumentException("An mdspan needs at least one extent");
        }
        this.extents = List.copyOf(extents);
    }

    private static CppType mdspanType(CppType elementType, List<String> extents, CppType extentsType, boolean ref) {
        String extentsStr = "std::extents< " + extentsType.cString() + ", " + String.join(", ", extents) + " >";
        return CppType.of("std::mdspan< " + elementType.cString() + ", " + extentsStr + " >" + (ref ? " &" : ""), HEADER);
    }

    /**
     * Creates an mdspan reference named after the given field. Symbolic extents become
     * dynamic extents; the trivial index dimension of explicit scalar fields is dropped.
     *
     * @param field The field.
     * @return The mdspan object, bound to a variable of the field's name.
     */
    public static StdMdspan fromField(FieldDescription field) {
        List<String> extents = new ArrayList<>();
        List<Extent> shape = field.shape().subList(0, field.mappedRank());
        for (Extent e : shape) {
            extents.add(e instanceof Extent.Fixed f ? Long.toString(f.value()) : DYNAMIC_EXTENT);
        }
        StdMdspan span = new StdMdspan(field.elementType(), extents, CppType.INT64, true);
        span.var(field.name());
        return span;
    }

    public int rank() {
        return extents.size();
    }

    @Override
    public Optional<Expression> extractPointer() {
        return Optional.of(Expression.format("{}.data_handle()", this));
    }

    @Override
    public Optional<Expression> extractSize(int coordinate) {
        if (coordinate >= rank()) {
            return Optional.empty();
        }
        return Optional.of(Expression.format("{}.extents().extent({})", this, coordinate));
    }

    @Override
    public Optional<Expression> extractStride(int coordinate) {
        if (coordinate >= rank()) {
            return Optional.empty();
        }
        return Optional.of(Expression.format("{}.stride({})", this, coordinate));
    }

    @Override
    public String toString() {
        return isBound() ? super.toString() : extents.stream().collect(Collectors.joining(", ", "mdspan[", "]"));
    }
}
