package org.sfgen.lang.cpp;

import org.sfgen.kernel.Extent;
import org.sfgen.kernel.FieldDescription;
import org.sfgen.lang.CppType;
import org.sfgen.lang.Expression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class StdMdspanTest {

    @Test
    void fromField_shouldUseDynamicExtentsForSymbolicShape() {
        StdMdspan span = StdMdspan.fromField(FieldDescription.create("u", CppType.DOUBLE, 2));

        assertThat(span.rank()).isEqualTo(2);
        assertThat(span.requireType().cString()).isEqualTo(
                "std::mdspan< double, std::extents< int64_t, std::dynamic_extent, std::dynamic_extent > > &");
    }

    @Test
    void fromField_shouldKeepFixedExtents() {
        FieldDescription f = FieldDescription.create("u", CppType.FLOAT, 2)
                .withSpatialShape(List.of(Extent.of(FieldDescription.sizeSymbol("u", 0)), Extent.of(8)));

        StdMdspan span = StdMdspan.fromField(f);

        assertThat(span.requireType().name()).contains("std::dynamic_extent, 8 >");
    }

    @Test
    void fromField_shouldDropTrivialIndexDimension() {
        StdMdspan span = StdMdspan.fromField(FieldDescription.create("s", CppType.DOUBLE, 2, 1));

        assertThat(span.rank()).isEqualTo(2);
    }

    @Test
    void extraction_shouldCoverAllCoordinatesBelowRank() {
        StdMdspan span = StdMdspan.fromField(FieldDescription.create("u", CppType.DOUBLE, 2));

        assertThat(span.extractPointer()).map(Expression::code).contains("u.data_handle()");
        assertThat(span.extractSize(1)).map(Expression::code).contains("u.extents().extent(1)");
        assertThat(span.extractStride(0)).map(Expression::code).contains("u.stride(0)");
        assertThat(span.extractSize(2)).isEmpty();
        assertThat(span.extractStride(2)).isEmpty();
    }
}
