package org.sfgen.postprocess.deferred;

import org.sfgen.config.CodeStyle;
import org.sfgen.ir.CallTreeNode;
import org.sfgen.ir.Sequence;
import org.sfgen.ir.Statements;
import org.sfgen.kernel.Extent;
import org.sfgen.kernel.FieldDescription;
import org.sfgen.lang.CppType;
import org.sfgen.lang.Expression;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.Variable;
import org.sfgen.lang.cpp.StdMdspan;
import org.sfgen.lang.cpp.StdVector;
import org.sfgen.lang.extraction.FieldExtraction;
import org.sfgen.postprocess.PostProcessingContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class FieldMappingExpansionTest {

    @Mock
    private FieldExtraction extraction;

    private static List<String> codes(CallTreeNode node) {
        return ((Sequence) node).children().stream().map(n -> n.render(CodeStyle.DEFAULT)).toList();
    }

    @Test
    @DisplayName("Only live field parameters are extracted and defined")
    void expand_shouldDefineOnlyLiveParameters() {
        FieldDescription field = FieldDescription.create("f", CppType.DOUBLE, 2);
        PostProcessingContext ppc = new PostProcessingContext();
        ppc.use(List.of(field.basePointer(), FieldDescription.sizeSymbol("f", 0)));
        when(extraction.extractPointer()).thenReturn(Optional.of(Expression.format("f.data()")));
        when(extraction.extractSize(0)).thenReturn(Optional.of(Expression.format("f.size(0)")));

        CallTreeNode result = new FieldMappingExpansion(field, extraction, true).expand(ppc);

        assertThat(codes(result)).containsExactly(
                "double * _data_f { f.data() };",
                "const int64_t _size_f_0 { int64_t( f.size(0) ) };");
        verify(extraction, never()).extractSize(1);
        verify(extraction, never()).extractStride(anyInt());
    }

    @Test
    void expand_shouldSkipCastWhenDisabled() {
        FieldDescription field = FieldDescription.create("f", CppType.DOUBLE, 1);
        PostProcessingContext ppc = new PostProcessingContext();
        ppc.use(List.of(FieldDescription.sizeSymbol("f", 0)));
        when(extraction.extractSize(0)).thenReturn(Optional.of(Expression.format("f.size(0)")));

        CallTreeNode result = new FieldMappingExpansion(field, extraction, false).expand(ppc);

        assertThat(codes(result)).containsExactly("const int64_t _size_f_0 { f.size(0) };");
    }

    @Test
    @DisplayName("A symbol shared by several coordinates is defined once and checked elsewhere")
    void expand_shouldDefineSharedSymbolOnce() {
        Variable n = new Variable("n", FieldDescription.INDEX_TYPE);
        FieldDescription field = new FieldDescription("g", CppType.DOUBLE,
                List.of(Extent.of(n), Extent.of(n)), List.of(),
                List.of(Extent.of(1), Extent.of(1)),
                FieldDescription.basePointer("g", CppType.DOUBLE));
        PostProcessingContext ppc = new PostProcessingContext();
        ppc.use(List.of(n));
        when(extraction.extractSize(0)).thenReturn(Optional.of(Expression.format("g.size(0)")));
        when(extraction.extractSize(1)).thenReturn(Optional.of(Expression.format("g.size(1)")));

        CallTreeNode result = new FieldMappingExpansion(field, extraction, true).expand(ppc);

        assertThat(codes(result)).containsExactly(
                "const int64_t n { int64_t( g.size(0) ) };",
                "/* g.size(1) == n */");
        verify(extraction, never()).extractPointer();
    }

    @Test
    void expand_shouldCommentFixedExtents() {
        FieldDescription field = new FieldDescription("v", CppType.DOUBLE,
                List.of(Extent.of(16)), List.of(), List.of(Extent.of(1)),
                FieldDescription.basePointer("v", CppType.DOUBLE));
        PostProcessingContext ppc = new PostProcessingContext();
        ppc.use(List.of(field.basePointer()));
        when(extraction.extractPointer()).thenReturn(Optional.of(Expression.format("v.data()")));
        when(extraction.extractSize(0)).thenReturn(Optional.of(Expression.format("v.size()")));

        CallTreeNode result = new FieldMappingExpansion(field, extraction, true).expand(ppc);

        assertThat(codes(result)).containsExactly("double * _data_v { v.data() };", "/* v.size() == 16 */");
    }

    @Test
    @DisplayName("Properties the data structure cannot provide are omitted")
    void expand_shouldOmitDeclinedProperties() {
        FieldDescription field = FieldDescription.create("f", CppType.DOUBLE, 1);
        PostProcessingContext ppc = new PostProcessingContext();
        ppc.use(List.of(field.basePointer()));
        when(extraction.extractPointer()).thenReturn(Optional.empty());

        CallTreeNode result = new FieldMappingExpansion(field, extraction, true).expand(ppc);

        assertThat(((Sequence) result).isEmpty()).isTrue();
    }

    @Test
    void expand_shouldMapExplicitScalarFieldsWithSpatialRank() {
        FieldDescription field = FieldDescription.create("h", CppType.DOUBLE, 2, 1);
        PostProcessingContext ppc = new PostProcessingContext();
        ppc.use(List.of(FieldDescription.sizeSymbol("h", 0), FieldDescription.strideSymbol("h", 2)));

        CallTreeNode result = new FieldMappingExpansion(field, StdMdspan.fromField(field), true).expand(ppc);

        assertThat(codes(result)).containsExactly("const int64_t _size_h_0 { int64_t( h.extents().extent(0) ) };");
    }

    @Test
    void expand_shouldMakeDefinitionsDependOnTheDataStructure() {
        FieldDescription field = FieldDescription.create("v", CppType.DOUBLE, 1);
        StdVector vec = StdVector.fromField(field);
        PostProcessingContext ppc = new PostProcessingContext();
        ppc.use(field.parameters());

        CallTreeNode result = new FieldMappingExpansion(field, vec, true).expand(ppc);

        assertThat(codes(result)).containsExactly(
                "double * _data_v { v.data() };",
                "const int64_t _size_v_0 { int64_t( v.size() ) };",
                "const int64_t _stride_v_0 { int64_t( 1 ) };");
        Statements ptr = (Statements) result.children().get(0);
        assertEquals(Set.of(field.basePointer()), ptr.defines());
        assertThat(ptr.depends()).containsExactly(vec.asVariable());
        assertThat(ptr.includes()).contains(HeaderFile.system("vector"));
    }
}
