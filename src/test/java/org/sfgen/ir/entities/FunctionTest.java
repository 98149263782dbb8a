package org.sfgen.ir.entities;

import org.sfgen.config.CodeStyle;
import org.sfgen.ir.DeferredNode;
import org.sfgen.ir.Sequence;
import org.sfgen.kernel.FieldDescription;
import org.sfgen.kernel.KernelHandle;
import org.sfgen.kernel.KernelNamespace;
import org.sfgen.kernel.KernelParameter;
import org.sfgen.kernel.TestKernel;
import org.sfgen.lang.CppType;
import org.sfgen.lang.SfgException;
import org.sfgen.lang.Variable;
import org.sfgen.lang.cpp.StdVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.sfgen.ir.CallTrees.call;
import static org.sfgen.ir.CallTrees.mapField;
import static org.sfgen.ir.CallTrees.seq;
import static org.sfgen.ir.CallTrees.statements;
import static org.sfgen.ir.CallTrees.stmt;

@Tag("unit")
class FunctionTest {

    private final CppType t = CppType.of("T");
    private final Variable a = new Variable("a", CppType.DOUBLE);
    private final Variable z = new Variable("z", CppType.DOUBLE);

    @Test
    @DisplayName("Variables defined in the body do not become parameters")
    void build_shouldOmitLocallyDefinedVariables() {
        Variable x = new Variable("x", t);
        Function f = Function.builder("f", seq(
                stmt("T x = 1;", List.of(x), List.of()),
                stmt("use(x);", List.of(), List.of(x)))).build();

        assertThat(f.parameters()).isEmpty();
        assertEquals("T x = 1;\nuse(x);", f.tree().render(CodeStyle.DEFAULT));
    }

    @Test
    void build_shouldSortInferredParametersByName() {
        Function f = Function.builder("f", seq(statements("g({}, {});", z, a))).build();

        assertThat(f.parameters()).containsExactly(a, z);
    }

    @Test
    void build_shouldKeepExplicitParameterOrder() {
        Variable extra = new Variable("extra", CppType.INT32);
        Function f = Function.builder("f", seq(statements("g({}, {});", z, a))).params(z, extra, a).build();

        assertThat(f.parameters()).containsExactly(z, extra, a);
    }

    @Test
    @DisplayName("Free variables missing from an explicit parameter list are an error")
    void build_shouldRejectMissingExplicitParameters() {
        Function.Builder builder = Function.builder("f", seq(statements("g({}, {});", z, a))).params(a);

        assertThatThrownBy(builder::build)
                .isInstanceOf(SfgException.class)
                .hasMessageContaining("Extraneous function parameters");
    }

    @Test
    void build_shouldRejectDeferredRoot() {
        DeferredNode root = new DeferredNode("root", ppc -> Sequence.empty());

        assertThatThrownBy(() -> Function.builder("f", root).build()).isInstanceOf(SfgException.class);
    }

    @Test
    @DisplayName("A mapped field passes the data structure instead of the kernel's field parameters")
    void build_shouldReplaceFieldParametersByDataStructure() {
        FieldDescription field = FieldDescription.create("v", CppType.DOUBLE, 1);
        StdVector vec = StdVector.fromField(field);
        KernelNamespace kns = new KernelNamespace("kernels", "");
        KernelHandle kernel = kns.add(TestKernel.cpu("scale",
                new KernelParameter("_data_v", CppType.parse("double *")),
                new KernelParameter("_size_v_0", FieldDescription.INDEX_TYPE)));

        Function f = Function.builder("run", seq(mapField(field, vec), call(kernel))).build();

        assertThat(f.parameters()).containsExactly(vec.asVariable());
        assertEquals("double * _data_v { v.data() };\n"
                + "const int64_t _size_v_0 { int64_t( v.size() ) };\n"
                + "kernels::scale(_data_v, _size_v_0);", f.tree().render(CodeStyle.DEFAULT));
    }

    @Test
    void signature_shouldRenderQualifiers() {
        Function f = Function.builder("norm", seq(statements("return {};", a)))
                .returnType(CppType.DOUBLE)
                .inline(true)
                .constexpr(true)
                .attribute("nodiscard")
                .build();

        assertEquals("[[nodiscard]] inline constexpr double norm(double a)", FunctionSignature.render(f, false));
    }
}
