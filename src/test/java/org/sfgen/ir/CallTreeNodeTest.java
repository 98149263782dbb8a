package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.kernel.KernelHandle;
import org.sfgen.kernel.KernelNamespace;
import org.sfgen.kernel.TestKernel;
import org.sfgen.lang.CppType;
import org.sfgen.lang.Expression;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.SfgException;
import org.sfgen.lang.Variable;
import org.sfgen.postprocess.PostProcessingContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.sfgen.ir.CallTrees.block;
import static org.sfgen.ir.CallTrees.branch;
import static org.sfgen.ir.CallTrees.call;
import static org.sfgen.ir.CallTrees.gpuLaunch;
import static org.sfgen.ir.CallTrees.init;
import static org.sfgen.ir.CallTrees.params;
import static org.sfgen.ir.CallTrees.requireIncludes;
import static org.sfgen.ir.CallTrees.seq;
import static org.sfgen.ir.CallTrees.statements;
import static org.sfgen.ir.CallTrees.switchOn;
import static org.sfgen.kernel.TestKernel.param;

@Tag("unit")
class CallTreeNodeTest {

    private static final CodeStyle STYLE = CodeStyle.DEFAULT;

    @Test
    void sequence_shouldSkipEmptyChildren() {
        Sequence s = seq("a;", params(new Variable("x", CppType.DOUBLE)), "b;");

        assertEquals("a;\nb;", s.render(STYLE));
    }

    @Test
    void block_shouldIndentBody() {
        assertEquals("{\n  a;\n  b;\n}", block("a;", "b;").render(STYLE));
        assertEquals("{\n}", block().render(STYLE));
    }

    @Test
    void branch_shouldRenderBothArms() {
        Branch b = branch("x > 0", seq("a;"), seq("b;"));

        assertEquals("if(x > 0) {\n  a;\n} else {\n  b;\n}", b.render(STYLE));
        assertEquals("if(x > 0) {\n  a;\n}", branch("x > 0", seq("a;")).render(STYLE));
    }

    @Test
    @DisplayName("Every case ends in a break, the default case comes last")
    void switch_shouldRenderCasesWithBreak() {
        Switch sw = switchOn("mode").caseOf("0", "a;").defaultCase("b;").build();

        assertEquals("switch(mode) {\n"
                + "case 0: {\n  a;\n  break;\n}\n"
                + "default: {\n  b;\n  break;\n}\n"
                + "}", sw.render(STYLE));
        assertThat(sw.defaultCase()).isPresent();
    }

    @Test
    void switch_shouldRejectDefaultCaseBeforeOtherCases() {
        List<SwitchCase> cases = List.of(SwitchCase.defaultCase(seq()), SwitchCase.of("1", seq()));

        assertThatThrownBy(() -> new Switch(Statements.of("m"), cases))
                .isInstanceOf(SfgException.class)
                .hasMessageContaining("last");
    }

    @Test
    void switch_shouldRejectReplacingDefaultWithNormalCase() {
        Switch sw = switchOn("mode").caseOf("0", "a;").defaultCase("b;").build();

        assertThatThrownBy(() -> sw.children().set(2, SwitchCase.of("1", seq())))
                .isInstanceOf(SfgException.class);
    }

    @Test
    @DisplayName("Children can be replaced but never added or removed")
    void children_shouldBeFixedSize() {
        Sequence s = seq("a;", "b;");
        List<CallTreeNode> children = s.children();

        children.set(0, Statements.of("c;"));

        assertEquals("c;\nb;", s.render(STYLE));
        assertThatThrownBy(() -> children.add(Statements.of("d;"))).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> children.remove(0)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void block_shouldOnlyAcceptSequenceAsBody() {
        Block b = block("a;");

        assertThatThrownBy(() -> b.children().set(0, Statements.of("x;")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Deferred nodes have neither children nor code before expansion")
    void deferredNode_shouldRejectAccessBeforeExpansion() {
        DeferredNode d = new DeferredNode("test", ppc -> Statements.of("x;"));

        assertThatThrownBy(d::children).isInstanceOf(SfgException.class);
        assertThatThrownBy(() -> d.render(STYLE)).isInstanceOf(SfgException.class);
    }

    @Test
    void deferredNode_shouldRejectExpansionOutsideTraversal() {
        DeferredNode d = new DeferredNode("test", ppc -> Statements.of("x;"));

        assertThatThrownBy(() -> d.expand(new PostProcessingContext()))
                .isInstanceOf(SfgException.class)
                .hasMessageContaining("test");
    }

    @Test
    void requiredIncludes_shouldAggregateDescendants() {
        Sequence s = seq(requireIncludes("<vector>"), block(requireIncludes("\"my.h\"")));

        assertThat(s.requiredIncludes()).containsExactly(HeaderFile.system("vector"), HeaderFile.parse("my.h"));
    }

    @Test
    void statements_shouldCarryDependenciesOfArguments() {
        Variable x = new Variable("x", CppType.INT64);

        Statements s = statements("use({});", x);

        assertEquals("use(x);", s.code());
        assertThat(s.depends()).containsExactly(x);
        assertThat(s.defines()).isEmpty();
    }

    @Test
    void init_shouldDefineTheVariable() {
        Variable y = new Variable("y", CppType.DOUBLE);
        Variable z = new Variable("z", CppType.DOUBLE);

        Statements s = init(y, Expression.format("{} * 2", z), 1);

        assertEquals("double y { z * 2, 1 };", s.code());
        assertThat(s.defines()).containsExactly(y);
        assertThat(s.depends()).containsExactly(z);
    }

    @Test
    void kernelCall_shouldPassParametersByName() {
        KernelNamespace kns = new KernelNamespace("kernels", "app");
        KernelHandle h = kns.add(TestKernel.cpu("jacobi", param("_data_f", "double *"), param("n", "int64_t")));

        KernelCallNode node = call(h);

        assertEquals("app::kernels::jacobi(_data_f, n);", node.render(STYLE));
        assertThat(node.depends()).containsExactly(
                new Variable("_data_f", CppType.parse("double *")), new Variable("n", CppType.INT64));
    }

    @Test
    void gpuLaunch_shouldRenderLaunchConfiguration() {
        KernelNamespace kns = new KernelNamespace("kernels", "");
        KernelHandle h = kns.add(TestKernel.gpu("k", param("a", "float *")));
        Variable blocks = new Variable("blocks", CppType.INT32);

        GpuKernelInvocation node = gpuLaunch(h, blocks, 256, "stream");

        assertEquals("kernels::k<<< blocks, 256, stream >>>(a);", node.render(STYLE));
        assertThat(node.depends()).contains(blocks);
    }

    @Test
    void gpuLaunch_shouldRejectCpuKernels() {
        KernelNamespace kns = new KernelNamespace("kernels", "");
        KernelHandle h = kns.add(TestKernel.cpu("k"));

        assertThatThrownBy(() -> gpuLaunch(h, 1, 1, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
