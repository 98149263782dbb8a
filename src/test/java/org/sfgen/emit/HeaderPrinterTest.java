package org.sfgen.emit;

import org.sfgen.config.CodeStyle;
import org.sfgen.config.OutputMode;
import org.sfgen.config.OutputSpec;
import org.sfgen.context.SourceFileContext;
import org.sfgen.ir.entities.Constructor;
import org.sfgen.ir.entities.CppClass;
import org.sfgen.ir.entities.Function;
import org.sfgen.ir.entities.MemberVariable;
import org.sfgen.ir.entities.Method;
import org.sfgen.ir.entities.Visibility;
import org.sfgen.kernel.KernelHandle;
import org.sfgen.kernel.TestKernel;
import org.sfgen.lang.CppType;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.sfgen.ir.CallTrees.call;
import static org.sfgen.ir.CallTrees.seq;
import static org.sfgen.ir.CallTrees.statements;
import static org.sfgen.kernel.TestKernel.param;

@Tag("unit")
class HeaderPrinterTest {

    private final Variable y = new Variable("y", CppType.DOUBLE);

    private static String print(SourceFileContext ctx, OutputSpec output) {
        return new HeaderPrinter(CodeStyle.DEFAULT, output).print(ctx);
    }

    @Test
    void print_shouldDeclareFunctionsAfterIncludes() {
        SourceFileContext ctx = new SourceFileContext();
        ctx.include("<cstdint>");
        ctx.add(Function.builder("compute", seq(statements("use({});", y))).build());

        assertEquals("#pragma once\n\n#include <cstdint>\n\nvoid compute(double y);\n",
                print(ctx, OutputSpec.of("generated")));
    }

    @Test
    void print_shouldWrapBodyIntoOuterNamespace() {
        SourceFileContext ctx = new SourceFileContext("app", "kernels");
        ctx.add(Function.builder("compute", seq(statements("use({});", y))).build());

        assertEquals("#pragma once\n\nnamespace app {\n  void compute(double y);\n} // namespace app\n",
                print(ctx, OutputSpec.of("generated")));
    }

    @Test
    void print_shouldUseMacroGuard() {
        SourceFileContext ctx = new SourceFileContext();
        ctx.define("using real = double;");

        String header = print(ctx, OutputSpec.of("gen").withIncludeGuard(OutputSpec.IncludeGuard.MACRO));

        assertEquals("#ifndef GEN_HPP\n#define GEN_HPP\n\nusing real = double;\n\n#endif // GEN_HPP\n", header);
    }

    @Test
    void print_shouldStartWithPrelude() {
        SourceFileContext ctx = new SourceFileContext();
        ctx.appendPrelude("Generated code\nDo not edit");

        assertThat(print(ctx, OutputSpec.of("gen"))).startsWith("/**\n * Generated code\n * Do not edit\n */\n\n#pragma once");
    }

    @Test
    void print_shouldDefineInlineFunctionsInStandaloneMode() {
        SourceFileContext ctx = new SourceFileContext();
        ctx.add(Function.builder("twice", seq(statements("return 2 * {};", y)))
                .returnType(CppType.DOUBLE).inline(true).build());

        assertThat(print(ctx, OutputSpec.of("gen")))
                .contains("inline double twice(double y)\n{\n  return 2 * y;\n}\n");
    }

    @Test
    @DisplayName("Header-only output holds kernels and inline definitions")
    void print_shouldInlineEverythingInHeaderOnlyMode() {
        SourceFileContext ctx = new SourceFileContext();
        KernelHandle h = ctx.kernels().add(TestKernel
                .cpu("scale", param("_data_f", "double *"), param("alpha", "double"))
                .withHeaders(HeaderFile.system("cmath")));
        ctx.add(Function.builder("run", seq(call(h))).build());

        String header = print(ctx, OutputSpec.of("gen").withMode(OutputMode.HEADER_ONLY));

        assertEquals("#pragma once\n\n"
                + "#include <cmath>\n\n"
                + "namespace kernels {\n"
                + "  inline void scale(double * _data_f, double alpha)\n"
                + "  {\n"
                + "    /* scale */\n"
                + "  }\n"
                + "} // namespace kernels\n\n"
                + "inline void run(double * _data_f, double alpha)\n"
                + "{\n"
                + "  kernels::scale(_data_f, alpha);\n"
                + "}\n", header);
    }

    @Test
    void print_shouldRenderClassWithVisibilityBlocks() {
        CppClass cls = new CppClass("Solver");
        MemberVariable dt = new MemberVariable("dt_", CppType.DOUBLE);
        Variable dt0 = new Variable("dt0", CppType.DOUBLE);
        Variable t = new Variable("t", CppType.DOUBLE);
        cls.add(dt, Visibility.PRIVATE);
        cls.add(Constructor.builder().param(dt0).init(dt, dt0).build(), Visibility.PUBLIC);
        cls.add(Method.builder("step", seq(statements("advance({}, {});", dt.variable(), t)))
                .constQualified(true).build(), Visibility.PUBLIC);
        SourceFileContext ctx = new SourceFileContext();
        ctx.add(cls);

        assertEquals("#pragma once\n\n"
                + "class Solver {\n"
                + "private:\n"
                + "  double dt_;\n\n"
                + "public:\n"
                + "  Solver(double dt0)\n"
                + "  :dt_(dt0)\n"
                + "  {\n"
                + "  }\n"
                + "  void step(double t) const;\n"
                + "};\n", print(ctx, OutputSpec.of("gen")));
    }

    @Test
    void print_shouldIncludeHeadersOfDeclaredTypes() {
        SourceFileContext ctx = new SourceFileContext();
        ctx.include("\"private.h\"", true);
        ctx.add(Function.builder("count", seq(statements("use({});", new Variable("n", CppType.INT64)))).build());

        String header = print(ctx, OutputSpec.of("gen"));

        assertThat(header).contains("#include <cstdint>").doesNotContain("private.h");
    }
}
