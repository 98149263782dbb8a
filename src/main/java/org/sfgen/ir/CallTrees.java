package org.sfgen.ir;

import org.sfgen.kernel.FieldDescription;
import org.sfgen.kernel.KernelHandle;
import org.sfgen.lang.DependentExpression;
import org.sfgen.lang.Expression;
import org.sfgen.lang.HeaderFile;
import org.sfgen.lang.SfgException;
import org.sfgen.lang.Symbol;
import org.sfgen.lang.Variable;
import org.sfgen.lang.Variables;
import org.sfgen.lang.extraction.FieldExtraction;
import org.sfgen.lang.extraction.VectorExtraction;
import org.sfgen.postprocess.deferred.FieldMappingExpansion;
import org.sfgen.postprocess.deferred.ParamSetterExpansion;
import org.sfgen.postprocess.deferred.VectorMappingExpansion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Factory methods for building call trees.
 * <p>
 * Wherever a node is expected, plain strings are accepted as code without dependencies
 * and {@link Expression}s as code depending on the expression's variables.
 */
public final class CallTrees {

    private CallTrees() {
        // Private constructor to prevent instantiation
    }

    public static Sequence seq(Object... items) {
        return new Sequence(Arrays.stream(items).map(CallTrees::toNode).toList());
    }

    public static Block block(Object... items) {
        return new Block(seq(items));
    }

    /**
     * @param code The code text.
     * @param defines The variables the code defines.
     * @param depends The variables the code reads.
     * @return The statements leaf.
     */
    public static Statements stmt(String code, Collection<Variable> defines, Collection<Variable> depends) {
        return new Statements(code, defines, depends);
    }

    /**
     * Composes a statement from a template. The statement depends on all variables of its arguments.
     *
     * @param fmt Template with {@code {}} placeholders.
     * @param args Template arguments.
     * @return The statements leaf.
     */
    public static Statements statements(String fmt, Object... args) {
        DependentExpression e = Expression.format(fmt, args).expression();
        return new Statements(e.code(), Set.of(), e.depends(), e.includes());
    }

    /**
     * Declares and initializes a variable: {@code T name { args };}.
     *
     * @param lhs The variable-like object to define.
     * @param args Initializer arguments.
     * @return The statements leaf defining the variable.
     */
    public static Statements init(Object lhs, Object... args) {
        Variable v = Variables.canonicalize(lhs);
        Set<Variable> deps = new LinkedHashSet<>();
        Set<HeaderFile> incls = new LinkedHashSet<>(v.includes());
        List<String> codes = new ArrayList<>();
        for (Object arg : args) {
            DependentExpression e = Expression.format("{}", arg).expression();
            codes.add(e.code());
            deps.addAll(e.depends());
            incls.addAll(e.includes());
        }
        String code = v.type().cString() + " " + v.name() + " { " + String.join(", ", codes) + " };";
        return new Statements(code, Set.of(v), deps, incls);
    }

    public static Branch branch(Object condition, Sequence ifTrue) {
        return new Branch(toLeaf(condition), ifTrue, null);
    }

    public static Branch branch(Object condition, Sequence ifTrue, Sequence ifFalse) {
        return new Branch(toLeaf(condition), ifTrue, ifFalse);
    }

    public static SwitchBuilder switchOn(Object argument) {
        return new SwitchBuilder(toLeaf(argument));
    }

    public static KernelCallNode call(KernelHandle kernel) {
        return new KernelCallNode(kernel);
    }

    /**
     * @param kernel The GPU kernel.
     * @param numBlocks Block count expression.
     * @param threadsPerBlock Threads-per-block expression.
     * @param stream Stream expression, or {@code null} for the default stream.
     * @return The invocation leaf.
     */
    public static GpuKernelInvocation gpuLaunch(KernelHandle kernel, Object numBlocks, Object threadsPerBlock, Object stream) {
        return new GpuKernelInvocation(kernel, dependent(numBlocks), dependent(threadsPerBlock),
                stream == null ? null : dependent(stream));
    }

    /**
     * Forces the given variables onto the parameter list of the enclosing function.
     *
     * @param vars Variable-like objects.
     * @return The parameter leaf.
     */
    public static FunctionParams params(Object... vars) {
        return new FunctionParams(Arrays.stream(vars).map(Variables::canonicalize)
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    public static RequireIncludes requireIncludes(String... headers) {
        return new RequireIncludes(Arrays.stream(headers).map(HeaderFile::parse)
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    public static DeferredNode mapField(FieldDescription field, FieldExtraction extraction) {
        return mapField(field, extraction, true);
    }

    /**
     * @param field The field to map.
     * @param extraction The data structure to extract field properties from.
     * @param castIndexingSymbols Whether to cast extents and strides to the symbol types.
     * @return A deferred node expanding to the definitions of all live field parameters.
     */
    public static DeferredNode mapField(FieldDescription field, FieldExtraction extraction, boolean castIndexingSymbols) {
        return new DeferredNode("field mapping of " + field.name(),
                new FieldMappingExpansion(field, extraction, castIndexingSymbols));
    }

    /**
     * @param scalars Variables, symbols or names, one per vector component.
     * @param vector The vector data structure.
     * @return A deferred node expanding to the definitions of all live components.
     */
    public static DeferredNode mapVector(List<?> scalars, VectorExtraction vector) {
        List<String> names = scalars.stream().map(CallTrees::nameOf).toList();
        return new DeferredNode("vector mapping of " + names, new VectorMappingExpansion(names, vector));
    }

    /**
     * @param param The parameter to set.
     * @param rhs The value.
     * @return A deferred node defining the parameter if it is live.
     */
    public static DeferredNode setParam(Object param, Object rhs) {
        String name = nameOf(param);
        Expression value = rhs instanceof Expression e ? e : Expression.format("{}", rhs);
        return new DeferredNode("parameter setter of " + name, new ParamSetterExpansion(name, value));
    }

    private static String nameOf(Object obj) {
        if (obj instanceof String s) {
            return s;
        }
        if (obj instanceof Symbol s) {
            return s.name();
        }
        return Variables.canonicalize(obj).name();
    }

    private static DependentExpression dependent(Object obj) {
        return Expression.format("{}", obj).expression();
    }

    static CallTreeNode toNode(Object item) {
        if (item instanceof CallTreeNode node) {
            return node;
        }
        return toLeaf(item);
    }

    static CallTreeLeaf toLeaf(Object item) {
        if (item instanceof CallTreeLeaf leaf) {
            return leaf;
        }
        if (item instanceof String s) {
            return Statements.of(s);
        }
        DependentExpression e = dependent(item);
        return new Statements(e.code(), Set.of(), e.depends(), e.includes());
    }

    /**
     * Builder for {@link Switch} nodes.
     */
    public static final class SwitchBuilder {
        private final CallTreeLeaf argument;
        private final List<SwitchCase> cases = new ArrayList<>();
        private SwitchCase defaultCase;

        private SwitchBuilder(CallTreeLeaf argument) {
            this.argument = argument;
        }

        public SwitchBuilder caseOf(String label, Object... body) {
            cases.add(SwitchCase.of(label, seq(body)));
            return this;
        }

        public SwitchBuilder defaultCase(Object... body) {
            if (defaultCase != null) {
                throw new SfgException("Duplicate default case in switch");
            }
            defaultCase = SwitchCase.defaultCase(seq(body));
            return this;
        }

        public Switch build() {
            List<SwitchCase> all = new ArrayList<>(cases);
            if (defaultCase != null) {
                all.add(defaultCase);
            }
            return new Switch(argument, all);
        }
    }
}
