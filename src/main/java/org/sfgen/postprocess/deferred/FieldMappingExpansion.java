package org.sfgen.postprocess.deferred;

import org.sfgen.ir.CallTreeNode;
import org.sfgen.ir.DeferredExpansion;
import org.sfgen.ir.Sequence;
import org.sfgen.ir.Statements;
import org.sfgen.kernel.Extent;
import org.sfgen.kernel.FieldDescription;
import org.sfgen.lang.CppType;
import org.sfgen.lang.Expression;
import org.sfgen.lang.Variable;
import org.sfgen.lang.extraction.FieldExtraction;
import org.sfgen.postprocess.PostProcessingContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Maps a field onto a data structure, defining only those field parameters that are live.
 * <p>
 * For every live base pointer, extent or stride symbol of the field, a definition
 * {@code T name { expr };} is emitted using the extraction capability. Constant extents and
 * strides are verified in a comment if the data structure provides an expression for them.
 * A symbol serving several coordinates is defined once and verified at the remaining coordinates.
 * Properties the extraction capability declines are omitted.
 * <p>
 * Fields with the explicit scalar index shape {@code (1)} are mapped with their spatial rank only.
 */
public class FieldMappingExpansion implements DeferredExpansion {

    private final FieldDescription field;
    private final FieldExtraction extraction;
    private final boolean castIndexingSymbols;

    public FieldMappingExpansion(FieldDescription field, FieldExtraction extraction, boolean castIndexingSymbols) {
        this.field = field;
        this.extraction = extraction;
        this.castIndexingSymbols = castIndexingSymbols;
    }

    @Override
    public CallTreeNode expand(PostProcessingContext ppc) {
        int rank = field.mappedRank();
        List<CallTreeNode> nodes = new ArrayList<>();
        Set<Variable> done = new HashSet<>();

        ppc.liveVariableMatching(field.basePointer()).ifPresent(ptr ->
                extraction.extractPointer().ifPresent(expr -> nodes.add(definition(ptr, expr))));

        List<Extent> shape = field.shape();
        for (int coord = 0; coord < rank; coord++) {
            mapExtent(ppc, coord, shape.get(coord), extraction::extractSize, done, nodes);
        }
        for (int coord = 0; coord < rank; coord++) {
            mapExtent(ppc, coord, field.strides().get(coord), extraction::extractStride, done, nodes);
        }

        return new Sequence(nodes);
    }

    private void mapExtent(PostProcessingContext ppc, int coord, Extent extent,
                           IntFunction<Optional<Expression>> extractor,
                           Set<Variable> done, List<CallTreeNode> nodes) {
        if (extent instanceof Extent.Symbolic s) {
            Optional<Variable> live = ppc.liveVariableMatching(s.symbol());
            if (live.isEmpty()) {
                return;
            }
            Variable symbol = live.get();
            extractor.apply(coord).ifPresent(expr -> {
                if (done.add(symbol)) {
                    nodes.add(definition(symbol, maybeCast(expr, symbol.type())));
                } else {
                    nodes.add(Statements.of("/* " + expr.code() + " == " + symbol.name() + " */"));
                }
            });
        } else if (extent instanceof Extent.Fixed f) {
            extractor.apply(coord).ifPresent(expr ->
                    nodes.add(Statements.of("/* " + expr.code() + " == " + f.value() + " */")));
        }
    }

    private Expression maybeCast(Expression expr, CppType targetType) {
        if (!castIndexingSymbols) {
            return expr;
        }
        return new Expression(targetType).bind("{}( {} )", targetType.deconstified(), expr);
    }

    static Statements definition(Variable target, Expression expr) {
        return new Statements(
                target.type().cString() + " " + target.name() + " { " + expr.code() + " };",
                Set.of(target),
                expr.depends(),
                expr.includes());
    }
}
