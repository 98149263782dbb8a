package org.sfgen.postprocess.deferred;

import org.sfgen.ir.CallTreeNode;
import org.sfgen.ir.DeferredExpansion;
import org.sfgen.ir.Sequence;
import org.sfgen.ir.Statements;
import org.sfgen.lang.Expression;
import org.sfgen.postprocess.PostProcessingContext;

import java.util.Set;

/**
 * Sets a parameter from an expression if, and only if, the parameter is live.
 * The definition uses the live variable's type: {@code T name = expr;}.
 */
public class ParamSetterExpansion implements DeferredExpansion {

    private final String paramName;
    private final Expression rhs;

    public ParamSetterExpansion(String paramName, Expression rhs) {
        this.paramName = paramName;
        this.rhs = rhs;
    }

    @Override
    public CallTreeNode expand(PostProcessingContext ppc) {
        return ppc.liveVariable(paramName)
                .<CallTreeNode>map(live -> new Statements(
                        live.type().cString() + " " + live.name() + " = " + rhs.code() + ";",
                        Set.of(live),
                        rhs.depends(),
                        rhs.includes()))
                .orElseGet(Sequence::empty);
    }
}
