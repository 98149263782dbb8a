package org.sfgen.ir;

import org.sfgen.lang.Variable;

import java.util.List;
import java.util.Set;

/**
 * A leaf of the call tree. Leaves declare which variables must be visible when they execute.
 */
public sealed interface CallTreeLeaf extends CallTreeNode
        permits Statements, FunctionParams, RequireIncludes, KernelCallNode, GpuKernelInvocation {

    /**
     * @return The variables this leaf reads.
     */
    Set<Variable> depends();

    @Override
    default List<CallTreeNode> children() {
        return List.of();
    }
}
