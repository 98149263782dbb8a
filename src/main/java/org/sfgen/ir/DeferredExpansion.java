package org.sfgen.ir;

import org.sfgen.postprocess.PostProcessingContext;

/**
 * Strategy that materializes a {@link DeferredNode} once the variables live at its
 * position are known.
 */
@FunctionalInterface
public interface DeferredExpansion {

    /**
     * @param ppc The postprocessing context holding the current live variables.
     * @return The concrete replacement node.
     */
    CallTreeNode expand(PostProcessingContext ppc);
}
