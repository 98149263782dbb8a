package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.lang.SfgException;
import org.sfgen.postprocess.PostProcessingContext;

import java.util.List;
import java.util.Objects;

/**
 * Placeholder for code that depends on which variables are still required downstream.
 * <p>
 * A deferred node has no children and no code of its own. It must be replaced by its
 * expansion during postprocessing before the tree can be printed.
 */
public final class DeferredNode implements CallTreeNode {

    private final String description;
    private final DeferredExpansion expansion;
    private boolean expanded;

    public DeferredNode(String description, DeferredExpansion expansion) {
        this.description = Objects.requireNonNull(description, "description");
        this.expansion = Objects.requireNonNull(expansion, "expansion");
    }

    public String description() {
        return description;
    }

    /**
     * Expands this node.
     *
     * @param ppc The context of the enclosing scope traversal.
     * @return The replacement node.
     * @throws SfgException if the context does not belong to an active scope traversal,
     *         or if this node was already expanded.
     */
    public CallTreeNode expand(PostProcessingContext ppc) {
        if (!ppc.isActive()) {
            throw new SfgException("Deferred node '" + description
                    + "' can only be expanded while postprocessing its enclosing sequence.");
        }
        if (expanded) {
            throw new SfgException("Deferred node '" + description + "' was already expanded.");
        }
        expanded = true;
        return Objects.requireNonNull(expansion.expand(ppc), "expansion result");
    }

    @Override
    public List<CallTreeNode> children() {
        throw invalidAccess();
    }

    @Override
    public String render(CodeStyle style) {
        throw invalidAccess();
    }

    private SfgException invalidAccess() {
        return new SfgException("Invalid access into deferred node '" + description
                + "'; deferred nodes must be expanded first.");
    }

    @Override
    public String toString() {
        return "Deferred[" + description + "]";
    }
}
