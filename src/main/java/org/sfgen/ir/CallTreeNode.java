package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.lang.HeaderFile;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node of a call tree, the unit of generated code.
 * <p>
 * The set of node kinds is closed. Traversals dispatch over the permitted subtypes.
 * The children of a node are exposed as a fixed-size list: elements may be replaced
 * through {@link List#set(int, Object)}, but the list can never be resized. The only
 * operation that changes the number of children is {@link Sequence#flatten()}.
 */
public sealed interface CallTreeNode
        permits CallTreeLeaf, Sequence, Block, Branch, Switch, SwitchCase, DeferredNode {

    /**
     * @return This node's children, as a fixed-size, index-addressable view.
     */
    List<CallTreeNode> children();

    /**
     * Renders the code of this node. The returned text never ends in a line break.
     *
     * @param style The code style.
     * @return The code.
     */
    String render(CodeStyle style);

    /**
     * @return Headers required by this node itself, excluding its descendants.
     */
    default Set<HeaderFile> ownIncludes() {
        return Set.of();
    }

    /**
     * @return Headers required by this node and all of its descendants.
     */
    default Set<HeaderFile> requiredIncludes() {
        Set<HeaderFile> out = new LinkedHashSet<>(ownIncludes());
        for (CallTreeNode child : children()) {
            out.addAll(child.requiredIncludes());
        }
        return out;
    }
}
