package org.sfgen.postprocess;

import org.sfgen.ir.CallTreeNode;
import org.sfgen.ir.DeferredNode;
import org.sfgen.ir.Sequence;

/**
 * Flattens every sequence of a call tree, so that each lexical scope is represented
 * by exactly one flat sequence. Deferred nodes are left untouched.
 */
public final class SequenceFlattener {

    private SequenceFlattener() {
        // Private constructor to prevent instantiation
    }

    /**
     * Flattens all sequences in the given tree in place.
     *
     * @param root The root of the tree.
     * @return The root.
     */
    public static CallTreeNode flattenAll(CallTreeNode root) {
        if (root instanceof DeferredNode) {
            return root;
        }
        if (root instanceof Sequence seq) {
            seq.flatten();
        }
        for (CallTreeNode child : root.children()) {
            flattenAll(child);
        }
        return root;
    }
}
