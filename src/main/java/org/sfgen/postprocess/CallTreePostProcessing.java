package org.sfgen.postprocess;

import org.sfgen.ir.CallTreeLeaf;
import org.sfgen.ir.CallTreeNode;
import org.sfgen.ir.DeferredNode;
import org.sfgen.ir.Sequence;
import org.sfgen.ir.Statements;
import org.sfgen.lang.SfgException;
import org.sfgen.lang.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Resolves a call tree: flattens nested sequences, expands deferred nodes and computes
 * the set of free variables the tree requires.
 * <p>
 * Each sequence is scanned in reverse emission order with its own live set. Deferred
 * nodes are expanded with the live set at their position. All other nodes are scopes
 * of their own: their children are processed independently and the results are merged.
 * The tree is mutated in place and must be processed exactly once.
 */
public class CallTreePostProcessing {

    private static final Logger LOG = LoggerFactory.getLogger(CallTreePostProcessing.class);

    /**
     * Processes the given tree.
     *
     * @param root The root of the tree.
     * @return The free variables of the tree and all warnings raised.
     * @throws SfgException if the root is a deferred node or a variable conflict occurs.
     */
    public PostProcessingResult process(CallTreeNode root) {
        List<String> warnings = new ArrayList<>();
        Set<Variable> params = liveVariables(root, warnings);
        LOG.debug("Call tree requires {} free variable(s): {}", params.size(), params);
        return new PostProcessingResult(params, warnings);
    }

    private Set<Variable> liveVariables(CallTreeNode node, List<String> warnings) {
        if (node instanceof Sequence seq) {
            PostProcessingContext ppc = new PostProcessingContext(warnings);
            handleSequence(seq, ppc);
            return ppc.liveVariables();
        }
        if (node instanceof DeferredNode) {
            throw new SfgException("Deferred nodes can only occur inside a sequence.");
        }
        PostProcessingContext merged = new PostProcessingContext(warnings);
        if (node instanceof CallTreeLeaf leaf) {
            merged.use(leaf.depends());
        }
        for (CallTreeNode child : node.children()) {
            merged.use(liveVariables(child, warnings));
        }
        return merged.liveVariables();
    }

    private void handleSequence(Sequence seq, PostProcessingContext ppc) {
        seq.flatten();
        ppc.enter();
        try {
            List<CallTreeNode> children = seq.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                CallTreeNode c = children.get(i);

                if (c instanceof DeferredNode deferred) {
                    c = deferred.expand(ppc);
                    children.set(i, c);
                }

                if (c instanceof Sequence nested) {
                    handleSequence(nested, ppc);
                } else {
                    if (c instanceof Statements stmts) {
                        ppc.define(stmts.defines(), stmts.code());
                    }
                    ppc.use(liveVariables(c, ppc.warningSink()));
                }
            }
        } finally {
            ppc.leave();
        }
        seq.flatten();
    }
}
