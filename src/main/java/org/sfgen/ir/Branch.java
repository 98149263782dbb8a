package org.sfgen.ir;

import org.sfgen.config.CodeStyle;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@code if}/{@code else} construct. Both arms are independent scopes.
 */
public final class Branch implements CallTreeNode {

    private final CallTreeNode[] children;

    /**
     * @param condition The condition leaf.
     * @param ifTrue The true arm.
     * @param ifFalse The false arm, or {@code null}.
     */
    public Branch(CallTreeLeaf condition, Sequence ifTrue, Sequence ifFalse) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(ifTrue, "ifTrue");
        this.children = ifFalse == null
                ? new CallTreeNode[] {condition, ifTrue}
                : new CallTreeNode[] {condition, ifTrue, ifFalse};
    }

    public CallTreeLeaf condition() {
        return (CallTreeLeaf) children[0];
    }

    public Sequence ifTrue() {
        return (Sequence) children[1];
    }

    public Optional<Sequence> ifFalse() {
        return children.length > 2 ? Optional.of((Sequence) children[2]) : Optional.empty();
    }

    @Override
    public List<CallTreeNode> children() {
        return new FixedChildren(children, (i, c) -> {
            if (i == 0) {
                if (!(c instanceof CallTreeLeaf)) {
                    throw new IllegalArgumentException("Branch condition must be a leaf");
                }
            } else {
                Block.requireSequence(c);
            }
        });
    }

    @Override
    public String render(CodeStyle style) {
        String code = Scopes.braced("if(" + condition().render(style) + ") ", ifTrue().render(style), style);
        if (children.length > 2) {
            code += Scopes.braced(" else ", ifFalse().orElseThrow().render(style), style);
        }
        return code;
    }
}
