package org.sfgen.ir;

import org.sfgen.config.CodeStyle;

import java.util.List;
import java.util.Objects;

/**
 * A sequence wrapped in its own lexical scope: {@code { ... }}.
 */
public final class Block implements CallTreeNode {

    private final CallTreeNode[] children;

    public Block(Sequence body) {
        this.children = new CallTreeNode[] {Objects.requireNonNull(body, "body")};
    }

    public Sequence body() {
        return (Sequence) children[0];
    }

    @Override
    public List<CallTreeNode> children() {
        return new FixedChildren(children, (i, c) -> requireSequence(c));
    }

    static void requireSequence(CallTreeNode c) {
        if (!(c instanceof Sequence)) {
            throw new IllegalArgumentException("Expected a sequence, but got " + c.getClass().getSimpleName());
        }
    }

    @Override
    public String render(CodeStyle style) {
        return Scopes.braced("", body().render(style), style);
    }
}
