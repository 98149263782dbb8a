package org.sfgen.ir;

import org.sfgen.config.CodeStyle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered list of nodes, printed one after another.
 * <p>
 * Sequences are the only nodes across which definitions propagate from one child
 * to the next.
 */
public final class Sequence implements CallTreeNode {

    private CallTreeNode[] children;

    public Sequence(List<? extends CallTreeNode> children) {
        this.children = children.stream().map(c -> Objects.requireNonNull(c, "child")).toArray(CallTreeNode[]::new);
    }

    public static Sequence empty() {
        return new Sequence(List.of());
    }

    public static Sequence of(CallTreeNode... children) {
        return new Sequence(Arrays.asList(children));
    }

    @Override
    public List<CallTreeNode> children() {
        return new FixedChildren(children, (i, c) -> { });
    }

    public boolean isEmpty() {
        return children.length == 0;
    }

    /**
     * Splices all directly or transitively nested sequences into this one, preserving the
     * left-to-right order of their children. Sequences inside other node kinds are left alone.
     * Flattening a flat sequence has no effect.
     *
     * @return This sequence.
     */
    public Sequence flatten() {
        List<CallTreeNode> flat = new ArrayList<>();
        collectFlat(this, flat);
        children = flat.toArray(CallTreeNode[]::new);
        return this;
    }

    private static void collectFlat(Sequence seq, List<CallTreeNode> out) {
        for (CallTreeNode c : seq.children) {
            if (c instanceof Sequence nested) {
                collectFlat(nested, out);
            } else {
                out.add(c);
            }
        }
    }

    @Override
    public String render(CodeStyle style) {
        return Arrays.stream(children)
                .map(c -> c.render(style))
                .filter(code -> !code.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "Sequence" + Arrays.toString(children);
    }
}
