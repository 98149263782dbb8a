package org.sfgen.ir;

import org.sfgen.config.CodeStyle;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One labelled case of a {@link Switch}, or its default case.
 */
public final class SwitchCase implements CallTreeNode {

    private final String label;
    private final CallTreeNode[] children;

    private SwitchCase(String label, Sequence body) {
        this.label = label;
        this.children = new CallTreeNode[] {Objects.requireNonNull(body, "body")};
    }

    public static SwitchCase of(String label, Sequence body) {
        return new SwitchCase(Objects.requireNonNull(label, "label"), body);
    }

    public static SwitchCase defaultCase(Sequence body) {
        return new SwitchCase(null, body);
    }

    /**
     * @return The case label, empty for the default case.
     */
    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public boolean isDefault() {
        return label == null;
    }

    public Sequence body() {
        return (Sequence) children[0];
    }

    @Override
    public List<CallTreeNode> children() {
        return new FixedChildren(children, (i, c) -> Block.requireSequence(c));
    }

    @Override
    public String render(CodeStyle style) {
        String body = body().render(style);
        body = body.isEmpty() ? "break;" : body + "\nbreak;";
        return Scopes.braced(isDefault() ? "default: " : "case " + label + ": ", body, style);
    }
}
