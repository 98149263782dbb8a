package org.sfgen.ir;

import org.sfgen.config.CodeStyle;
import org.sfgen.lang.SfgException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A {@code switch} construct. Every case body is an independent scope; the default case,
 * if present, is always the last case.
 */
public final class Switch implements CallTreeNode {

    private final CallTreeNode[] children;

    /**
     * @param argument The discriminant leaf.
     * @param cases The cases, in order.
     * @throws SfgException if a default case is not last or occurs more than once.
     */
    public Switch(CallTreeLeaf argument, List<SwitchCase> cases) {
        Objects.requireNonNull(argument, "argument");
        for (int i = 0; i < cases.size(); i++) {
            if (cases.get(i).isDefault() && i != cases.size() - 1) {
                throw new SfgException("Default case must be listed last.");
            }
        }
        List<CallTreeNode> all = new ArrayList<>();
        all.add(argument);
        all.addAll(cases);
        this.children = all.toArray(CallTreeNode[]::new);
    }

    public CallTreeLeaf argument() {
        return (CallTreeLeaf) children[0];
    }

    /**
     * @return All cases including the default case.
     */
    public List<SwitchCase> cases() {
        return Arrays.stream(children, 1, children.length).map(SwitchCase.class::cast).toList();
    }

    public Optional<SwitchCase> defaultCase() {
        if (children.length > 1 && ((SwitchCase) children[children.length - 1]).isDefault()) {
            return Optional.of((SwitchCase) children[children.length - 1]);
        }
        return Optional.empty();
    }

    @Override
    public List<CallTreeNode> children() {
        return new FixedChildren(children, this::validateReplacement);
    }

    private void validateReplacement(int index, CallTreeNode c) {
        if (index == 0) {
            if (!(c instanceof CallTreeLeaf)) {
                throw new IllegalArgumentException("Switch argument must be a leaf");
            }
            return;
        }
        if (!(c instanceof SwitchCase sc)) {
            throw new IllegalArgumentException("Switch children must be cases");
        }
        boolean replacesDefault = ((SwitchCase) children[index]).isDefault();
        if (sc.isDefault() && !replacesDefault) {
            throw new SfgException("Cannot replace normal case with default case.");
        }
        if (!sc.isDefault() && replacesDefault) {
            throw new SfgException("Cannot replace default case with normal case.");
        }
    }

    @Override
    public String render(CodeStyle style) {
        String body = cases().stream().map(c -> c.render(style)).collect(Collectors.joining("\n"));
        return "switch(" + argument().render(style) + ") {\n" + body + "\n}";
    }
}
