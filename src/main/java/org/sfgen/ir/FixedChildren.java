package org.sfgen.ir;

import java.util.AbstractList;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.function.BiConsumer;

/**
 * Fixed-size list view over a node's child array. Replacements are checked by a validator.
 */
final class FixedChildren extends AbstractList<CallTreeNode> implements RandomAccess {

    private final CallTreeNode[] slots;
    private final BiConsumer<Integer, CallTreeNode> validator;

    FixedChildren(CallTreeNode[] slots, BiConsumer<Integer, CallTreeNode> validator) {
        this.slots = slots;
        this.validator = validator;
    }

    @Override
    public CallTreeNode get(int index) {
        return slots[index];
    }

    @Override
    public CallTreeNode set(int index, CallTreeNode element) {
        Objects.requireNonNull(element, "element");
        Objects.checkIndex(index, slots.length);
        validator.accept(index, element);
        CallTreeNode old = slots[index];
        slots[index] = element;
        return old;
    }

    @Override
    public int size() {
        return slots.length;
    }
}
