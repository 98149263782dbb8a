package org.sfgen.ir.entities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of class members printed under one visibility keyword.
 */
public final class VisibilityBlock {

    private final Visibility visibility;
    private final List<ClassMember> members = new ArrayList<>();

    VisibilityBlock(Visibility visibility) {
        this.visibility = visibility;
    }

    public Visibility visibility() {
        return visibility;
    }

    public List<ClassMember> members() {
        return Collections.unmodifiableList(members);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    void add(ClassMember member) {
        members.add(member);
    }
}
