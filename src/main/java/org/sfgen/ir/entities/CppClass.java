package org.sfgen.ir.entities;

import org.sfgen.context.Declaration;
import org.sfgen.lang.CppType;
import org.sfgen.lang.SfgException;
import org.sfgen.lang.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A C++ class or struct: an ordered list of visibility blocks holding its members.
 * <p>
 * The first block is the unlabeled default block; it is always present, but printed
 * only when it holds members.
 */
public final class CppClass implements Declaration {

    private final String name;
    private final ClassKeyword keyword;
    private final List<String> baseClasses;
    private final List<VisibilityBlock> blocks = new ArrayList<>();
    private final Map<String, MemberVariable> memberVariables = new LinkedHashMap<>();

    public CppClass(String name) {
        this(name, ClassKeyword.CLASS, List.of());
    }

    /**
     * @param name The class name.
     * @param keyword {@code class} or {@code struct}.
     * @param baseClasses Base class specifiers, e.g. {@code public Base}.
     */
    public CppClass(String name, ClassKeyword keyword, List<String> baseClasses) {
        this.name = Objects.requireNonNull(name, "name");
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.baseClasses = List.copyOf(baseClasses);
        blocks.add(new VisibilityBlock(Visibility.DEFAULT));
    }

    public String name() {
        return name;
    }

    public ClassKeyword keyword() {
        return keyword;
    }

    public List<String> baseClasses() {
        return baseClasses;
    }

    public CppType type() {
        return CppType.of(name);
    }

    /**
     * Adds a member. Consecutive members of equal visibility share one block.
     *
     * @param member The member to bind to this class.
     * @param visibility The member's visibility.
     * @return This class.
     * @throws SfgException if the member is already bound, a member variable of the same
     *         name exists, or default visibility is requested after a labeled block.
     */
    public CppClass add(ClassMember member, Visibility visibility) {
        VisibilityBlock last = blocks.get(blocks.size() - 1);
        if (visibility == Visibility.DEFAULT && last.visibility() != Visibility.DEFAULT) {
            throw new SfgException("Cannot add members with default visibility after a visibility block.");
        }
        if (last.visibility() != visibility) {
            last = new VisibilityBlock(visibility);
            blocks.add(last);
        }
        bindInto(last, member);
        return this;
    }

    /**
     * Appends a new visibility block with the given members.
     *
     * @param visibility The block's visibility.
     * @param members The members.
     * @return This class.
     */
    public CppClass addBlock(Visibility visibility, ClassMember... members) {
        if (visibility == Visibility.DEFAULT) {
            for (ClassMember m : members) {
                add(m, Visibility.DEFAULT);
            }
            return this;
        }
        VisibilityBlock block = new VisibilityBlock(visibility);
        blocks.add(block);
        for (ClassMember m : members) {
            bindInto(block, m);
        }
        return this;
    }

    private void bindInto(VisibilityBlock block, ClassMember member) {
        if (member.isBound()) {
            throw new SfgException(member + " is already bound to class " + member.owningClass().name() + ".");
        }
        if (member instanceof MemberVariable mv) {
            if (memberVariables.containsKey(mv.name())) {
                throw new SfgException("Duplicate field name " + mv.name() + " in class " + name);
            }
            memberVariables.put(mv.name(), mv);
        }
        member.bind(this, block.visibility());
        block.add(member);
    }

    /**
     * @param v A free variable of a method body.
     * @return Whether the variable is a member variable of this class.
     */
    boolean providesMember(Variable v) {
        MemberVariable mv = memberVariables.get(v.name());
        return mv != null && mv.type().sameIgnoringConst(v.type());
    }

    public List<VisibilityBlock> visibilityBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public Stream<ClassMember> members() {
        return blocks.stream().flatMap(b -> b.members().stream());
    }

    public List<Method> methods() {
        return members().filter(Method.class::isInstance).map(Method.class::cast).toList();
    }

    public List<Constructor> constructors() {
        return members().filter(Constructor.class::isInstance).map(Constructor.class::cast).toList();
    }

    public List<MemberVariable> memberVariables() {
        return List.copyOf(memberVariables.values());
    }

    @Override
    public String declarationName() {
        return name;
    }

    @Override
    public String toString() {
        return keyword + " " + name;
    }
}
