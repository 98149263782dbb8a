package org.sfgen.ir.entities;

import org.sfgen.lang.CppType;
import org.sfgen.lang.Expression;
import org.sfgen.lang.Variable;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A data member of a class, optionally with a default member initializer.
 */
public class MemberVariable extends ClassMember {

    private final Variable variable;
    private final List<String> defaultInit;

    public MemberVariable(String name, CppType type) {
        this(new Variable(name, type), null);
    }

    private MemberVariable(Variable variable, List<String> defaultInit) {
        this.variable = variable;
        this.defaultInit = defaultInit;
    }

    /**
     * Creates a member variable with a default initializer {@code T name{args};}.
     *
     * @param name The member name.
     * @param type The member type.
     * @param args Initializer arguments.
     * @return The member variable.
     */
    public static MemberVariable withDefault(String name, CppType type, Object... args) {
        List<String> init = Arrays.stream(args).map(a -> Expression.format("{}", a).code()).toList();
        return new MemberVariable(new Variable(name, type), init);
    }

    public String name() {
        return variable.name();
    }

    public CppType type() {
        return variable.type();
    }

    public Variable variable() {
        return variable;
    }

    public Optional<List<String>> defaultInit() {
        return Optional.ofNullable(defaultInit);
    }

    @Override
    public String toString() {
        return "member variable " + variable.nameAndType();
    }
}
