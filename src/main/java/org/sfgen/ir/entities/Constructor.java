package org.sfgen.ir.entities;

import org.sfgen.lang.Expression;
import org.sfgen.lang.Variable;
import org.sfgen.lang.Variables;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A constructor of a class with parameters, a member initializer list and a raw body.
 */
public class Constructor extends ClassMember {

    /**
     * One entry of the member initializer list: {@code target(args)}.
     *
     * @param target The initialized member or base.
     * @param args The initializer arguments.
     */
    public record Initializer(String target, List<String> args) {
        public Initializer {
            args = List.copyOf(args);
        }

        @Override
        public String toString() {
            return target + "(" + String.join(", ", args) + ")";
        }
    }

    private final List<Variable> parameters;
    private final List<Initializer> initializers;
    private final String body;

    private Constructor(List<Variable> parameters, List<Initializer> initializers, String body) {
        this.parameters = List.copyOf(parameters);
        this.initializers = List.copyOf(initializers);
        this.body = body;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Variable> parameters() {
        return parameters;
    }

    public List<Initializer> initializers() {
        return initializers;
    }

    public String body() {
        return body;
    }

    @Override
    public String toString() {
        return "constructor" + parameters;
    }

    /**
     * Builder for constructors. Initializers keep the order in which they were added.
     */
    public static final class Builder {
        private final List<Variable> parameters = new ArrayList<>();
        private final List<Initializer> initializers = new ArrayList<>();
        private String body = "";

        private Builder() {
        }

        public Builder param(Object var) {
            parameters.add(Variables.canonicalize(var));
            return this;
        }

        /**
         * @param target A member variable, variable or name.
         * @param args Initializer arguments.
         * @return This builder.
         */
        public Builder init(Object target, Object... args) {
            String name;
            if (target instanceof MemberVariable mv) {
                name = mv.name();
            } else if (target instanceof String s) {
                name = s;
            } else {
                name = Variables.canonicalize(target).name();
            }
            List<String> codes = Arrays.stream(args).map(a -> Expression.format("{}", a).code()).toList();
            initializers.add(new Initializer(name, codes));
            return this;
        }

        public Builder body(String text) {
            this.body = text;
            return this;
        }

        public Constructor build() {
            return new Constructor(parameters, initializers, body);
        }
    }
}
