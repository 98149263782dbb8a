package org.sfgen.ir.entities;

import org.sfgen.context.Declaration;
import org.sfgen.ir.CallTreeNode;
import org.sfgen.lang.CppType;
import org.sfgen.lang.Variable;
import org.sfgen.lang.Variables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A free function.
 * <p>
 * The function's tree is postprocessed when the function is built; the parameter list is
 * fixed from then on.
 */
public final class Function implements Declaration {

    private static final Logger LOG = LoggerFactory.getLogger(Function.class);

    private final String name;
    private final CallTreeNode tree;
    private final List<Variable> parameters;
    private final List<String> warnings;
    private final CppType returnType;
    private final boolean inline;
    private final boolean constexpr;
    private final List<String> attributes;

    private Function(Builder b) {
        this.name = b.name;
        this.tree = b.tree;
        this.returnType = b.returnType;
        this.inline = b.inline;
        this.constexpr = b.constexpr;
        this.attributes = List.copyOf(b.attributes);
        ParameterCollection.Collected collected = ParameterCollection.collect(
                "function " + name, tree, b.requiredParams, v -> false);
        this.parameters = collected.params();
        this.warnings = collected.warnings();
        LOG.debug("Function {} has {} parameter(s)", name, parameters.size());
    }

    public static Builder builder(String name, CallTreeNode tree) {
        return new Builder(name, tree);
    }

    public String name() {
        return name;
    }

    /**
     * @return The resolved tree.
     */
    public CallTreeNode tree() {
        return tree;
    }

    public List<Variable> parameters() {
        return parameters;
    }

    public List<String> warnings() {
        return warnings;
    }

    public CppType returnType() {
        return returnType;
    }

    public boolean isInline() {
        return inline;
    }

    public boolean isConstexpr() {
        return constexpr;
    }

    public List<String> attributes() {
        return attributes;
    }

    @Override
    public String declarationName() {
        return name;
    }

    @Override
    public String toString() {
        return "function " + name;
    }

    /**
     * Builder for {@link Function}.
     */
    public static final class Builder {
        private final String name;
        private final CallTreeNode tree;
        private CppType returnType = CppType.VOID;
        private boolean inline;
        private boolean constexpr;
        private final List<String> attributes = new ArrayList<>();
        private List<Variable> requiredParams;

        private Builder(String name, CallTreeNode tree) {
            this.name = Objects.requireNonNull(name, "name");
            this.tree = Objects.requireNonNull(tree, "tree");
        }

        public Builder returnType(CppType type) {
            this.returnType = type;
            return this;
        }

        public Builder inline(boolean value) {
            this.inline = value;
            return this;
        }

        public Builder constexpr(boolean value) {
            this.constexpr = value;
            return this;
        }

        public Builder attribute(String attr) {
            attributes.add(attr);
            return this;
        }

        /**
         * Lists the parameters explicitly, in order. The tree's free variables must be a subset.
         *
         * @param params Variable-like objects.
         * @return This builder.
         */
        public Builder params(Object... params) {
            List<Variable> vars = new ArrayList<>();
            for (Object p : params) {
                vars.add(Variables.canonicalize(p));
            }
            this.requiredParams = vars;
            return this;
        }

        public Function build() {
            return new Function(this);
        }
    }
}
