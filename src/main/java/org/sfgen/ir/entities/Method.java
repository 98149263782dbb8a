package org.sfgen.ir.entities;

import org.sfgen.ir.CallTreeNode;
import org.sfgen.lang.CppType;
import org.sfgen.lang.SfgException;
import org.sfgen.lang.Variable;
import org.sfgen.lang.Variables;
import org.sfgen.postprocess.CallTreePostProcessing;
import org.sfgen.postprocess.PostProcessingResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An instance method of a class.
 * <p>
 * The body is resolved when the method is bound to its class. Member variables of the class
 * are available implicitly and never become parameters.
 */
public class Method extends ClassMember {

    private final String name;
    private final CallTreeNode tree;
    private final CppType returnType;
    private final boolean inline;
    private final boolean constexpr;
    private final boolean isConst;
    private final boolean isStatic;
    private final boolean virtual;
    private final boolean override;
    private final List<String> attributes;
    private final List<Variable> requiredParams;

    private Set<Variable> freeVariables;
    private List<String> warnings = List.of();

    private Method(Builder b) {
        this.name = b.name;
        this.tree = b.tree;
        this.returnType = b.returnType;
        this.inline = b.inline;
        this.constexpr = b.constexpr;
        this.isConst = b.isConst;
        this.isStatic = b.isStatic;
        this.virtual = b.virtual;
        this.override = b.override;
        this.attributes = List.copyOf(b.attributes);
        this.requiredParams = b.requiredParams;
    }

    public static Builder builder(String name, CallTreeNode tree) {
        return new Builder(name, tree);
    }

    @Override
    protected void onBind(CppClass cls) {
        PostProcessingResult result = new CallTreePostProcessing().process(tree);
        this.freeVariables = result.functionParams();
        this.warnings = result.warnings();
    }

    public String name() {
        return name;
    }

    public CallTreeNode tree() {
        return tree;
    }

    /**
     * The free variables of the body minus the member variables the class has at the time of
     * the call, so members added after this method are excluded as well.
     *
     * @return The parameter list.
     * @throws SfgException if the method is not yet bound to a class, or explicit parameters were
     *         given and the body has further free variables.
     */
    public List<Variable> parameters() {
        if (freeVariables == null) {
            throw new SfgException("Parameters of method " + name + " are unknown until it is bound to a class.");
        }
        CppClass cls = owningClass();
        return ParameterCollection.select("method " + cls.name() + "::" + name,
                freeVariables, requiredParams, cls::providesMember);
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

    public boolean isConst() {
        return isConst;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isVirtual() {
        return virtual;
    }

    public boolean isOverride() {
        return override;
    }

    public List<String> attributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "method " + name;
    }

    /**
     * Builder for {@link Method}.
     */
    public static final class Builder {
        private final String name;
        private final CallTreeNode tree;
        private CppType returnType = CppType.VOID;
        private boolean inline;
        private boolean constexpr;
        private boolean isConst;
        private boolean isStatic;
        private boolean virtual;
        private boolean override;
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

        public Builder constQualified(boolean value) {
            this.isConst = value;
            return this;
        }

        public Builder staticMethod(boolean value) {
            this.isStatic = value;
            return this;
        }

        public Builder virtual(boolean value) {
            this.virtual = value;
            return this;
        }

        public Builder override(boolean value) {
            this.override = value;
            return this;
        }

        public Builder attribute(String attr) {
            attributes.add(attr);
            return this;
        }

        public Builder params(Object... params) {
            List<Variable> vars = new ArrayList<>();
            for (Object p : params) {
                vars.add(Variables.canonicalize(p));
            }
            this.requiredParams = vars;
            return this;
        }

        public Method build() {
            return new Method(this);
        }
    }
}
