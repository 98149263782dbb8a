package org.sfgen.lang;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A C++ expression annotated with the variables it depends on.
 * <p>
 * An expression is created unbound, optionally with a data type, and receives its code
 * exactly once through {@link #bind(String, Object...)} or {@link #var(String)}. Composition
 * unions the dependency sets of all arguments. An expression bound through {@link #var(String)}
 * literally denotes one variable and can be converted back with {@link #asVariable()}.
 */
public class Expression {

    private final CppType type;
    private DependentExpression bound;
    private Variable boundVariable;

    public Expression() {
        this(null);
    }

    public Expression(CppType type) {
        this.type = type;
    }

    /**
     * Creates a new untyped expression from a format template.
     *
     * @param fmt Template using {@code {}} as positional placeholder; {@code {{}} and {@code }}} escape braces.
     * @param args Sub-expressions, variables, symbols or plain values.
     * @return The composed expression.
     */
    public static Expression format(String fmt, Object... args) {
        return new Expression().bind(fmt, args);
    }

    /**
     * @param name The variable name.
     * @param type The variable type.
     * @return An expression bound to a new variable.
     */
    public static Expression variable(String name, CppType type) {
        return new Expression(type).var(name);
    }

    /**
     * Binds this expression to a newly composed piece of code.
     *
     * @param fmt Format template.
     * @param args Template arguments.
     * @return This expression.
     * @throws SfgException if this expression is already bound or an argument is a symbolic
     *         expression with untyped free symbols.
     */
    public Expression bind(String fmt, Object... args) {
        Set<Variable> deps = new LinkedHashSet<>();
        Set<HeaderFile> incls = new LinkedHashSet<>();
        for (Object arg : args) {
            if (arg == null) {
                throw new IllegalArgumentException("Null argument in expression template: " + fmt);
            }
            deps.addAll(Variables.dependsOf(arg));
            incls.addAll(Variables.includesOf(arg));
        }
        String code = substitute(fmt, args);
        doBind(new DependentExpression(code, deps, incls));
        return this;
    }

    /**
     * Binds this expression to a new variable of this expression's type.
     *
     * @param name The variable name.
     * @return This expression.
     */
    public Expression var(String name) {
        Variable v = new Variable(name, requireType());
        doBind(new DependentExpression(name, Set.of(v), v.includes()));
        this.boundVariable = v;
        return this;
    }

    private void doBind(DependentExpression expr) {
        if (bound != null) {
            throw new SfgException("Attempting to bind an already-bound expression: " + bound.code());
        }
        bound = expr;
    }

    public boolean isBound() {
        return bound != null;
    }

    /**
     * @return Whether this expression literally denotes a variable.
     */
    public boolean isVariable() {
        return boundVariable != null;
    }

    public Optional<CppType> type() {
        return Optional.ofNullable(type);
    }

    public CppType requireType() {
        if (type == null) {
            throw new SfgException("This expression has no known data type.");
        }
        return type;
    }

    public DependentExpression expression() {
        if (bound == null) {
            throw new SfgException("Unbound expression: no code was bound to this expression.");
        }
        return bound;
    }

    public String code() {
        return expression().code();
    }

    public Set<Variable> depends() {
        return expression().depends();
    }

    public Set<HeaderFile> includes() {
        Set<HeaderFile> out = new LinkedHashSet<>(expression().includes());
        if (type != null) {
            out.addAll(type.headers());
        }
        return out;
    }

    /**
     * @return The variable this expression denotes.
     * @throws SfgException if the expression is unbound or not bound to a variable.
     */
    public Variable asVariable() {
        expression();
        if (boundVariable == null) {
            throw new SfgException("Expression '" + bound.code() + "' does not denote a variable.");
        }
        return boundVariable;
    }

    @Override
    public String toString() {
        return bound == null ? "/* [ERROR] unbound expression */" : bound.code();
    }

    private static String substitute(String fmt, Object[] args) {
        StringBuilder sb = new StringBuilder();
        int next = 0;
        int i = 0;
        while (i < fmt.length()) {
            char c = fmt.charAt(i);
            if (c == '{' && i + 1 < fmt.length() && fmt.charAt(i + 1) == '{') {
                sb.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < fmt.length() && fmt.charAt(i + 1) == '}') {
                sb.append('}');
                i += 2;
            } else if (c == '{' && i + 1 < fmt.length() && fmt.charAt(i + 1) == '}') {
                if (next >= args.length) {
                    throw new IllegalArgumentException("Too few arguments for template: " + fmt);
                }
                sb.append(render(args[next++]));
                i += 2;
            } else {
                sb.append(c);
                i++;
            }
        }
        if (next != args.length) {
            throw new IllegalArgumentException("Too many arguments for template: expected "
                    + next + ", but got " + args.length + " (" + fmt + ")");
        }
        return sb.toString();
    }

    private static String render(Object arg) {
        if (arg instanceof Expression e) {
            return e.code();
        }
        if (arg instanceof CppType t) {
            return t.cString();
        }
        if (arg instanceof Symbol s) {
            return s.name();
        }
        return String.valueOf(arg);
    }
}
