package org.sfgen.ir.entities;

import org.sfgen.lang.Variable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the signature of a free function.
 */
public final class FunctionSignature {

    private FunctionSignature() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param f The function.
     * @param forceInline Whether to print {@code inline} regardless of the function's own flag.
     * @return e.g. {@code [[nodiscard]] inline double norm(const double x, const double y)}.
     */
    public static String render(Function f, boolean forceInline) {
        StringBuilder sb = new StringBuilder(attributes(f.attributes()));
        if (f.isInline() || forceInline) {
            sb.append("inline ");
        }
        if (f.isConstexpr()) {
            sb.append("constexpr ");
        }
        sb.append(f.returnType().cString()).append(' ')
                .append(f.name()).append('(').append(parameterList(f.parameters())).append(')');
        return sb.toString();
    }

    static String attributes(List<String> attrs) {
        return attrs.isEmpty() ? "" : "[[" + String.join(", ", attrs) + "]] ";
    }

    public static String parameterList(List<Variable> params) {
        return params.stream().map(Variable::declaration).collect(Collectors.joining(", "));
    }
}
