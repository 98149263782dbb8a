package org.sfgen.ir.entities;

/**
 * Renders method signatures, either inside the class body or qualified by the class name.
 */
public final class MethodSignature {

    private MethodSignature() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param m A bound method.
     * @param inClass Whether the signature appears inside the class body.
     * @return The signature without terminating semicolon or body.
     */
    public static String render(Method m, boolean inClass) {
        StringBuilder sb = new StringBuilder(FunctionSignature.attributes(m.attributes()));
        if (inClass) {
            if (m.isStatic()) {
                sb.append("static ");
            }
            if (m.isVirtual()) {
                sb.append("virtual ");
            }
        }
        if (m.isConstexpr()) {
            sb.append("constexpr ");
        }
        sb.append(m.returnType().cString()).append(' ');
        if (!inClass) {
            sb.append(m.owningClass().name()).append("::");
        }
        sb.append(m.name()).append('(').append(FunctionSignature.parameterList(m.parameters())).append(')');
        if (m.isConst()) {
            sb.append(" const");
        }
        if (m.isOverride() && inClass) {
            sb.append(" override");
        }
        return sb.toString();
    }
}
