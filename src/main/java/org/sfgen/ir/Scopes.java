package org.sfgen.ir;

import org.sfgen.config.CodeStyle;

/**
 * Rendering helpers for braced scopes.
 */
public final class Scopes {

    private Scopes() {
        // Private constructor to prevent instantiation
    }

    /**
     * Renders {@code opener{ body }} with the body indented by one level.
     *
     * @param opener Text before the opening brace, e.g. {@code if(c) }.
     * @param body The unindented body, may be empty.
     * @param style The code style.
     * @return The braced scope, without trailing line break.
     */
    public static String braced(String opener, String body, CodeStyle style) {
        StringBuilder sb = new StringBuilder(opener).append("{\n");
        if (!body.isEmpty()) {
            sb.append(style.indent(body)).append('\n');
        }
        return sb.append('}').toString();
    }
}
