package org.sfgen.config;

import java.util.stream.Collectors;

/**
 * Formatting options for printed code.
 *
 * @param indentWidth Number of spaces per nesting level.
 */
public record CodeStyle(int indentWidth) {

    public static final CodeStyle DEFAULT = new CodeStyle(2);

    public CodeStyle {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + indentWidth);
        }
    }

    /**
     * Indents every non-blank line of the given text by one level.
     *
     * @param text The text to indent.
     * @return The indented text.
     */
    public String indent(String text) {
        String prefix = " ".repeat(indentWidth);
        return text.lines()
                .map(line -> line.isBlank() ? "" : prefix + line)
                .collect(Collectors.joining("\n"));
    }
}
