package org.sfgen.context;

/**
 * Raw code placed at namespace level of the header, e.g. type aliases or constants.
 *
 * @param text The code text.
 */
public record CustomDefinition(String text) implements Declaration {

    @Override
    public String declarationName() {
        return text;
    }
}
