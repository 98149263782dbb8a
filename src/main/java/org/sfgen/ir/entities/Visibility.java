package org.sfgen.ir.entities;

/**
 * Visibility qualifiers of class members.
 */
public enum Visibility {
    /** The unlabeled block at the beginning of a class body. */
    DEFAULT(""),
    PRIVATE("private"),
    PROTECTED("protected"),
    PUBLIC("public");

    private final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
