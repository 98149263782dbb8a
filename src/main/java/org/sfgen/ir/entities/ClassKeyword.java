package org.sfgen.ir.entities;

public enum ClassKeyword {
    CLASS("class"),
    STRUCT("struct");

    private final String keyword;

    ClassKeyword(String keyword) {
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
