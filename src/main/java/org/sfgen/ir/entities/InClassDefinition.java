package org.sfgen.ir.entities;

/**
 * Raw text inside a class body.
 */
public class InClassDefinition extends ClassMember {

    private final String text;

    public InClassDefinition(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return "in-class definition";
    }
}
