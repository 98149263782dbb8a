package org.sfgen.lang;

/**
 * Raised when two variables share a name but have incompatible data types.
 */
public class VariableConflictException extends SfgException {

    private final Variable first;
    private final Variable second;

    public VariableConflictException(String message, Variable first, Variable second) {
        super(message + ":\n    " + first.nameAndType() + "\nand\n    " + second.nameAndType());
        this.first = first;
        this.second = second;
    }

    public Variable first() {
        return first;
    }

    public Variable second() {
        return second;
    }
}
