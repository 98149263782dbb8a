package org.sfgen.lang;

/**
 * Unchecked exception for structural misuse of the generator's building blocks:
 * reading unbound expressions, accessing unexpanded deferred nodes, duplicate
 * registrations and similar programming errors in the composition layer.
 * <p>
 * These errors are fatal; code generation for the whole file is aborted.
 */
public class SfgException extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public SfgException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause The cause.
     */
    public SfgException(String message, Throwable cause) {
        super(message, cause);
    }
}
