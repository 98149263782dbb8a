package org.sfgen.api;

/**
 * Thrown when generating a source file fails.
 * <p>
 * It is part of the public API and hides the internal exception types of the generator.
 * Generation is all-or-nothing: when this exception is thrown, no output was produced.
 */
public class GenerationException extends Exception {

    /**
     * Constructs a new generation exception with the specified detail message.
     * @param message The detail message.
     */
    public GenerationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new generation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
