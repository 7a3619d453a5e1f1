package com.specgen.exception;

/**
 * A runtime exception for failures of the generator's collaborators.
 * <p>
 * Problems inside annotation text never raise this exception; they are dropped line by line. It is used when a
 * source file cannot be read or parsed, when the source directory is missing, or when the document cannot be
 * written.
 */
public class SpecGenException extends RuntimeException {

    /**
     * Constructs a new SpecGenException with the specified detail message.
     *
     * @param message The detail message.
     */
    public SpecGenException(String message) {
        super(message);
    }

    /**
     * Constructs a new SpecGenException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying failure, usually an {@link java.io.IOException} or a JavaParser problem.
     */
    public SpecGenException(String message, Throwable cause) {
        super(message, cause);
    }
}
