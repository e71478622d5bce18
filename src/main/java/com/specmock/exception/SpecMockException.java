package com.specmock.exception;

/**
 * Base runtime exception for application-specific errors within the mock server.
 * <p>
 * Subclasses separate failures that abort startup from failures that only affect the
 * request being served, so each can be reported the way it deserves.
 */
public class SpecMockException extends RuntimeException {

    /**
     * Constructs a new SpecMockException with the specified detail message.
     *
     * @param message The detail message, which is saved for later retrieval by the
     *                {@link #getMessage()} method.
     */
    public SpecMockException(String message) {
        super(message);
    }

    /**
     * Constructs a new SpecMockException with the specified detail message and cause.
     *
     * @param message The detail message (which is saved for later retrieval by the
     *                {@link #getMessage()} method).
     * @param cause   The cause (which is saved for later retrieval by the
     *                {@link #getCause()} method). A {@code null} value is permitted.
     */
    public SpecMockException(String message, Throwable cause) {
        super(message, cause);
    }
}
