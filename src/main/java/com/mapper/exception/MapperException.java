package com.mapper.exception;

import com.mapper.model.AttributePath;

/**
 * Base runtime exception for failures while loading or lowering OpenAPI schemas.
 * <p>
 * Lowering failures carry the dotted {@link AttributePath} of the attribute being built, so the
 * message always names the exact location in the document. Failures are terminal for the subtree:
 * the input is static data and retrying cannot help.
 */
public class MapperException extends RuntimeException {

    private final transient AttributePath path;

    /**
     * Constructs a new MapperException that is not tied to an attribute, e.g. an unreadable document.
     *
     * @param message The detail message.
     */
    public MapperException(String message) {
        this(message, (Throwable) null);
    }

    /**
     * Constructs a new MapperException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The cause, may be {@code null}.
     */
    public MapperException(String message, Throwable cause) {
        super(message, cause);
        this.path = null;
    }

    /**
     * Constructs a new MapperException for the attribute at {@code path}. The path is prefixed to the
     * message.
     *
     * @param path    The attribute the failure belongs to.
     * @param message The detail message.
     */
    public MapperException(AttributePath path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    /**
     * @return The attribute the failure belongs to, or {@code null} when the failure is not tied to one.
     */
    public AttributePath getPath() {
        return path;
    }
}
