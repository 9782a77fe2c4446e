package com.taskforge.resource;

/**
 * Raised when a resource document's {@code spec} cannot be read as the requested typed view.
 */
public class ResourceFormatException extends RuntimeException {

    public ResourceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
