package com.qoeguard.core.json;

/**
 * Thrown when a baseline or candidate document cannot be read or decoded.
 */
public class JsonInputException extends RuntimeException {
    public JsonInputException(String message) {
        super(message);
    }

    public JsonInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
