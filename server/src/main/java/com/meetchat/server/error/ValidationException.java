package com.meetchat.server.error;

/**
 * Rejected before any state change: blank or oversized text, malformed ids.
 */
public class ValidationException extends ChatException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
