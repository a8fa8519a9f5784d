package com.meetchat.server.error;

/**
 * Base of every failure that is reported back to the caller that caused it.
 * The message is client-safe; causes are only logged.
 */
public abstract class ChatException extends RuntimeException {
    private final ErrorKind kind;

    protected ChatException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ChatException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
