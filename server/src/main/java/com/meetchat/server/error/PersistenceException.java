package com.meetchat.server.error;

/**
 * The durable store failed or is unreachable. Callers log it, skip the broadcast and tell the
 * originating connection; the connection itself stays open.
 */
public class PersistenceException extends ChatException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
}
