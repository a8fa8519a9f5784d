package com.meetchat.server.error;

/**
 * Malformed or unknown real-time event.
 */
public class ProtocolException extends ChatException {

    public ProtocolException(String message) {
        super(ErrorKind.PROTOCOL, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorKind.PROTOCOL, message, cause);
    }
}
