package com.meetchat.server.error;

/**
 * Caller is neither host nor participant, or acts for another user.
 */
public class AuthorizationException extends ChatException {

    public AuthorizationException(String message) {
        super(ErrorKind.AUTHORIZATION, message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(ErrorKind.AUTHORIZATION, message, cause);
    }
}
