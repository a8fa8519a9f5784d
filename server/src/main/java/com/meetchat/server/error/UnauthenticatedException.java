package com.meetchat.server.error;

public class UnauthenticatedException extends ChatException {

    public UnauthenticatedException(String message) {
        super(ErrorKind.UNAUTHENTICATED, message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(ErrorKind.UNAUTHENTICATED, message, cause);
    }
}
