package com.meetchat.server.error;

public enum ErrorKind {
    VALIDATION,
    UNAUTHENTICATED,
    AUTHORIZATION,
    NOT_FOUND,
    PERSISTENCE,
    PROTOCOL
}
