package com.whisk.shopkeeper.exception;

/**
 * Machine-readable error categories returned to API clients.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_INPUT,
    UNAUTHENTICATED
}
