package com.whisk.shopkeeper.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures that are reported to the caller as-is.
 */
public abstract class ShopException extends RuntimeException {

    private final ErrorKind kind;
    private final HttpStatus status;

    protected ShopException(ErrorKind kind, HttpStatus status, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
