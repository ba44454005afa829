package com.whisk.shopkeeper.exception;

import org.springframework.http.HttpStatus;

/**
 * A referenced stock item, customer, invoice or recipe does not exist.
 */
public class NotFoundException extends ShopException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, HttpStatus.NOT_FOUND, message);
    }

    /**
     * For ids that arrive inside a request body rather than the path: the
     * request itself is rejected with 400 while the kind stays NOT_FOUND.
     */
    public static NotFoundException inRequestBody(String message) {
        return new NotFoundException(message, HttpStatus.BAD_REQUEST);
    }

    private NotFoundException(String message, HttpStatus status) {
        super(ErrorKind.NOT_FOUND, status, message);
    }
}
