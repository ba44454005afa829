package com.whisk.shopkeeper.exception;

import org.springframework.http.HttpStatus;

public class InvalidInputException extends ShopException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, HttpStatus.BAD_REQUEST, message);
    }
}
