package com.whisk.shopkeeper.config;

import com.whisk.shopkeeper.dto.ApiError;
import com.whisk.shopkeeper.exception.ErrorKind;
import com.whisk.shopkeeper.exception.ShopException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ShopException.class)
    public ResponseEntity<ApiError> handleShopException(ShopException e) {
        log.warn("{}: {}", e.getKind(), e.getMessage());
        return respond(e.getStatus(), e.getKind(), e.getKind() == ErrorKind.NOT_FOUND ? "Not Found" : "Invalid Request",
                e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing));

        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, "Validation Failed",
                "Request validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Malformed parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, "Invalid Request",
                "Invalid " + e.getName() + ": " + e.getValue(), null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, "Invalid Request",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, "Invalid Request",
                "Malformed request body", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, null, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, ErrorKind kind, String error, String message,
            Map<String, String> details) {
        ApiError body = ApiError.builder()
                .kind(kind)
                .error(error)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
