package com.whisk.shopkeeper.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whisk.shopkeeper.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body shared by the exception handler and the security entry point.
 * Fields that do not apply, such as {@code details}, are left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Value
@Builder
public class ApiError {
    ErrorKind kind;
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
