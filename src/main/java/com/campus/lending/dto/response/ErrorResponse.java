package com.campus.lending.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every non-2xx response. {@code fieldErrors} is filled for bean
 * validation failures, {@code details} lists the equipment that blocked a reservation.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors,
    List<String> details
) {
    public static ErrorResponse of(HttpStatus status, String message, String path) {
        return new ErrorResponse(status.value(), status.getReasonPhrase(), message, Instant.now(), path,
            List.of(), List.of());
    }

    public ErrorResponse withFieldErrors(List<FieldError> errors) {
        return new ErrorResponse(status, error, message, timestamp, path, List.copyOf(errors), details);
    }

    public ErrorResponse withDetails(List<String> items) {
        return new ErrorResponse(status, error, message, timestamp, path, fieldErrors, List.copyOf(items));
    }

    public record FieldError(String field, String message) {}
}
