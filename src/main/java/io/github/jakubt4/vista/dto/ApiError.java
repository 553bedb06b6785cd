package io.github.jakubt4.vista.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Problem-style error body.
 *
 * @param type     error category path, e.g. {@code /errors/validation-error}
 * @param title    short summary
 * @param status   HTTP status code
 * @param detail   human-readable explanation
 * @param field    offending request parameter, for validation errors only
 * @param instance request path
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String type, String title, int status, String detail, String field, String instance) {

    public static ApiError validation(final String field, final String detail, final String instance) {
        return new ApiError("/errors/validation-error", "Validation Error", 400, detail, field, instance);
    }

    public static ApiError notFound(final String detail, final String instance) {
        return new ApiError("/errors/not-found", "Not Found", 404, detail, null, instance);
    }

    public static ApiError unavailable(final String detail, final String instance) {
        return new ApiError("/errors/upstream-unavailable", "Service Unavailable", 503, detail, null, instance);
    }
}
