package io.github.jakubt4.vista.service;

import lombok.Getter;

/**
 * Malformed caller input, reported with the name of the offending request parameter.
 */
@Getter
public class InvalidQueryException extends RuntimeException {

    private final String field;

    public InvalidQueryException(final String field, final String message) {
        super(message);
        this.field = field;
    }
}
