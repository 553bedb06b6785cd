package io.github.jakubt4.vista.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Completeness tier of a detected panorama.
 */
public enum Quality {
    FULL("full"),
    HALF("half"),
    PARTIAL("partial");

    private final String label;

    Quality(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
