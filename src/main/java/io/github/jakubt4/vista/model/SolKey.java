package io.github.jakubt4.vista.model;

/**
 * A rover and a sol: the scope within which panorama sequence indexes are assigned.
 */
public record SolKey(String rover, int sol) {
}
