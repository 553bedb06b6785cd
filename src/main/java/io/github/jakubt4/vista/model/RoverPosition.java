package io.github.jakubt4.vista.model;

/**
 * Rover position in the site frame at capture time.
 */
public record RoverPosition(double x, double y, double z) {
}
