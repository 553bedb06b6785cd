package io.github.jakubt4.vista.model;

/**
 * A segment that passed geometric validation but has no identity yet.
 */
public record PanoramaCandidate(PanoramaSegment segment, SweepGeometry geometry, Quality quality) {
}
