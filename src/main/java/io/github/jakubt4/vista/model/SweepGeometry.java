package io.github.jakubt4.vista.model;

/**
 * Angular statistics of a segment.
 *
 * @param uniquePositions    distinct pointing positions after bracket deduplication
 * @param coverageDegrees    arc swept between the outermost unique positions
 * @param avgPositionSpacing mean gap between adjacent unique positions along the arc
 * @param elevationSpread    max minus min member elevation
 * @param avgElevation       mean member elevation
 */
public record SweepGeometry(
        int uniquePositions,
        double coverageDegrees,
        double avgPositionSpacing,
        double elevationSpread,
        double avgElevation) {
}
