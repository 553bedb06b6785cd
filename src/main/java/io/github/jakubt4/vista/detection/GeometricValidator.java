package io.github.jakubt4.vista.detection;

import io.github.jakubt4.vista.config.PanoramaProperties;
import io.github.jakubt4.vista.model.PanoramaSegment;
import io.github.jakubt4.vista.model.PhotoRecord;
import io.github.jakubt4.vista.model.SweepGeometry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a segment is a genuine mast sweep.
 *
 * <p>A segment is rejected when it has fewer than the minimum number of distinct pointing
 * positions, when those positions span less than the minimum arc, or when its photos were taken at
 * elevations further apart than the elevation tolerance (a deliberately different pointing rather
 * than one sweep).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeometricValidator {

    private final PanoramaProperties properties;

    /**
     * Computes the angular statistics of a segment without judging it.
     */
    public SweepGeometry measure(final PanoramaSegment segment) {
        final var positions = Azimuths.uniquePositions(
                segment.photos().stream().map(PhotoRecord::azimuth).toList(),
                properties.positionToleranceDegrees());
        final var coverage = Azimuths.coverage(positions);
        final var spacing = positions.size() > 1 ? coverage / (positions.size() - 1) : 0.0;

        final var elevations = segment.photos().stream()
                .mapToDouble(PhotoRecord::elevation)
                .summaryStatistics();

        return new SweepGeometry(
                positions.size(),
                coverage,
                spacing,
                elevations.getMax() - elevations.getMin(),
                elevations.getAverage());
    }

    /**
     * @return the segment's geometry if it qualifies as a panorama, empty otherwise
     */
    public Optional<SweepGeometry> validate(final PanoramaSegment segment) {
        final var geometry = measure(segment);

        if (geometry.uniquePositions() < properties.minUniquePositions()) {
            log.debug("Rejected {} ({} photos): {} unique positions",
                    segment.key(), segment.size(), geometry.uniquePositions());
            return Optional.empty();
        }
        if (geometry.coverageDegrees() < properties.minCoverageDegrees()) {
            log.debug("Rejected {} ({} photos): coverage {} deg",
                    segment.key(), segment.size(), geometry.coverageDegrees());
            return Optional.empty();
        }
        if (geometry.elevationSpread() > properties.elevationToleranceDegrees()) {
            log.debug("Rejected {} ({} photos): elevation spread {} deg",
                    segment.key(), segment.size(), geometry.elevationSpread());
            return Optional.empty();
        }
        return Optional.of(geometry);
    }
}
