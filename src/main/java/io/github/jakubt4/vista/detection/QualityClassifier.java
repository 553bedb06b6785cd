package io.github.jakubt4.vista.detection;

import io.github.jakubt4.vista.config.PanoramaProperties;
import io.github.jakubt4.vista.model.Quality;
import io.github.jakubt4.vista.model.SweepGeometry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Assigns a completeness tier to an accepted sweep. Tiers are checked from {@code full} down, so
 * the highest satisfied tier wins.
 */
@Component
@RequiredArgsConstructor
public class QualityClassifier {

    private final PanoramaProperties properties;

    public Quality classify(final SweepGeometry geometry) {
        if (geometry.coverageDegrees() >= properties.fullMinCoverageDegrees()
                && geometry.uniquePositions() >= properties.fullMinPositions()) {
            return Quality.FULL;
        }
        if (geometry.coverageDegrees() >= properties.halfMinCoverageDegrees()
                && geometry.uniquePositions() >= properties.halfMinPositions()) {
            return Quality.HALF;
        }
        return Quality.PARTIAL;
    }
}
