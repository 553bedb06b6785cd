package io.github.jakubt4.vista;

import io.github.jakubt4.vista.config.PanoramaProperties;
import io.github.jakubt4.vista.detection.GeometricValidator;
import io.github.jakubt4.vista.detection.GroupingStage;
import io.github.jakubt4.vista.detection.IdentityAssigner;
import io.github.jakubt4.vista.detection.PanoramaDetector;
import io.github.jakubt4.vista.detection.QualityClassifier;
import io.github.jakubt4.vista.detection.Sequencer;
import io.github.jakubt4.vista.detection.TelemetryFilter;

/**
 * Wires the detection pipeline without a Spring context.
 */
public final class TestPipeline {

    private TestPipeline() {
    }

    public static PanoramaDetector detector(final PanoramaProperties properties) {
        return new PanoramaDetector(
                new TelemetryFilter(),
                new GroupingStage(),
                new Sequencer(properties),
                new GeometricValidator(properties),
                new QualityClassifier(properties),
                new IdentityAssigner());
    }
}
