package io.github.jakubt4.vista;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Vista: panoramic-sequence detection for rover mast-camera photos.
 *
 * <p>Fetches photo telemetry from the photo archive, finds the photos that were shot as one
 * continuous mast sweep, grades each sweep by completeness and serves the result over a read-only
 * REST API. Nothing is persisted; panoramas are recomputed per query.
 *
 * @see io.github.jakubt4.vista.detection.PanoramaDetector
 * @see io.github.jakubt4.vista.service.PanoramaService
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
@ConfigurationPropertiesScan
public class VistaApplication {

    public static void main(String[] args) {
        SpringApplication.run(VistaApplication.class, args);
    }
}
