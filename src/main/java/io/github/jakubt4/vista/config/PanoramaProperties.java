package io.github.jakubt4.vista.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detection thresholds and query limits bound from {@code vista.panorama.*}.
 *
 * <p>The elevation tolerance and position tolerance were inferred from sample sequences rather
 * than measured against mission telemetry; both are exposed here so they can be tuned per
 * deployment.
 *
 * @param maxGapSeconds             largest acquisition-clock gap inside one segment
 * @param positionToleranceDegrees  azimuth readings closer than this are one pointing position
 * @param minUniquePositions        fewest pointing positions an accepted panorama may have
 * @param minCoverageDegrees        smallest arc an accepted panorama may sweep
 * @param elevationToleranceDegrees largest elevation spread inside one panorama
 * @param fullMinCoverageDegrees    arc needed for the {@code full} tier
 * @param fullMinPositions          positions needed for the {@code full} tier
 * @param halfMinCoverageDegrees    arc needed for the {@code half} tier
 * @param halfMinPositions          positions needed for the {@code half} tier
 * @param knownRovers               rover names accepted in queries
 * @param defaultSolWindow          sols scanned back from the latest sol when no range is given
 * @param maxPerPage                largest accepted page size
 * @param detectionTimeout          wall-clock budget of one request's detection run
 * @param cache                     detection snapshot cache settings
 */
@ConfigurationProperties(prefix = "vista.panorama")
public record PanoramaProperties(
        @DefaultValue("300") double maxGapSeconds,
        @DefaultValue("1.0") double positionToleranceDegrees,
        @DefaultValue("3") int minUniquePositions,
        @DefaultValue("30") double minCoverageDegrees,
        @DefaultValue("15") double elevationToleranceDegrees,
        @DefaultValue("300") double fullMinCoverageDegrees,
        @DefaultValue("10") int fullMinPositions,
        @DefaultValue("120") double halfMinCoverageDegrees,
        @DefaultValue("5") int halfMinPositions,
        @DefaultValue({"curiosity", "perseverance", "opportunity", "spirit"}) List<String> knownRovers,
        @DefaultValue("500") int defaultSolWindow,
        @DefaultValue("100") int maxPerPage,
        @DefaultValue("30s") Duration detectionTimeout,
        @DefaultValue Cache cache) {

    public PanoramaProperties {
        knownRovers = List.copyOf(knownRovers);
    }

    /**
     * The values used when nothing is configured.
     */
    public static PanoramaProperties defaults() {
        return new PanoramaProperties(300, 1.0, 3, 30, 15, 300, 10, 120, 5,
                List.of("curiosity", "perseverance", "opportunity", "spirit"),
                500, 100, Duration.ofSeconds(30), Cache.defaults());
    }

    public Set<String> knownRoverSet() {
        return knownRovers.stream()
                .map(rover -> rover.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public PanoramaProperties withCache(final Cache cache) {
        return new PanoramaProperties(maxGapSeconds, positionToleranceDegrees, minUniquePositions,
                minCoverageDegrees, elevationToleranceDegrees, fullMinCoverageDegrees, fullMinPositions,
                halfMinCoverageDegrees, halfMinPositions, knownRovers, defaultSolWindow, maxPerPage,
                detectionTimeout, cache);
    }

    public PanoramaProperties withDetectionTimeout(final Duration timeout) {
        return new PanoramaProperties(maxGapSeconds, positionToleranceDegrees, minUniquePositions,
                minCoverageDegrees, elevationToleranceDegrees, fullMinCoverageDegrees, fullMinPositions,
                halfMinCoverageDegrees, halfMinPositions, knownRovers, defaultSolWindow, maxPerPage,
                timeout, cache);
    }

    /**
     * @param enabled    whether detection results are cached at all
     * @param ttl        how long a cached snapshot is served before it is recomputed
     * @param maxEntries most snapshots held at once; the one closest to expiry goes first
     */
    public record Cache(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("4h") Duration ttl,
            @DefaultValue("256") int maxEntries) {

        public static Cache defaults() {
            return new Cache(true, Duration.ofHours(4), 256);
        }

        public static Cache disabled() {
            return new Cache(false, Duration.ofHours(4), 256);
        }
    }
}
