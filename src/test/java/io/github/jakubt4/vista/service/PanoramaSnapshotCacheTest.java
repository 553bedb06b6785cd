package io.github.jakubt4.vista.service;

import io.github.jakubt4.vista.config.PanoramaProperties;
import io.github.jakubt4.vista.model.Panorama;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PanoramaSnapshotCacheTest {

    private static final DetectionScope SCOPE = new DetectionScope(Set.of("curiosity"), 1000, 1000);

    private final MutableClock clock = new MutableClock();
    private final PanoramaSnapshotCache cache = new PanoramaSnapshotCache(PanoramaProperties.defaults(), clock);
    private final AtomicInteger detections = new AtomicInteger();

    @Test
    void servesFreshSnapshotWithoutRecomputing() {
        final var first = cache.getOrDetect(SCOPE, this::detect);
        final var second = cache.getOrDetect(SCOPE, this::detect);

        assertThat(second).isSameAs(first);
        assertThat(detections).hasValue(1);
    }

    @Test
    void recomputesAfterTtl() {
        cache.getOrDetect(SCOPE, this::detect);
        clock.advance(Duration.ofHours(4));

        cache.getOrDetect(SCOPE, this::detect);

        assertThat(detections).hasValue(2);
    }

    @Test
    void keepsScopesApart() {
        cache.getOrDetect(SCOPE, this::detect);
        cache.getOrDetect(new DetectionScope(Set.of("curiosity"), 1000, 1001), this::detect);

        assertThat(detections).hasValue(2);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void failedDetectionIsNotCached() {
        assertThatThrownBy(() -> cache.getOrDetect(SCOPE, () -> {
            throw new CancellationException("cancelled");
        })).isInstanceOf(CancellationException.class);

        assertThat(cache.size()).isZero();
    }

    @Test
    void evictsOnlyExpiredSnapshots() {
        cache.getOrDetect(SCOPE, this::detect);
        clock.advance(Duration.ofHours(3));
        cache.getOrDetect(new DetectionScope(Set.of(), 0, 500), this::detect);
        clock.advance(Duration.ofHours(2));

        cache.evictExpired();

        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void disabledCacheAlwaysRecomputes() {
        final var disabled = new PanoramaSnapshotCache(
                PanoramaProperties.defaults().withCache(PanoramaProperties.Cache.disabled()), clock);

        disabled.getOrDetect(SCOPE, this::detect);
        disabled.getOrDetect(SCOPE, this::detect);

        assertThat(detections).hasValue(2);
        assertThat(disabled.size()).isZero();
    }

    @Test
    void boundsEntriesByDroppingSnapshotClosestToExpiry() {
        final var bounded = new PanoramaSnapshotCache(
                PanoramaProperties.defaults().withCache(new PanoramaProperties.Cache(true, Duration.ofHours(4), 3)),
                clock);
        for (int sol = 1; sol <= 5000; sol++) {
            bounded.getOrDetect(new DetectionScope(Set.of("curiosity"), sol, sol), this::detect);
            clock.advance(Duration.ofSeconds(1));
        }
        bounded.evictExpired();

        assertThat(bounded.size()).isEqualTo(3);
        assertThat(detections).hasValue(5000);

        bounded.getOrDetect(new DetectionScope(Set.of("curiosity"), 5000, 5000), this::detect);
        assertThat(detections).hasValue(5000);

        bounded.getOrDetect(new DetectionScope(Set.of("curiosity"), 1, 1), this::detect);
        assertThat(detections).hasValue(5001);
        assertThat(bounded.size()).isEqualTo(3);
    }

    @Test
    void findsFreshSnapshotCoveringRoverAndSol() {
        final var wide = cache.getOrDetect(new DetectionScope(Set.of("curiosity", "spirit"), 900, 1100), this::detect);

        assertThat(cache.findCovering("spirit", 1000)).containsSame(wide);
        assertThat(cache.findCovering("perseverance", 1000)).isEmpty();
        assertThat(cache.findCovering("curiosity", 1101)).isEmpty();

        clock.advance(Duration.ofHours(4));
        assertThat(cache.findCovering("curiosity", 1000)).isEmpty();
    }

    @Test
    void clearDropsEverything() {
        cache.getOrDetect(SCOPE, this::detect);

        cache.clear();

        assertThat(cache.size()).isZero();
    }

    private List<Panorama> detect() {
        detections.incrementAndGet();
        return List.of();
    }

    private static final class MutableClock extends Clock {

        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(final Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(final ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
