package io.github.jakubt4.vista.service;

import io.github.jakubt4.vista.config.PanoramaProperties;
import io.github.jakubt4.vista.model.Panorama;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Time-bounded cache of detection results per {@link DetectionScope}.
 *
 * <p>The whole cache is one immutable map held in an {@link AtomicReference} and replaced on every
 * write, so readers always see a complete snapshot. At most {@code max-entries} snapshots are
 * held; a write past that bound drops the snapshot closest to expiry. A miss or an expired entry is recomputed from
 * source records; the cache never decides what a correct answer is.
 */
@Slf4j
@Component
public class PanoramaSnapshotCache {

    private final PanoramaProperties.Cache settings;
    private final Clock clock;
    private final AtomicReference<Map<DetectionScope, Snapshot>> snapshots = new AtomicReference<>(Map.of());

    @Autowired
    public PanoramaSnapshotCache(final PanoramaProperties properties) {
        this(properties, Clock.systemUTC());
    }

    PanoramaSnapshotCache(final PanoramaProperties properties, final Clock clock) {
        this.settings = properties.cache();
        this.clock = clock;
    }

    /**
     * Returns the cached panoramas for {@code scope}, or runs {@code detection} and caches its result.
     * Exceptions from {@code detection} propagate and leave the cache untouched.
     */
    List<Panorama> getOrDetect(final DetectionScope scope, final Supplier<List<Panorama>> detection) {
        if (!settings.enabled()) {
            return detection.get();
        }
        final var now = clock.instant();
        final var cached = snapshots.get().get(scope);
        if (cached != null && cached.isFresh(now)) {
            return cached.panoramas();
        }

        final var panoramas = List.copyOf(detection.get());
        final var snapshot = new Snapshot(panoramas, now.plus(settings.ttl()));
        snapshots.updateAndGet(current -> {
            final var next = new HashMap<>(current);
            next.put(scope, snapshot);
            while (next.size() > settings.maxEntries()) {
                evictClosestToExpiry(next);
            }
            return Map.copyOf(next);
        });
        log.debug("Cached {} panoramas for {} until {}", panoramas.size(), scope, snapshot.expiresAt());
        return panoramas;
    }

    /**
     * Returns the panoramas of the freshest snapshot whose scope includes {@code rover} on {@code sol}.
     */
    Optional<List<Panorama>> findCovering(final String rover, final int sol) {
        final var now = clock.instant();
        return snapshots.get().entrySet().stream()
                .filter(entry -> entry.getValue().isFresh(now))
                .filter(entry -> entry.getKey().covers(rover, sol))
                .max(Map.Entry.comparingByValue(Comparator.comparing(Snapshot::expiresAt)))
                .map(entry -> entry.getValue().panoramas());
    }

    @Scheduled(fixedRateString = "${vista.panorama.cache.sweep-interval-ms:300000}")
    public void evictExpired() {
        final var now = clock.instant();
        final var before = snapshots.get().size();
        final var after = snapshots.updateAndGet(current -> {
            final var next = new HashMap<DetectionScope, Snapshot>();
            current.forEach((scope, snapshot) -> {
                if (snapshot.isFresh(now)) {
                    next.put(scope, snapshot);
                }
            });
            return Map.copyOf(next);
        }).size();
        if (after < before) {
            log.info("Evicted {} expired panorama snapshots, {} remain", before - after, after);
        }
    }

    private static void evictClosestToExpiry(final Map<DetectionScope, Snapshot> entries) {
        entries.entrySet().stream()
                .min(Map.Entry.comparingByValue(Comparator.comparing(Snapshot::expiresAt)))
                .map(Map.Entry::getKey)
                .ifPresent(entries::remove);
    }

    void clear() {
        snapshots.set(Map.of());
    }

    int size() {
        return snapshots.get().size();
    }

    private record Snapshot(List<Panorama> panoramas, Instant expiresAt) {

        boolean isFresh(final Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
