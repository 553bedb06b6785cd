package io.github.jakubt4.vista.service;

import io.github.jakubt4.vista.client.PhotoRecordSource;
import io.github.jakubt4.vista.config.PanoramaProperties;
import io.github.jakubt4.vista.detection.PanoramaDetector;
import io.github.jakubt4.vista.dto.PanoramaPage;
import io.github.jakubt4.vista.dto.PanoramaResource;
import io.github.jakubt4.vista.model.Panorama;
import io.github.jakubt4.vista.model.PanoramaId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Entry point for panorama queries.
 *
 * <p>Panoramas are never stored: every query fetches the photos of its rover/sol scope from the
 * archive and runs detection over them (or reuses a fresh cached snapshot of that run). The list
 * and by-id paths share one detection routine, so an id taken from a listing always resolves to
 * the same panorama.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PanoramaService {

    private final PhotoRecordSource photoRecordSource;
    private final PanoramaDetector panoramaDetector;
    private final ResultMaterializer resultMaterializer;
    private final QueryValidator queryValidator;
    private final PanoramaSnapshotCache snapshotCache;
    private final PanoramaProperties properties;

    /**
     * Lists detected panoramas, cancelling if the calling thread is interrupted or the run outlives
     * {@code vista.panorama.detection-timeout}. Servlet containers do not interrupt a request thread
     * when the client disconnects, so the timeout is what bounds an abandoned request.
     *
     * @param rovers    comma-separated rover names, case-insensitive, {@code null} for all
     * @param solMin    inclusive lower sol bound, {@code null} for open
     * @param solMax    inclusive upper sol bound, {@code null} for open
     * @param minPhotos minimum photos per panorama, {@code null} for none
     * @param page      one-based page number
     * @param perPage   page size
     * @throws InvalidQueryException if any parameter is malformed
     * @throws CancellationException if the thread is interrupted or the timeout passes during detection
     */
    public PanoramaPage<PanoramaResource> listPanoramas(final String rovers, final Integer solMin,
                                                        final Integer solMax, final Integer minPhotos,
                                                        final int page, final int perPage) {
        final var query = queryValidator.validate(rovers, solMin, solMax, minPhotos, page, perPage);
        return listPanoramas(query, requestDeadline());
    }

    public PanoramaPage<PanoramaResource> listPanoramas(final PanoramaQuery query, final BooleanSupplier cancelled) {
        final var scope = resolveScope(query);
        if (scope.isEmpty()) {
            return PanoramaPage.empty(query.page(), query.perPage());
        }
        final var panoramas = detect(scope.get(), cancelled);
        return resultMaterializer.materialize(panoramas, query);
    }

    /**
     * Resolves a panorama id against a fresh cached snapshot covering its rover/sol, so an id taken
     * from a cached listing resolves against the same detection run. Without one, detection is
     * re-run for that rover/sol only.
     *
     * @return the panorama, or empty if the id is malformed, names an unknown rover, or matches nothing
     */
    public Optional<PanoramaResource> getPanoramaById(final String panoramaId) {
        final var parsed = PanoramaId.parse(panoramaId);
        if (parsed.isEmpty() || !properties.knownRoverSet().contains(parsed.get().rover())) {
            log.debug("Unresolvable panorama id [{}]", panoramaId);
            return Optional.empty();
        }
        final var id = parsed.get();
        final var panoramas = snapshotCache.findCovering(id.rover(), id.sol())
                .orElseGet(() -> detect(new DetectionScope(Set.of(id.rover()), id.sol(), id.sol()),
                        requestDeadline()));

        return panoramas.stream()
                .filter(panorama -> panorama.id().equals(id))
                .findFirst()
                .map(resultMaterializer::toResource);
    }

    private BooleanSupplier requestDeadline() {
        final var thread = Thread.currentThread();
        final var deadline = System.nanoTime() + properties.detectionTimeout().toNanos();
        return () -> thread.isInterrupted() || System.nanoTime() - deadline >= 0;
    }

    private List<Panorama> detect(final DetectionScope scope, final BooleanSupplier cancelled) {
        return snapshotCache.getOrDetect(scope, () -> {
            final var photos = photoRecordSource.findPhotos(scope.rovers(), scope.solMin(), scope.solMax());
            return panoramaDetector.detect(photos, cancelled);
        });
    }

    private Optional<DetectionScope> resolveScope(final PanoramaQuery query) {
        if (query.hasSolRange()) {
            return Optional.of(new DetectionScope(query.rovers(), query.solMin(), query.solMax()));
        }
        final var latest = photoRecordSource.latestSol(query.rovers());
        if (latest.isEmpty()) {
            log.info("No photos in archive for rovers={}, nothing to scan", query.rovers());
            return Optional.empty();
        }
        final var solMax = latest.getAsInt();
        final var solMin = Math.max(0, solMax - properties.defaultSolWindow());
        log.info("No sol range specified, defaulting to recent {} sols (sol {} to {})",
                properties.defaultSolWindow(), solMin, solMax);
        return Optional.of(new DetectionScope(query.rovers(), solMin, solMax));
    }
}
