package io.github.jakubt4.vista.detection;

import io.github.jakubt4.vista.model.GroupKey;
import io.github.jakubt4.vista.model.Panorama;
import io.github.jakubt4.vista.model.PanoramaCandidate;
import io.github.jakubt4.vista.model.PhotoRecord;
import io.github.jakubt4.vista.model.SolKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Runs the detection pipeline over a set of photos: telemetry filter, grouping, sequencing,
 * geometric validation, quality classification and identity assignment.
 *
 * <p>Detection is a pure function of its input. Rover/sols are processed one at a time and the
 * cancellation signal is polled between them; a cancelled run throws and returns nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PanoramaDetector {

    private final TelemetryFilter telemetryFilter;
    private final GroupingStage groupingStage;
    private final Sequencer sequencer;
    private final GeometricValidator geometricValidator;
    private final QualityClassifier qualityClassifier;
    private final IdentityAssigner identityAssigner;

    public List<Panorama> detect(final Collection<PhotoRecord> photos) {
        return detect(photos, () -> false);
    }

    /**
     * @param photos    photos of any rovers and sols; incomplete ones are ignored
     * @param cancelled polled between rover/sols
     * @return panoramas ordered by rover, sol and sequence index
     * @throws CancellationException if {@code cancelled} reports true before detection finishes
     */
    public List<Panorama> detect(final Collection<PhotoRecord> photos, final BooleanSupplier cancelled) {
        final var groups = groupingStage.group(telemetryFilter.filter(photos));
        final var panoramas = new ArrayList<Panorama>();

        for (final var sol : bySol(groups).entrySet()) {
            if (cancelled.getAsBoolean()) {
                log.warn("Detection cancelled before {}, discarding {} panoramas", sol.getKey(), panoramas.size());
                throw new CancellationException("Panorama detection cancelled");
            }
            panoramas.addAll(detectSol(sol.getKey(), sol.getValue()));
        }
        log.debug("Detected {} panoramas in {} photos", panoramas.size(), photos.size());
        return List.copyOf(panoramas);
    }

    private List<Panorama> detectSol(final SolKey solKey, final Map<GroupKey, List<PhotoRecord>> groups) {
        final var candidates = new ArrayList<PanoramaCandidate>();
        groups.forEach((key, members) -> {
            for (final var segment : sequencer.split(key, members)) {
                geometricValidator.validate(segment).ifPresent(geometry -> candidates.add(
                        new PanoramaCandidate(segment, geometry, qualityClassifier.classify(geometry))));
            }
        });
        return identityAssigner.assign(solKey, candidates);
    }

    private static Map<SolKey, Map<GroupKey, List<PhotoRecord>>> bySol(final Map<GroupKey, List<PhotoRecord>> groups) {
        final var bySol = new LinkedHashMap<SolKey, Map<GroupKey, List<PhotoRecord>>>();
        groups.forEach((key, members) ->
                bySol.computeIfAbsent(key.solKey(), ignored -> new LinkedHashMap<>()).put(key, members));
        return bySol;
    }
}
