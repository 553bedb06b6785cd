package io.github.jakubt4.vista.detection;

import io.github.jakubt4.vista.model.Panorama;
import io.github.jakubt4.vista.model.PanoramaCandidate;
import io.github.jakubt4.vista.model.PanoramaId;
import io.github.jakubt4.vista.model.SolKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Numbers the panoramas of one rover/sol in order of their first photo's acquisition clock.
 *
 * <p>The ordering must not change between releases: published ids such as
 * {@code pano_curiosity_1000_3} are resolved by recomputing it.
 */
@Component
public class IdentityAssigner {

    private static final Comparator<PanoramaCandidate> DETECTION_ORDER = Comparator
            .comparingDouble((PanoramaCandidate candidate) -> candidate.segment().startClock())
            .thenComparing(candidate -> candidate.segment().key());

    /**
     * @param solKey     rover/sol shared by every candidate
     * @param candidates accepted segments of that rover/sol, in any order
     * @return panoramas ordered by sequence index
     */
    public List<Panorama> assign(final SolKey solKey, final Collection<PanoramaCandidate> candidates) {
        final var ordered = candidates.stream().sorted(DETECTION_ORDER).toList();
        final var panoramas = new ArrayList<Panorama>(ordered.size());
        for (int index = 0; index < ordered.size(); index++) {
            final var candidate = ordered.get(index);
            if (!candidate.segment().key().solKey().equals(solKey)) {
                throw new IllegalArgumentException(
                        "Candidate " + candidate.segment().key() + " does not belong to " + solKey);
            }
            panoramas.add(new Panorama(
                    new PanoramaId(solKey.rover(), solKey.sol(), index),
                    candidate.segment(),
                    candidate.geometry(),
                    candidate.quality()));
        }
        return panoramas;
    }
}
