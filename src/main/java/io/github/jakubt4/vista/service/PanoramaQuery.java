package io.github.jakubt4.vista.service;

import java.util.Set;

/**
 * Validated filters of a list request.
 *
 * @param rovers    lower-case rover names, empty for all rovers
 * @param solMin    inclusive lower sol bound, {@code null} for open
 * @param solMax    inclusive upper sol bound, {@code null} for open
 * @param minPhotos minimum total photos, {@code null} for no minimum
 * @param page      one-based page number
 * @param perPage   page size
 */
public record PanoramaQuery(Set<String> rovers, Integer solMin, Integer solMax, Integer minPhotos,
                            int page, int perPage) {

    public PanoramaQuery {
        rovers = Set.copyOf(rovers);
    }

    public boolean hasSolRange() {
        return solMin != null || solMax != null;
    }
}
