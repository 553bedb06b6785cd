package io.github.jakubt4.vista.service;

import java.util.Set;

/**
 * The archive slice a detection run covers; also the snapshot cache key.
 */
record DetectionScope(Set<String> rovers, Integer solMin, Integer solMax) {

    DetectionScope {
        rovers = Set.copyOf(rovers);
    }

    boolean covers(final String rover, final int sol) {
        return (rovers.isEmpty() || rovers.contains(rover))
                && (solMin == null || solMin <= sol)
                && (solMax == null || sol <= solMax);
    }
}
