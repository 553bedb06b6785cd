package io.github.jakubt4.vista.service;

import io.github.jakubt4.vista.config.PanoramaProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Turns raw request parameters into a {@link PanoramaQuery}, rejecting anything malformed.
 * Nothing is silently corrected.
 */
@Component
@RequiredArgsConstructor
public class QueryValidator {

    private final PanoramaProperties properties;

    /**
     * @throws InvalidQueryException naming the first offending parameter
     */
    public PanoramaQuery validate(final String rovers, final Integer solMin, final Integer solMax,
                                  final Integer minPhotos, final int page, final int perPage) {
        final var roverSet = parseRovers(rovers);

        if (solMin != null && solMin < 0) {
            throw new InvalidQueryException("sol_min", "sol_min must be >= 0");
        }
        if (solMax != null && solMax < 0) {
            throw new InvalidQueryException("sol_max", "sol_max must be >= 0");
        }
        if (solMin != null && solMax != null && solMin > solMax) {
            throw new InvalidQueryException("sol_min",
                    "sol_min (%d) must not be greater than sol_max (%d)".formatted(solMin, solMax));
        }
        if (minPhotos != null && minPhotos < 0) {
            throw new InvalidQueryException("min_photos", "min_photos must be >= 0");
        }
        if (page < 1) {
            throw new InvalidQueryException("page", "Page number must be >= 1");
        }
        if (perPage < 1 || perPage > properties.maxPerPage()) {
            throw new InvalidQueryException("per_page",
                    "Per page must be between 1 and " + properties.maxPerPage());
        }
        return new PanoramaQuery(roverSet, solMin, solMax, minPhotos, page, perPage);
    }

    private Set<String> parseRovers(final String rovers) {
        if (rovers == null || rovers.isBlank()) {
            return Set.of();
        }
        final var known = properties.knownRoverSet();
        final var parsed = new LinkedHashSet<String>();
        Arrays.stream(rovers.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .map(name -> name.toLowerCase(Locale.ROOT))
                .forEach(name -> {
                    if (!known.contains(name)) {
                        throw new InvalidQueryException("rovers", "Unknown rover: " + name);
                    }
                    parsed.add(name);
                });
        return parsed;
    }
}
