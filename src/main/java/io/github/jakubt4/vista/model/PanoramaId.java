package io.github.jakubt4.vista.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Public panorama identifier of the form {@code pano_{rover}_{sol}_{sequenceIndex}}.
 *
 * <p>Ids are recomputed, not stored: the same rover/sol photos always yield the same ids, which is
 * what lets clients bookmark them.
 */
public record PanoramaId(String rover, int sol, int sequenceIndex) {

    private static final String PREFIX = "pano";
    private static final String SEPARATOR = "_";
    private static final Pattern NON_NEGATIVE_INT = Pattern.compile("\\d{1,10}");

    public PanoramaId {
        rover = rover.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an id string. Any malformed input yields {@link Optional#empty()}.
     *
     * @param value candidate id, may be {@code null}
     */
    public static Optional<PanoramaId> parse(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        final var parts = value.split(SEPARATOR, -1);
        if (parts.length != 4 || !PREFIX.equals(parts[0]) || parts[1].isBlank()) {
            return Optional.empty();
        }
        final var sol = parseNonNegative(parts[2]);
        final var index = parseNonNegative(parts[3]);
        if (sol.isEmpty() || index.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PanoramaId(parts[1], sol.get(), index.get()));
    }

    private static Optional<Integer> parseNonNegative(final String part) {
        if (!NON_NEGATIVE_INT.matcher(part).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(part));
        } catch (final NumberFormatException e) {
            // ten digits can still overflow an int
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, PREFIX, rover, Integer.toString(sol), Integer.toString(sequenceIndex));
    }
}
