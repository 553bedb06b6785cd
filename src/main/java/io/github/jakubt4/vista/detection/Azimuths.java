package io.github.jakubt4.vista.detection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Circular arithmetic on mast azimuths (degrees, 0 = north, clockwise).
 */
final class Azimuths {

    static final double FULL_CIRCLE = 360.0;

    private Azimuths() {
    }

    static double normalize(final double degrees) {
        final var wrapped = degrees % FULL_CIRCLE;
        if (wrapped >= 0) {
            return wrapped;
        }
        // a tiny negative reading rounds up to exactly 360 once shifted
        final var shifted = wrapped + FULL_CIRCLE;
        return shifted == FULL_CIRCLE ? 0.0 : shifted;
    }

    /**
     * Collapses readings closer than {@code tolerance} into one pointing position. Each position is
     * represented by the lowest reading of its cluster; a cluster straddling north is represented
     * by its reading just west of north.
     *
     * @return unique positions in ascending order, all within [0, 360)
     */
    static List<Double> uniquePositions(final Collection<Double> azimuths, final double tolerance) {
        final var sorted = azimuths.stream()
                .map(Azimuths::normalize)
                .sorted()
                .toList();
        final var positions = new ArrayList<Double>();
        if (sorted.isEmpty()) {
            return positions;
        }

        var anchor = sorted.get(0);
        positions.add(anchor);
        for (final var reading : sorted) {
            if (reading - anchor >= tolerance) {
                anchor = reading;
                positions.add(anchor);
            }
        }

        // merge the first and last clusters when they meet across 0/360
        final var seamGap = sorted.get(0) + FULL_CIRCLE - sorted.get(sorted.size() - 1);
        if (positions.size() > 1 && seamGap < tolerance) {
            positions.remove(0);
        }
        return positions;
    }

    /**
     * Arc covered by the given positions: the full circle minus the widest empty gap between
     * circularly adjacent positions. For a sweep that does not cross north this is max - min.
     *
     * @param positions ascending positions within [0, 360)
     */
    static double coverage(final List<Double> positions) {
        if (positions.size() < 2) {
            return 0.0;
        }
        var widestGap = positions.get(0) + FULL_CIRCLE - positions.get(positions.size() - 1);
        for (int i = 1; i < positions.size(); i++) {
            widestGap = Math.max(widestGap, positions.get(i) - positions.get(i - 1));
        }
        return FULL_CIRCLE - widestGap;
    }
}
