package io.github.jakubt4.vista.service;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts the time of day from archive Mars timestamps such as {@code Sol-01646M15:18:15.866}.
 */
final class MarsLocalTime {

    private static final Pattern TIME_OF_DAY = Pattern.compile("^M?(\\d{1,2}):(\\d{2}):(\\d{2})(?:\\.(\\d+))?$");

    private MarsLocalTime() {
    }

    /**
     * @return the time of day formatted as {@code MHH:MM:SS}, or empty if the timestamp is absent
     *         or does not parse
     */
    static Optional<String> timeOfDay(final String marsTimestamp) {
        if (marsTimestamp == null || marsTimestamp.isBlank()) {
            return Optional.empty();
        }
        final var marker = marsTimestamp.indexOf('M');
        if (marker < 0) {
            return Optional.empty();
        }
        final var matcher = TIME_OF_DAY.matcher(marsTimestamp.substring(marker).trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        final var hours = Integer.parseInt(matcher.group(1));
        final var minutes = Integer.parseInt(matcher.group(2));
        final var seconds = Integer.parseInt(matcher.group(3));
        if (hours > 23 || minutes > 59 || seconds > 59) {
            return Optional.empty();
        }
        return Optional.of("M%02d:%02d:%02d".formatted(hours, minutes, seconds));
    }
}
