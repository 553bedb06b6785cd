package io.github.jakubt4.vista.detection;

import io.github.jakubt4.vista.model.PhotoRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Keeps only photos that carry mast pointing, spacecraft clock and a site/drive location.
 *
 * <p>Incomplete photos are dropped silently; they never fail a request.
 */
@Slf4j
@Component
public class TelemetryFilter {

    public List<PhotoRecord> filter(final Collection<PhotoRecord> photos) {
        final var usable = photos.stream()
                .filter(PhotoRecord::isTelemetryComplete)
                .filter(PhotoRecord::hasLocation)
                .toList();
        if (usable.size() < photos.size()) {
            log.debug("Dropped {} of {} photos without usable telemetry", photos.size() - usable.size(), photos.size());
        }
        return usable;
    }
}
