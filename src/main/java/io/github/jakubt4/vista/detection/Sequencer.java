package io.github.jakubt4.vista.detection;

import io.github.jakubt4.vista.config.PanoramaProperties;
import io.github.jakubt4.vista.model.GroupKey;
import io.github.jakubt4.vista.model.PanoramaSegment;
import io.github.jakubt4.vista.model.PhotoRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders a bucket by acquisition clock and cuts it wherever two consecutive photos are further
 * apart than the configured maximum gap.
 *
 * <p>Bracketed exposures share one clock value, so they always stay in the same segment.
 */
@Component
@RequiredArgsConstructor
public class Sequencer {

    static final Comparator<PhotoRecord> BY_CLOCK = Comparator
            .comparingDouble(PhotoRecord::acquisitionClock)
            .thenComparing(PhotoRecord::nasaId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final PanoramaProperties properties;

    public List<PanoramaSegment> split(final GroupKey key, final List<PhotoRecord> photos) {
        final var ordered = photos.stream().sorted(BY_CLOCK).toList();
        final var segments = new ArrayList<PanoramaSegment>();

        var current = new ArrayList<PhotoRecord>();
        PhotoRecord previous = null;
        for (final var photo : ordered) {
            if (previous != null
                    && photo.acquisitionClock() - previous.acquisitionClock() > properties.maxGapSeconds()) {
                segments.add(new PanoramaSegment(key, current));
                current = new ArrayList<>();
            }
            current.add(photo);
            previous = photo;
        }
        if (!current.isEmpty()) {
            segments.add(new PanoramaSegment(key, current));
        }
        return segments;
    }
}
