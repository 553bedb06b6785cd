package io.github.jakubt4.vista.model;

import java.util.List;

/**
 * A time-contiguous run of telemetry-complete photos from one {@link GroupKey},
 * ordered by acquisition clock.
 */
public record PanoramaSegment(GroupKey key, List<PhotoRecord> photos) {

    public PanoramaSegment {
        if (photos.isEmpty()) {
            throw new IllegalArgumentException("Segment must contain at least one photo");
        }
        photos = List.copyOf(photos);
    }

    public PhotoRecord first() {
        return photos.get(0);
    }

    public PhotoRecord last() {
        return photos.get(photos.size() - 1);
    }

    public double startClock() {
        return first().acquisitionClock();
    }

    public int size() {
        return photos.size();
    }
}
