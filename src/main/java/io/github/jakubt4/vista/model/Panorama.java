package io.github.jakubt4.vista.model;

import java.util.Objects;

/**
 * An accepted panorama: a validated segment, its geometry, tier and public identity.
 */
public record Panorama(PanoramaId id, PanoramaSegment segment, SweepGeometry geometry, Quality quality) {

    public String rover() {
        return id.rover();
    }

    public int sol() {
        return id.sol();
    }

    public int sequenceIndex() {
        return id.sequenceIndex();
    }

    public String camera() {
        return segment.key().camera();
    }

    public int totalPhotos() {
        return segment.size();
    }

    /**
     * First member position reported by the archive, or {@code null} if no member carries one.
     */
    public RoverPosition representativePosition() {
        return segment.photos().stream()
                .map(PhotoRecord::position)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }
}
