package io.github.jakubt4.vista.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.time.Instant;

/**
 * A single rover-camera photo as delivered by the photo archive.
 *
 * <p>Telemetry fields are nullable: older archive entries often lack mast pointing or the
 * spacecraft clock. Such records are never an error, they simply take no part in panorama
 * detection.
 *
 * @param nasaId           archive photo identifier, used only to order bracketed exposures
 * @param rover            rover name, compared case-insensitively
 * @param camera           camera short name (e.g. {@code MAST}, {@code NAVCAM})
 * @param sol              Martian day index since landing
 * @param site             coarse location marker, {@code null} when unknown
 * @param drive            fine location marker, {@code null} when unknown
 * @param azimuth          mast heading in degrees
 * @param elevation        mast tilt in degrees
 * @param acquisitionClock onboard spacecraft clock in seconds
 * @param capturedAt       capture time (UTC)
 * @param marsLocalTime    Mars local timestamp, e.g. {@code Sol-01000M14:03:00.120}
 * @param position         rover position at capture time, {@code null} when unknown
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PhotoRecord(
        String nasaId,
        String rover,
        String camera,
        int sol,
        Integer site,
        Integer drive,
        Double azimuth,
        Double elevation,
        Double acquisitionClock,
        Instant capturedAt,
        String marsLocalTime,
        RoverPosition position) {

    public boolean isTelemetryComplete() {
        return azimuth != null && elevation != null && acquisitionClock != null;
    }

    public boolean hasLocation() {
        return site != null && drive != null;
    }
}
