package io.github.jakubt4.vista.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.github.jakubt4.vista.model.Quality;

/**
 * @param rover              lower-case rover name
 * @param sol                sol the sweep was shot on
 * @param marsTimeStart      Mars local time of the first photo ({@code MHH:MM:SS}), omitted if unknown
 * @param marsTimeEnd        Mars local time of the last photo, omitted if unknown
 * @param totalPhotos        all member photos, bracketed exposures included
 * @param uniquePositions    distinct pointing positions
 * @param coverageDegrees    swept arc
 * @param avgPositionSpacing mean gap between adjacent positions
 * @param avgElevation       mean mast elevation
 * @param quality            completeness tier
 * @param location           rover stop
 * @param camera             camera short name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PanoramaAttributes(
        String rover,
        int sol,
        String marsTimeStart,
        String marsTimeEnd,
        int totalPhotos,
        int uniquePositions,
        double coverageDegrees,
        double avgPositionSpacing,
        double avgElevation,
        Quality quality,
        PanoramaLocation location,
        String camera) {
}
