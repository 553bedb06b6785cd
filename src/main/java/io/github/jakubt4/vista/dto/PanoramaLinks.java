package io.github.jakubt4.vista.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PanoramaLinks(String downloadSet) {

    public static PanoramaLinks forPanorama(final String panoramaId) {
        return new PanoramaLinks("/api/v2/panoramas/" + panoramaId + "/download");
    }
}
