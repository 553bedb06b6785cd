package io.github.jakubt4.vista.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Public representation of a detected panorama.
 *
 * @param id         panorama identifier, e.g. {@code pano_curiosity_1000_0}
 * @param type       always {@code "panorama"}
 * @param attributes computed statistics
 * @param links      related resources
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PanoramaResource(String id, String type, PanoramaAttributes attributes, PanoramaLinks links) {

    public static final String TYPE = "panorama";
}
