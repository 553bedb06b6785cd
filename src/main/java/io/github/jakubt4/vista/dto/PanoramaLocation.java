package io.github.jakubt4.vista.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.jakubt4.vista.model.RoverPosition;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PanoramaLocation(int site, int drive, RoverPosition coordinates) {
}
