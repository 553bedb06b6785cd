package io.github.jakubt4.vista.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Envelope of {@code GET /api/v2/panoramas}.
 */
public record PanoramaListResponse(List<PanoramaResource> data, Meta meta, Pagination pagination) {

    public static PanoramaListResponse from(final PanoramaPage<PanoramaResource> page) {
        return new PanoramaListResponse(
                page.items(),
                new Meta(page.totalCount(), page.items().size()),
                new Pagination(page.page(), page.perPage(), page.totalPages()));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Meta(long totalCount, int returnedCount) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Pagination(int page, int perPage, int totalPages) {
    }
}
