package io.github.jakubt4.vista.dto;

import java.util.List;

/**
 * One page of a filtered result.
 *
 * @param items      the requested page
 * @param totalCount matching items before pagination
 * @param page       one-based page number
 * @param perPage    page size
 */
public record PanoramaPage<T>(List<T> items, long totalCount, int page, int perPage) {

    public PanoramaPage {
        items = List.copyOf(items);
    }

    public static <T> PanoramaPage<T> empty(final int page, final int perPage) {
        return new PanoramaPage<>(List.of(), 0, page, perPage);
    }

    public int totalPages() {
        return (int) ((totalCount + perPage - 1) / perPage);
    }
}
