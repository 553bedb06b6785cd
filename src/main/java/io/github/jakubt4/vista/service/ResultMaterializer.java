package io.github.jakubt4.vista.service;

import io.github.jakubt4.vista.dto.PanoramaAttributes;
import io.github.jakubt4.vista.dto.PanoramaLinks;
import io.github.jakubt4.vista.dto.PanoramaLocation;
import io.github.jakubt4.vista.dto.PanoramaPage;
import io.github.jakubt4.vista.dto.PanoramaResource;
import io.github.jakubt4.vista.model.Panorama;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;

/**
 * Applies caller filters to detected panoramas, paginates them and shapes the public resource.
 */
@Component
public class ResultMaterializer {

    private static final Comparator<Panorama> LISTING_ORDER = Comparator
            .comparing(Panorama::rover)
            .thenComparingInt(Panorama::sol)
            .thenComparingInt(Panorama::sequenceIndex);

    public PanoramaPage<PanoramaResource> materialize(final Collection<Panorama> panoramas,
                                                      final PanoramaQuery query) {
        final var matching = panoramas.stream()
                .filter(panorama -> query.rovers().isEmpty() || query.rovers().contains(panorama.rover()))
                .filter(panorama -> query.solMin() == null || panorama.sol() >= query.solMin())
                .filter(panorama -> query.solMax() == null || panorama.sol() <= query.solMax())
                .filter(panorama -> query.minPhotos() == null || panorama.totalPhotos() >= query.minPhotos())
                .sorted(LISTING_ORDER)
                .toList();

        final var items = matching.stream()
                .skip((long) (query.page() - 1) * query.perPage())
                .limit(query.perPage())
                .map(this::toResource)
                .toList();

        return new PanoramaPage<>(items, matching.size(), query.page(), query.perPage());
    }

    public PanoramaResource toResource(final Panorama panorama) {
        final var id = panorama.id().toString();
        final var segment = panorama.segment();
        final var geometry = panorama.geometry();

        final var attributes = new PanoramaAttributes(
                panorama.rover(),
                panorama.sol(),
                MarsLocalTime.timeOfDay(segment.first().marsLocalTime()).orElse(null),
                MarsLocalTime.timeOfDay(segment.last().marsLocalTime()).orElse(null),
                panorama.totalPhotos(),
                geometry.uniquePositions(),
                geometry.coverageDegrees(),
                geometry.avgPositionSpacing(),
                geometry.avgElevation(),
                panorama.quality(),
                new PanoramaLocation(segment.key().site(), segment.key().drive(), panorama.representativePosition()),
                panorama.camera());

        return new PanoramaResource(id, PanoramaResource.TYPE, attributes, PanoramaLinks.forPanorama(id));
    }
}
