package io.github.jakubt4.vista;

import io.github.jakubt4.vista.client.PhotoRecordSource;
import io.github.jakubt4.vista.config.PanoramaProperties;
import io.github.jakubt4.vista.service.PanoramaService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.util.OptionalInt;

import static io.github.jakubt4.vista.TestPhotos.steppedSweep;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.when;

@SpringBootTest
class VistaApplicationTest {

    @MockBean
    private PhotoRecordSource photoRecordSource;

    @Autowired
    private PanoramaProperties properties;

    @Autowired
    private PanoramaService panoramaService;

    @Test
    void bindsDetectionDefaults() {
        assertThat(properties.maxGapSeconds()).isEqualTo(300.0);
        assertThat(properties.minUniquePositions()).isEqualTo(3);
        assertThat(properties.minCoverageDegrees()).isEqualTo(30.0);
        assertThat(properties.elevationToleranceDegrees()).isEqualTo(15.0);
        assertThat(properties.positionToleranceDegrees()).isEqualTo(1.0);
        assertThat(properties.knownRoverSet()).containsExactlyInAnyOrder(
                "curiosity", "perseverance", "opportunity", "spirit");
        assertThat(properties.cache().ttl()).isEqualTo(Duration.ofHours(4));
        assertThat(properties.cache().maxEntries()).isEqualTo(256);
        assertThat(properties.detectionTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void servesPanoramasThroughWiredPipeline() {
        when(photoRecordSource.latestSol(anySet())).thenReturn(OptionalInt.of(1000));
        when(photoRecordSource.findPhotos(anySet(), any(), any())).thenReturn(steppedSweep(0, 30, 12));

        final var page = panoramaService.listPanoramas("curiosity", null, null, null, 1, 25);

        assertThat(page.items()).singleElement().satisfies(resource ->
                assertThat(resource.attributes().quality().label()).isEqualTo("full"));
        assertThat(panoramaService.getPanoramaById(page.items().get(0).id())).isPresent();
        assertThat(panoramaService.getPanoramaById("pano_curiosity_1000_5")).isEmpty();
    }
}
