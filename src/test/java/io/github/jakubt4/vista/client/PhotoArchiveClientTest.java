package io.github.jakubt4.vista.client;

import io.github.jakubt4.vista.model.RoverPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PhotoArchiveClientTest {

    private static final String BASE_URL = "http://localhost:5000";

    private PhotoArchiveClient client;
    private MockRestServiceServer mockServer;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).build();

        final var builder = RestClient.builder()
                .requestFactory(restTemplate.getRequestFactory());

        client = new PhotoArchiveClient(builder, BASE_URL);
    }

    @Test
    void findPhotosQueriesTelemetryEndpointAndMapsRecords() {
        mockServer.expect(requestTo(BASE_URL + "/api/v2/photos/telemetry?rovers=curiosity,perseverance&sol_min=1000&sol_max=1001"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        [
                          {
                            "nasa_id": "NRF_1000_0001",
                            "rover": "Curiosity",
                            "camera": "MAST",
                            "sol": 1000,
                            "site": 79,
                            "drive": 1204,
                            "azimuth": 45.0,
                            "elevation": -10.0,
                            "acquisition_clock": 813073000.0,
                            "captured_at": "2015-05-30T10:00:00Z",
                            "mars_local_time": "Sol-01000M14:00:00",
                            "position": {"x": 35.4362, "y": 22.5714, "z": -9.46445}
                          },
                          {
                            "nasa_id": "NRF_1000_0002",
                            "rover": "Curiosity",
                            "camera": "NAVCAM",
                            "sol": 1000,
                            "site": null,
                            "drive": null,
                            "azimuth": null,
                            "elevation": null,
                            "acquisition_clock": null
                          }
                        ]
                        """, MediaType.APPLICATION_JSON));

        final var photos = client.findPhotos(Set.of("perseverance", "curiosity"), 1000, 1001);

        mockServer.verify();
        assertThat(photos).hasSize(2);
        final var first = photos.get(0);
        assertThat(first.nasaId()).isEqualTo("NRF_1000_0001");
        assertThat(first.acquisitionClock()).isEqualTo(813073000.0);
        assertThat(first.capturedAt()).isEqualTo(Instant.parse("2015-05-30T10:00:00Z"));
        assertThat(first.position()).isEqualTo(new RoverPosition(35.4362, 22.5714, -9.46445));
        assertThat(first.isTelemetryComplete()).isTrue();
        assertThat(photos.get(1).isTelemetryComplete()).isFalse();
        assertThat(photos.get(1).hasLocation()).isFalse();
    }

    @Test
    void findPhotosOmitsOpenBounds() {
        mockServer.expect(requestTo(BASE_URL + "/api/v2/photos/telemetry"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThat(client.findPhotos(Set.of(), null, null)).isEmpty();
        mockServer.verify();
    }

    @Test
    void latestSolReadsSolField() {
        mockServer.expect(requestTo(BASE_URL + "/api/v2/photos/latest-sol?rovers=curiosity"))
                .andRespond(withSuccess("{\"sol\": 4102}", MediaType.APPLICATION_JSON));

        assertThat(client.latestSol(Set.of("curiosity"))).hasValue(4102);
    }

    @Test
    void latestSolIsEmptyForEmptyArchive() {
        mockServer.expect(requestTo(BASE_URL + "/api/v2/photos/latest-sol"))
                .andRespond(withSuccess("{\"sol\": null}", MediaType.APPLICATION_JSON));

        assertThat(client.latestSol(Set.of())).isEmpty();
    }

    @Test
    void findPhotosThrowsOnServerError() {
        mockServer.expect(requestTo(BASE_URL + "/api/v2/photos/telemetry?sol_min=1&sol_max=2"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.findPhotos(Set.of(), 1, 2))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
