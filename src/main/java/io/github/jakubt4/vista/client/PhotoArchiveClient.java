package io.github.jakubt4.vista.client;

import io.github.jakubt4.vista.model.PhotoRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link PhotoRecordSource} backed by the photo archive's REST API.
 *
 * <p>Transport and 5xx failures are retried; if the archive stays unreachable the
 * {@link RestClientException} propagates to the caller rather than being turned into an empty
 * result.
 */
@Slf4j
@Service
public class PhotoArchiveClient implements PhotoRecordSource {

    static final String TELEMETRY_PATH = "/api/v2/photos/telemetry";
    static final String LATEST_SOL_PATH = "/api/v2/photos/latest-sol";

    private static final ParameterizedTypeReference<List<PhotoRecord>> PHOTO_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;

    public PhotoArchiveClient(final RestClient.Builder restClientBuilder,
                              @Value("${photo-archive.base-url}") final String baseUrl) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
    }

    @Override
    @Retryable(retryFor = RestClientException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 500, maxDelay = 2000))
    public List<PhotoRecord> findPhotos(final Set<String> rovers, final Integer solMin, final Integer solMax) {
        final var photos = restClient.get()
                .uri(builder -> withRovers(builder.path(TELEMETRY_PATH), rovers)
                        .queryParamIfPresent("sol_min", Optional.ofNullable(solMin))
                        .queryParamIfPresent("sol_max", Optional.ofNullable(solMax))
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(PHOTO_LIST);

        log.debug("Fetched {} photos for rovers={} sols={}..{}",
                photos == null ? 0 : photos.size(), rovers, solMin, solMax);
        return photos == null ? List.of() : photos;
    }

    @Override
    @Retryable(retryFor = RestClientException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 500, maxDelay = 2000))
    public OptionalInt latestSol(final Set<String> rovers) {
        final var response = restClient.get()
                .uri(builder -> withRovers(builder.path(LATEST_SOL_PATH), rovers).build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(LatestSolResponse.class);

        return response == null || response.sol() == null
                ? OptionalInt.empty()
                : OptionalInt.of(response.sol());
    }

    private static UriBuilder withRovers(final UriBuilder builder, final Set<String> rovers) {
        if (rovers.isEmpty()) {
            return builder;
        }
        return builder.queryParam("rovers", String.join(",", new TreeSet<>(rovers)));
    }
}
