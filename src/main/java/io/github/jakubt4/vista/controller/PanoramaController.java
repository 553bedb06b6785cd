package io.github.jakubt4.vista.controller;

import io.github.jakubt4.vista.dto.ApiError;
import io.github.jakubt4.vista.dto.PanoramaListResponse;
import io.github.jakubt4.vista.service.InvalidQueryException;
import io.github.jakubt4.vista.service.PanoramaService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.client.RestClientException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.concurrent.CancellationException;

/**
 * Read-only REST endpoints for auto-detected panoramic sequences.
 *
 * <p>{@code GET /api/v2/panoramas} lists panoramas with rover, sol and size filters;
 * {@code GET /api/v2/panoramas/{id}} resolves a single panorama by its recomputable id.
 */
@Slf4j
@RestController
@RequestMapping("/api/v2/panoramas")
@RequiredArgsConstructor
public class PanoramaController {

    private final PanoramaService panoramaService;

    /**
     * @param rovers    comma-separated rover names (curiosity, perseverance, ...)
     * @param solMin    minimum sol
     * @param solMax    maximum sol
     * @param minPhotos minimum number of photos in a panorama
     * @param page      page number, one-based
     * @param perPage   items per page, 1 to 100
     * @return {@code 200 OK} with a page of panoramas, {@code 400 Bad Request} naming the invalid
     *         parameter, or {@code 503} when the photo archive cannot be reached
     */
    @GetMapping
    public ResponseEntity<?> listPanoramas(
            @RequestParam(required = false) final String rovers,
            @RequestParam(name = "sol_min", required = false) final Integer solMin,
            @RequestParam(name = "sol_max", required = false) final Integer solMax,
            @RequestParam(name = "min_photos", required = false) final Integer minPhotos,
            @RequestParam(defaultValue = "1") final int page,
            @RequestParam(name = "per_page", defaultValue = "25") final int perPage,
            final HttpServletRequest request) {
        try {
            final var result = panoramaService.listPanoramas(rovers, solMin, solMax, minPhotos, page, perPage);
            return ResponseEntity.ok(PanoramaListResponse.from(result));
        } catch (final InvalidQueryException e) {
            log.info("Rejected panorama query, {}: {}", e.getField(), e.getMessage());
            return ResponseEntity.badRequest()
                    .body(ApiError.validation(e.getField(), e.getMessage(), request.getRequestURI()));
        } catch (final RestClientException e) {
            log.warn("Photo archive unavailable: {}", e.getMessage());
            return unavailable("Photo archive is unavailable, try again later", request);
        } catch (final CancellationException e) {
            log.warn("Panorama listing cancelled: {}", e.getMessage());
            return unavailable("Request was cancelled", request);
        }
    }

    /**
     * @param id panorama id, e.g. {@code pano_curiosity_1000_14}
     * @return {@code 200 OK} with the panorama or {@code 404 Not Found}
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getPanoramaById(@PathVariable final String id, final HttpServletRequest request) {
        try {
            return panoramaService.getPanoramaById(id)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(ApiError.notFound("Panorama with ID '" + id + "' not found",
                                    request.getRequestURI())));
        } catch (final RestClientException e) {
            log.warn("Photo archive unavailable while resolving [{}]: {}", id, e.getMessage());
            return unavailable("Photo archive is unavailable, try again later", request);
        } catch (final CancellationException e) {
            log.warn("Panorama lookup [{}] cancelled: {}", id, e.getMessage());
            return unavailable("Request was cancelled", request);
        }
    }

    /**
     * Query parameters that do not convert to their declared type, e.g. {@code sol_min=abc}.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(final MethodArgumentTypeMismatchException e,
                                                       final HttpServletRequest request) {
        final var expected = e.getRequiredType() == null ? "value" : e.getRequiredType().getSimpleName();
        final var detail = "Invalid " + e.getName() + " '" + e.getValue() + "': expected " + expected;
        log.info("Rejected panorama query, {}", detail);
        return ResponseEntity.badRequest()
                .body(ApiError.validation(e.getName(), detail, request.getRequestURI()));
    }

    private static ResponseEntity<ApiError> unavailable(final String detail, final HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiError.unavailable(detail, request.getRequestURI()));
    }
}
