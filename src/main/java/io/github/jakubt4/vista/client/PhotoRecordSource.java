package io.github.jakubt4.vista.client;

import io.github.jakubt4.vista.model.PhotoRecord;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Read-only access to the photo archive.
 */
public interface PhotoRecordSource {

    /**
     * Photos of the given rovers within an inclusive sol range. Telemetry fields may be {@code null}.
     *
     * @param rovers lower-case rover names, empty for all rovers
     * @param solMin lower bound, {@code null} for open
     * @param solMax upper bound, {@code null} for open
     */
    List<PhotoRecord> findPhotos(Set<String> rovers, Integer solMin, Integer solMax);

    /**
     * Latest sol with any photo for the given rovers, empty if the archive holds none.
     */
    OptionalInt latestSol(Set<String> rovers);
}
