package io.github.jakubt4.vista.detection;

import io.github.jakubt4.vista.model.GroupKey;
import io.github.jakubt4.vista.model.PhotoRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Partitions photos into independent candidate buckets by rover, sol, site, drive and camera.
 *
 * <p>Two cameras shooting at the same stop at the same time end up in separate buckets.
 */
@Component
public class GroupingStage {

    /**
     * @param photos telemetry-complete, located photos
     * @return buckets in {@link GroupKey} order
     */
    public SortedMap<GroupKey, List<PhotoRecord>> group(final Collection<PhotoRecord> photos) {
        final var groups = new TreeMap<GroupKey, List<PhotoRecord>>();
        for (final var photo : photos) {
            groups.computeIfAbsent(GroupKey.of(photo), key -> new ArrayList<>()).add(photo);
        }
        return groups;
    }
}
