package io.github.jakubt4.vista.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * Identifies one candidate bucket: photos taken by the same camera at the same rover stop.
 *
 * @param rover  lower-case rover name
 * @param sol    Martian day index
 * @param site   coarse location marker
 * @param drive  fine location marker
 * @param camera camera short name
 */
public record GroupKey(String rover, int sol, int site, int drive, String camera)
        implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator
            .comparing(GroupKey::rover)
            .thenComparingInt(GroupKey::sol)
            .thenComparingInt(GroupKey::site)
            .thenComparingInt(GroupKey::drive)
            .thenComparing(GroupKey::camera);

    /**
     * Builds the key of a located photo. Callers must have checked {@link PhotoRecord#hasLocation()}.
     */
    public static GroupKey of(final PhotoRecord photo) {
        return new GroupKey(
                photo.rover().toLowerCase(Locale.ROOT),
                photo.sol(),
                photo.site(),
                photo.drive(),
                photo.camera());
    }

    public SolKey solKey() {
        return new SolKey(rover, sol);
    }

    @Override
    public int compareTo(final GroupKey other) {
        return ORDER.compare(this, other);
    }
}
