package io.pingjob.utils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares the ids that should be scheduled with the tags that are.
 */
public final class DriftDetector {
    private DriftDetector() {
    }

    /**
     * Ids present in the durable index but not active in the scheduler, in sorted order.
     * Active tags that are not in the index are ignored; drift is only ever repaired by
     * re-registering, never by removing.
     */
    public static Set<String> computeMissing(Set<String> durableIds, Set<String> activeTags) {
        Objects.requireNonNull(durableIds, "durableIds must not be null");
        Objects.requireNonNull(activeTags, "activeTags must not be null");

        Set<String> missing = new TreeSet<>(durableIds);
        missing.removeAll(activeTags);
        return Collections.unmodifiableSet(new LinkedHashSet<>(missing));
    }
}
