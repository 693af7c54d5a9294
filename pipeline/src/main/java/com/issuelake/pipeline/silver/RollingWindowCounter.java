package com.issuelake.pipeline.silver;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-group trailing-window event counts.
 *
 * <p>For each element, the count is the number of earlier elements in the same group whose
 * timestamp is at most {@code window} behind it. The element itself is not counted.
 * Elements with a null key or null timestamp get 0 and are never counted for others.
 * Each group is sorted once and then scanned with two monotonic pointers.</p>
 */
public final class RollingWindowCounter {

    private RollingWindowCounter() {}

    /**
     * @param keys  grouping key per element (null means "no group")
     * @param times event time per element
     * @return counts aligned with the input positions
     */
    public static <K> long[] countPriorInWindow(List<K> keys, List<Instant> times, Duration window) {
        if (keys.size() != times.size()) {
            throw new IllegalArgumentException("keys and times must have the same size");
        }
        long[] counts = new long[keys.size()];

        Map<K, List<Integer>> groups = new HashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            if (keys.get(i) != null && times.get(i) != null) {
                groups.computeIfAbsent(keys.get(i), k -> new ArrayList<>()).add(i);
            }
        }

        for (List<Integer> members : groups.values()) {
            // stable: equal timestamps keep input order
            members.sort(Comparator.comparing(times::get));
            int start = 0;
            for (int end = 0; end < members.size(); end++) {
                Instant current = times.get(members.get(end));
                while (start < end
                        && Duration.between(times.get(members.get(start)), current).compareTo(window) > 0) {
                    start++;
                }
                counts[members.get(end)] = end - start;
            }
        }
        return counts;
    }
}
