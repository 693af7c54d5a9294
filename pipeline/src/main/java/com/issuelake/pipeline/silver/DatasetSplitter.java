package com.issuelake.pipeline.silver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Positional train/val/test split (70/15/15) over an already ordered list.
 *
 * <p>Boundaries are {@code floor(0.70n)} and {@code floor(0.85n)}, adjusted so that every split
 * gets at least one row when {@code n >= 3}. For {@code n < 3} train fills first, then val.</p>
 */
public final class DatasetSplitter {

    private DatasetSplitter() {}

    public static final String TRAIN = "train";
    public static final String VAL = "val";
    public static final String TEST = "test";

    static final int TRAIN_PERCENT = 70;
    static final int VAL_PERCENT = 15;

    record Boundaries(int trainEnd, int valEnd) {}

    static Boundaries boundaries(int n) {
        if (n <= 0) {
            return new Boundaries(0, 0);
        }
        int trainEnd = Math.max((int) ((long) n * TRAIN_PERCENT / 100), 1);
        int valEnd = Math.max((int) ((long) n * (TRAIN_PERCENT + VAL_PERCENT) / 100), trainEnd + 1);
        if (n >= 3) {
            trainEnd = Math.min(trainEnd, n - 2);
            valEnd = Math.min(Math.max(valEnd, trainEnd + 1), n - 1);
        } else {
            valEnd = Math.min(valEnd, n);
        }
        return new Boundaries(trainEnd, valEnd);
    }

    public static <T> Map<String, List<T>> split(List<T> ordered) {
        Boundaries b = boundaries(ordered.size());
        Map<String, List<T>> splits = new LinkedHashMap<>();
        splits.put(TRAIN, List.copyOf(ordered.subList(0, b.trainEnd())));
        splits.put(VAL, List.copyOf(ordered.subList(b.trainEnd(), b.valEnd())));
        splits.put(TEST, List.copyOf(ordered.subList(b.valEnd(), ordered.size())));
        return splits;
    }
}
