package io.statsheets.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class Batches {
    private Batches() {}

    /**
     * Splits items into consecutive batches of {@code size}; the last batch holds the remainder.
     * An empty input yields no batches.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) throw new IllegalArgumentException("batch size must be positive: " + size);
        List<List<T>> out = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            int to = Math.min(items.size(), from + size);
            out.add(List.copyOf(items.subList(from, to)));
        }
        return out;
    }

    /** Comma-joined id list as sent in a batch query; duplicates are kept. */
    public static String joinIds(Collection<String> ids) {
        return String.join(",", ids);
    }
}
