package com.tabulator.ranking;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Assigns ordinal ranks where every member of a run of equal keys receives the mean of the
 * positions the run occupies. Two items tied for positions 1 and 2 both get 1.5; three items
 * tied for 2, 3 and 4 all get 3.0. Rank values depend only on the keys, never on input order.
 */
public final class TieAveragingRanker {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private TieAveragingRanker() {
    }

    public enum Direction {
        /** Highest key takes position 1. */
        DESCENDING,
        /** Lowest key takes position 1. */
        ASCENDING
    }

    public static <T> List<Ranked<T>> rank(
            Collection<T> items,
            Function<T, BigDecimal> key,
            Direction direction,
            Comparator<T> tieOrder
    ) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }

        Comparator<T> byKey = Comparator.comparing(key);
        if (direction == Direction.DESCENDING) {
            byKey = byKey.reversed();
        }

        List<T> sorted = new ArrayList<>(items);
        sorted.sort(byKey.thenComparing(tieOrder));

        List<Ranked<T>> ranked = new ArrayList<>(sorted.size());
        int start = 0;
        while (start < sorted.size()) {
            BigDecimal runKey = key.apply(sorted.get(start));
            int end = start;
            while (end + 1 < sorted.size() && key.apply(sorted.get(end + 1)).compareTo(runKey) == 0) {
                end++;
            }
            // positions are 1-based: (start + 1 + end + 1) / 2
            BigDecimal rank = BigDecimal.valueOf(start + end + 2L).divide(TWO).setScale(1);
            for (int i = start; i <= end; i++) {
                ranked.add(new Ranked<>(sorted.get(i), rank));
            }
            start = end + 1;
        }
        return List.copyOf(ranked);
    }

    public record Ranked<T>(T item, BigDecimal rank) {
    }
}
