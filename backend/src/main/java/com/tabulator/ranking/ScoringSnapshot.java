package com.tabulator.ranking;

import com.tabulator.model.Division;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * One division's scoring state as read from the store: ordered categories, the active
 * contestants and judges, and their score and lock rows. Rankings are pure functions of it.
 */
public record ScoringSnapshot(
        Division division,
        List<CategoryRef> categories,
        List<ContestantRef> contestants,
        Set<UUID> judgeIds,
        List<ScoreEntry> scores,
        Set<LockKey> locks
) {

    public ScoringSnapshot {
        categories = List.copyOf(categories);
        contestants = List.copyOf(contestants);
        judgeIds = Set.copyOf(judgeIds);
        scores = List.copyOf(scores);
        locks = Set.copyOf(locks);
    }

    public static ScoringSnapshot empty(Division division) {
        return new ScoringSnapshot(division, List.of(), List.of(), Set.of(), List.of(), Set.of());
    }

    /**
     * Presentation order for contestants sharing a rank: display number, then id.
     */
    public Comparator<UUID> contestantOrder() {
        Map<UUID, Integer> numbers = new HashMap<>();
        for (ContestantRef contestant : contestants) {
            numbers.put(contestant.contestantId(), contestant.number());
        }
        return Comparator.<UUID, Integer>comparing(numbers::get, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Comparator.naturalOrder());
    }
}
