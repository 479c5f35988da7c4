package com.tabulator.ranking;

import java.util.UUID;

public record LockKey(
        UUID judgeId,
        UUID categoryId,
        UUID contestantId
) {
}
