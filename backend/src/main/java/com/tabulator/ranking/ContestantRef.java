package com.tabulator.ranking;

import java.util.UUID;

public record ContestantRef(
        UUID contestantId,
        Integer number,
        String fullName
) {
}
