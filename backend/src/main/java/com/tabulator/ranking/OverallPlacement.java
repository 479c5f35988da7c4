package com.tabulator.ranking;

import java.math.BigDecimal;
import java.util.UUID;

public record OverallPlacement(
        UUID contestantId,
        BigDecimal totalPoints,
        int categoriesCounted,
        BigDecimal placement
) {
}
