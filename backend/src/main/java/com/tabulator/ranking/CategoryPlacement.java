package com.tabulator.ranking;

import java.math.BigDecimal;
import java.util.UUID;

public record CategoryPlacement(
        UUID categoryId,
        UUID contestantId,
        BigDecimal rankSum,
        int judgeCount,
        BigDecimal placement
) {
}
