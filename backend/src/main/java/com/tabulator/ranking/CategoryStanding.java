package com.tabulator.ranking;

import java.math.BigDecimal;
import java.util.UUID;

public record CategoryStanding(
        UUID categoryId,
        BigDecimal placement,
        BigDecimal rankSum,
        boolean strongest,
        boolean weakest
) {
}
