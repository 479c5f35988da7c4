package com.tabulator.ranking;

import java.util.UUID;

public record CategoryRef(
        UUID categoryId,
        String slug,
        String label,
        int sortOrder
) {
}
