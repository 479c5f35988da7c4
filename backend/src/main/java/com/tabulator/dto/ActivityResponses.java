package com.tabulator.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class ActivityResponses {

    private ActivityResponses() {
    }

    public record ActivityEntry(
            UUID activityId,
            String actorType,
            String actorName,
            String actionType,
            String entityType,
            UUID entityId,
            String description,
            JsonNode metadata,
            OffsetDateTime createdAt
    ) {
    }
}
