package com.tabulator.dto;

import com.tabulator.model.Division;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public final class RosterRequests {

    private RosterRequests() {
    }

    public record CreateContestantRequest(
            @NotNull(message = "number is required")
            @Positive(message = "number must be positive")
            Integer number,

            @NotBlank(message = "fullName is required")
            @Size(max = 160, message = "fullName must be at most 160 characters")
            String fullName,

            @NotNull(message = "division is required")
            Division division
    ) {
    }

    public record CreateJudgeRequest(
            @NotBlank(message = "fullName is required")
            @Size(max = 160, message = "fullName must be at most 160 characters")
            String fullName,

            @NotBlank(message = "username is required")
            @Size(max = 64, message = "username must be at most 64 characters")
            String username,

            @NotNull(message = "division is required")
            Division division
    ) {
    }

    /**
     * Partial judge edit; absent fields keep their stored value. Deactivating a judge removes their
     * submissions from the rankings without deleting any score.
     */
    public record UpdateJudgeRequest(
            @Size(max = 160, message = "fullName must be at most 160 characters")
            String fullName,

            Division division,

            Boolean active
    ) {
    }
}
