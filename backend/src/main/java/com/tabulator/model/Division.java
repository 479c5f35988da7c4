package com.tabulator.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum Division {
    MALE,
    FEMALE;

    /**
     * Accepts the path and query spelling ({@code male}, {@code Female}) as well as the enum name.
     */
    @JsonCreator
    public static Division fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("division is required");
        }
        return Division.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
