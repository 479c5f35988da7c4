package com.tabulator.model;

public enum ScoreChangeType {
    CREATED,
    UPDATED
}
