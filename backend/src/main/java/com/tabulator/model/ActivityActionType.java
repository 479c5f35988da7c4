package com.tabulator.model;

public enum ActivityActionType {
    SCORES_SUBMITTED,
    LOCK_CREATED,
    LOCK_REMOVED,
    CONTESTANT_CREATED,
    JUDGE_CREATED,
    JUDGE_UPDATED
}
