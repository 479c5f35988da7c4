package com.tabulator.model;

public enum ActivityActorType {
    JUDGE,
    ADMIN
}
