package com.example.workoutlog.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a box produced a {@link ParseWarning}.
 */
public enum WarningReason {
    DIGITS_TOO_LONG("digits_too_long"),
    SIDE_COUNT_MISMATCH("side_count_mismatch");

    private final String wireName;

    WarningReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
