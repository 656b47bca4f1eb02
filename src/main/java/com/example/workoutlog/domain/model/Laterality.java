package com.example.workoutlog.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether an exercise box was recorded for a single side or with separate left/right sections.
 */
public enum Laterality {
    UNILATERAL("unilateral"),
    BILATERAL("bilateral");

    private final String wireName;

    Laterality(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return lower-case name used by the storage schema and the JSON output
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses the storage representation back into the enum.
     *
     * @param value wire name, case-insensitive
     * @return matching laterality
     * @throws IllegalArgumentException when the value is unknown
     */
    public static Laterality fromWireName(String value) {
        if (value != null) {
            String normalized = value.strip().toLowerCase(Locale.ROOT);
            for (Laterality laterality : values()) {
                if (laterality.wireName.equals(normalized)) {
                    return laterality;
                }
            }
        }
        throw new IllegalArgumentException("Unknown laterality: " + value);
    }
}
