package com.example.workoutlog.application.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for printing blank workout sheets.
 */
@ConfigurationProperties(prefix = "workout.sheet")
public class SheetProperties {

    /** Workout name used in the title when the caller gives none. */
    private String defaultWorkoutName = "Workout";

    public String getDefaultWorkoutName() {
        return defaultWorkoutName;
    }

    public void setDefaultWorkoutName(String defaultWorkoutName) {
        this.defaultWorkoutName = defaultWorkoutName;
    }
}
