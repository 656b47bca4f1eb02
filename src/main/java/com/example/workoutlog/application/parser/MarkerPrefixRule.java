package com.example.workoutlog.application.parser;

import org.springframework.stereotype.Component;

/**
 * Recognizes numbers written directly after the weight marker ({@code #4}). Such a number is an
 * equipment setting such as a machine hole, not a repetition count.
 * <p>
 * Only the directly adjacent form counts; {@code "# 4"} is still read as a rep.
 */
@Component
public class MarkerPrefixRule {

    private final AnnotationParserProperties properties;

    public MarkerPrefixRule(AnnotationParserProperties properties) {
        this.properties = properties;
    }

    /**
     * @param text        text being scanned
     * @param numberStart index of the first digit of the number
     * @return {@code true} when the weight marker ends right before {@code numberStart}
     */
    public boolean isEquipmentSetting(String text, int numberStart) {
        String marker = properties.getWeightMarker();
        int markerStart = numberStart - marker.length();
        return markerStart >= 0 && text.startsWith(marker, markerStart);
    }
}
