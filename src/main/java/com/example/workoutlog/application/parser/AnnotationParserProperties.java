package com.example.workoutlog.application.parser;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Grammar symbols of the handwriting shorthand read from exercise boxes.
 */
@ConfigurationProperties(prefix = "workout.parser")
public class AnnotationParserProperties {

    /** Symbol written right after a load, e.g. {@code 90#}. */
    private String weightMarker = "#";

    /** Section header opening the left side of a bilateral box. */
    private String leftMarker = "L -";

    /** Section header opening the right side of a bilateral box. */
    private String rightMarker = "R -";

    /** Longest digit run trusted as a single number; longer runs are usually fused OCR tokens. */
    private int maxDigits = 3;

    public String getWeightMarker() {
        return weightMarker;
    }

    public void setWeightMarker(String weightMarker) {
        this.weightMarker = weightMarker;
    }

    public String getLeftMarker() {
        return leftMarker;
    }

    public void setLeftMarker(String leftMarker) {
        this.leftMarker = leftMarker;
    }

    public String getRightMarker() {
        return rightMarker;
    }

    public void setRightMarker(String rightMarker) {
        this.rightMarker = rightMarker;
    }

    public int getMaxDigits() {
        return maxDigits;
    }

    public void setMaxDigits(int maxDigits) {
        this.maxDigits = maxDigits;
    }
}
