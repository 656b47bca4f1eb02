package com.example.workoutlog.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advisory note about a box that needs a human look. Never blocks record production.
 *
 * @param boxText full text of the box the warning refers to
 * @param token   offending token, or a short description of the mismatch
 * @param reason  warning category
 */
public record ParseWarning(
        @JsonProperty("box_text") String boxText,
        @JsonProperty("token") String token,
        @JsonProperty("reason") WarningReason reason
) {

    public static ParseWarning digitsTooLong(String boxText, String token) {
        return new ParseWarning(boxText, token, WarningReason.DIGITS_TOO_LONG);
    }

    public static ParseWarning sideCountMismatch(String boxText, int leftSets, int rightSets) {
        return new ParseWarning(boxText, "left=" + leftSets + " right=" + rightSets, WarningReason.SIDE_COUNT_MISMATCH);
    }
}
