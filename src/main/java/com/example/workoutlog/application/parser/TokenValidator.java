package com.example.workoutlog.application.parser;

import com.example.workoutlog.domain.model.ParseWarning;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Length check applied to every digit token before it may become a weight or a rep count.
 * Tokens longer than {@code workout.parser.max-digits} are usually two numbers fused by OCR; they
 * are dropped and reported.
 */
@Component
public class TokenValidator {

    private final AnnotationParserProperties properties;

    public TokenValidator(AnnotationParserProperties properties) {
        this.properties = properties;
    }

    /**
     * @param digits digit-only token
     * @return {@code true} when the token is short enough to trust
     */
    public boolean isTrustedLength(String digits) {
        return digits.length() <= properties.getMaxDigits();
    }

    /**
     * Converts a digit token to its value or rejects it with a warning.
     *
     * @param token    digit-only token
     * @param boxText  full text of the box, attached to any warning
     * @param warnings sink receiving a {@code digits_too_long} warning on rejection
     * @return parsed value or {@code null} when the token was rejected
     */
    public Integer validate(String token, String boxText, List<ParseWarning> warnings) {
        if (!isTrustedLength(token)) {
            warnings.add(ParseWarning.digitsTooLong(boxText, token));
            return null;
        }
        return Integer.parseInt(token);
    }
}
