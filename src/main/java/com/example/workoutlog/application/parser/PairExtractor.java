package com.example.workoutlog.application.parser;

import com.example.workoutlog.domain.model.ParseWarning;
import com.example.workoutlog.domain.model.WeightRepPair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds explicit {@code <weight><marker> x <reps>} pairs such as {@code 90# x 10} or {@code 0#×25}.
 */
@Component
public class PairExtractor {

    private final TokenValidator tokenValidator;
    private final Pattern pairPattern;

    public PairExtractor(AnnotationParserProperties properties, TokenValidator tokenValidator) {
        this.tokenValidator = tokenValidator;
        this.pairPattern = Pattern.compile(
                "(?<!\\d)(\\d+)" + Pattern.quote(properties.getWeightMarker()) + "\\s*[x×]\\s*(\\d+)",
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Extracts every pair from left to right. A pair is kept only when both of its tokens pass the
     * {@link TokenValidator}; the text of every match is blanked out either way so the numbers are
     * never counted twice.
     *
     * @param sideText text of one side
     * @param boxText  full box text, attached to warnings
     * @param warnings sink for rejected tokens
     * @return accepted pairs and the remaining text, same length as the input
     */
    public PairExtraction extract(String sideText, String boxText, List<ParseWarning> warnings) {
        List<PositionedSet> pairs = new ArrayList<>();
        StringBuilder remainder = new StringBuilder(sideText);
        Matcher matcher = pairPattern.matcher(sideText);
        while (matcher.find()) {
            Integer weight = tokenValidator.validate(matcher.group(1), boxText, warnings);
            Integer reps = tokenValidator.validate(matcher.group(2), boxText, warnings);
            if (weight != null && reps != null) {
                pairs.add(PositionedSet.explicit(matcher.start(), new WeightRepPair(weight, reps)));
            }
            blank(remainder, matcher.start(), matcher.end());
        }
        return new PairExtraction(pairs, remainder.toString());
    }

    static void blank(StringBuilder text, int start, int end) {
        for (int i = start; i < end; i++) {
            text.setCharAt(i, ' ');
        }
    }

    /**
     * @param pairs     accepted pairs in order of appearance
     * @param remainder side text with every matched span replaced by spaces
     */
    public record PairExtraction(List<PositionedSet> pairs, String remainder) {
    }
}
