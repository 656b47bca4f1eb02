package com.example.workoutlog.application.parser;

import com.example.workoutlog.domain.model.ParseWarning;
import com.example.workoutlog.domain.model.SideResult;
import com.example.workoutlog.domain.model.WeightRepPair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses the text of one side of an exercise box into aligned weight and rep sequences.
 * <p>
 * Explicit pairs come from the {@link PairExtractor}. Bare numbers left over are extra sets done at
 * the most recent weight written before them, or at 0 when no pair precedes them. Whatever is
 * neither becomes the residue.
 */
@Component
public class SideParser {

    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEADING_COMMAS = Pattern.compile("^,+");
    private static final Pattern EDGE_COMMAS = Pattern.compile("^[\\s,]+|[\\s,]+$");

    private final PairExtractor pairExtractor;
    private final TokenValidator tokenValidator;
    private final MarkerPrefixRule markerPrefixRule;
    private final Pattern strayToken;

    public SideParser(AnnotationParserProperties properties,
                      PairExtractor pairExtractor,
                      TokenValidator tokenValidator,
                      MarkerPrefixRule markerPrefixRule) {
        this.pairExtractor = pairExtractor;
        this.tokenValidator = tokenValidator;
        this.markerPrefixRule = markerPrefixRule;
        this.strayToken = Pattern.compile(
                "(?:" + Pattern.quote(properties.getWeightMarker()) + "|[x×\\-,])+",
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * @param sideText text of one side (the whole box for unilateral exercises)
     * @param boxText  full box text, attached to warnings
     * @param warnings sink for rejected tokens
     * @return parsed side; never {@code null}
     */
    public SideResult parse(String sideText, String boxText, List<ParseWarning> warnings) {
        String text = sideText == null ? "" : sideText;
        PairExtractor.PairExtraction extraction = pairExtractor.extract(text, boxText, warnings);
        String remainder = extraction.remainder();

        List<PositionedSet> found = new ArrayList<>(extraction.pairs());
        StringBuilder residue = new StringBuilder(remainder);
        Matcher matcher = NUMBER.matcher(remainder);
        while (matcher.find()) {
            PairExtractor.blank(residue, matcher.start(), matcher.end());
            if (markerPrefixRule.isEquipmentSetting(remainder, matcher.start())) {
                continue;
            }
            Integer reps = tokenValidator.validate(matcher.group(), boxText, warnings);
            if (reps != null) {
                found.add(PositionedSet.bare(matcher.start(), reps));
            }
        }

        found.sort(Comparator.comparingInt(PositionedSet::offset));
        List<WeightRepPair> sets = new ArrayList<>(found.size());
        int lastWeight = 0;
        for (PositionedSet positioned : found) {
            if (positioned.explicitWeight()) {
                lastWeight = positioned.set().weight();
                sets.add(positioned.set());
            } else {
                sets.add(new WeightRepPair(lastWeight, positioned.set().reps()));
            }
        }
        return SideResult.of(sets, cleanResidue(residue.toString()));
    }

    /**
     * Drops tokens made only of markers, separators and the commas left behind by the removed
     * numbers. Commas that follow a word, as in {@code felt easy, add weight}, are kept; commas at
     * either end of the residue are not.
     *
     * @param leftover side text with every number blanked out
     * @return remaining words joined by single spaces, or {@code null}
     */
    String cleanResidue(String leftover) {
        String joined = Arrays.stream(WHITESPACE.split(leftover.strip()))
                .filter(word -> !strayToken.matcher(word).matches())
                .map(word -> LEADING_COMMAS.matcher(word).replaceFirst(""))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.joining(" "));
        String cleaned = EDGE_COMMAS.matcher(joined).replaceAll("");
        return cleaned.isEmpty() ? null : cleaned;
    }
}
