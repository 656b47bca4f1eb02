package com.example.workoutlog.application.parser;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the printed exercise label from a sheet line that text extraction may have merged with
 * the handwritten continuation, e.g. {@code "Split Squat - 3x10 L - 0# x 25"} becomes
 * {@code "Split Squat"}.
 */
@Component
public class NameResolver {

    private static final String LABEL_DELIMITER = " - ";

    private final Pattern continuationStart;

    public NameResolver(AnnotationParserProperties properties) {
        this.continuationStart = Pattern.compile("(?<!\\p{L})(?:"
                + markerPattern(properties.getLeftMarker()) + "|"
                + markerPattern(properties.getRightMarker()) + ")|\\d");
    }

    /**
     * Resolves every exercise line of a sheet, title line excluded.
     *
     * @param lines printed lines in sheet order
     * @return exercise names in the same order
     */
    public List<String> resolveAll(List<String> lines) {
        return lines.stream().map(this::resolve).toList();
    }

    /**
     * Cuts a line at the first section marker or digit. When a {@code " - "} delimiter precedes that
     * position the name ends at the nearest such delimiter instead.
     * <p>
     * A marker letter directly preceded by another letter is part of a word, not a section marker:
     * {@code "Romanian DL - 3x8"} resolves to {@code "Romanian DL"} rather than {@code "Romanian"}.
     *
     * @param line printed sheet line
     * @return exercise name, possibly empty when the line starts with handwriting
     */
    public String resolve(String line) {
        if (line == null) {
            return "";
        }
        String text = line.strip();
        Matcher matcher = continuationStart.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        int delimiter = text.lastIndexOf(LABEL_DELIMITER, matcher.start() - LABEL_DELIMITER.length());
        if (delimiter >= 0) {
            return text.substring(0, delimiter).strip();
        }
        return text.substring(0, matcher.start()).strip();
    }

    /**
     * Builds a whitespace-tolerant pattern from a marker such as {@code "L -"}.
     */
    private static String markerPattern(String marker) {
        StringBuilder pattern = new StringBuilder();
        for (String part : marker.strip().split("\\s+")) {
            if (pattern.length() > 0) {
                pattern.append("\\s*");
            }
            pattern.append(Pattern.quote(part));
        }
        return pattern.append("\\s*").toString();
    }
}
