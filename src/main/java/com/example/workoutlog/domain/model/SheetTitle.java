package com.example.workoutlog.domain.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Title line printed at the top of a workout sheet, e.g. {@code "2024-05-01 - Push Day"}.
 *
 * @param rawTitle    title as printed
 * @param workoutDate date found in the title, or {@code null}
 * @param workoutName text after the first {@code " - "}, or {@code null}
 */
public record SheetTitle(String rawTitle, LocalDate workoutDate, String workoutName) {

    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final Pattern DATE_PATTERN = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");
    private static final String NAME_DELIMITER = " - ";

    /**
     * Parses a printed title line.
     *
     * @param line title text (may be {@code null})
     * @return parsed title; fields are {@code null} when not present
     */
    public static SheetTitle parse(String line) {
        if (line == null || line.isBlank()) {
            return new SheetTitle(null, null, null);
        }
        String title = line.strip();
        LocalDate date = null;
        Matcher matcher = DATE_PATTERN.matcher(title);
        if (matcher.find()) {
            try {
                date = LocalDate.parse(matcher.group(1), DATE_FORMATTER);
            } catch (DateTimeParseException ignored) {
                // not a calendar date, keep the title only
            }
        }
        int delimiter = title.indexOf(NAME_DELIMITER);
        String name = delimiter >= 0 ? title.substring(delimiter + NAME_DELIMITER.length()).strip() : null;
        return new SheetTitle(title, date, name == null || name.isEmpty() ? null : name);
    }

    /**
     * Formats the title printed by the sheet generator.
     *
     * @param date        workout date
     * @param workoutName workout name
     * @return title line
     */
    public static String format(LocalDate date, String workoutName) {
        return DATE_FORMATTER.format(date) + NAME_DELIMITER + workoutName;
    }
}
