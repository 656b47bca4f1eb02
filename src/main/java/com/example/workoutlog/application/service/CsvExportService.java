package com.example.workoutlog.application.service;

import com.example.workoutlog.application.exception.CsvExportValidationException;
import com.example.workoutlog.domain.model.ExerciseRecord;
import com.example.workoutlog.domain.model.SheetTitle;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Application-layer service that turns parsed records into the CSV layout read by the storage importer.
 */
@Service
public class CsvExportService {

    static final String HEADER =
            "date_completed,body_part,exercise_name,laterality,sets,weight_left,weight_right,reps_left,reps_right,extra_text";
    private static final String LIST_SEPARATOR = ";";

	/**
	 * Runs validation and returns a CSV string containing one row per record.
	 *
	 * @param records     parsed records in sheet order
	 * @param workoutDate date the workout was done, or {@code null} when unknown
	 * @return CSV content ready to stream to the browser
	 * @throws CsvExportValidationException when there is nothing to export
	 */
    public String export(List<ExerciseRecord> records, LocalDate workoutDate) {
        if (records == null || records.isEmpty()) {
            throw new CsvExportValidationException("No parsed exercises available for export.");
        }
        return buildCsv(records, workoutDate == null ? "" : SheetTitle.DATE_FORMATTER.format(workoutDate));
    }

	/**
	 * Builds the CSV output including the header row and sanitized values.
	 * Body part is left empty for the user to assign during import.
	 */
    private String buildCsv(List<ExerciseRecord> records, String date) {
        StringBuilder builder = new StringBuilder();
        builder.append(HEADER).append('\n');
        for (ExerciseRecord record : records) {
            builder.append(date).append(',')
                    .append(',')
                    .append(escape(record.exerciseName())).append(',')
                    .append(record.laterality().wireName()).append(',')
                    .append(record.sets()).append(',')
                    .append(joinList(record.weightLeft())).append(',')
                    .append(joinList(record.weightRight())).append(',')
                    .append(joinList(record.repsLeft())).append(',')
                    .append(joinList(record.repsRight())).append(',')
                    .append(escape(record.extraText()))
                    .append('\n');
        }
        return builder.toString();
    }

    private String joinList(List<Integer> values) {
        if (values == null || values.isEmpty()) {
            return "";
        }
        return values.stream().map(String::valueOf).collect(Collectors.joining(LIST_SEPARATOR));
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
