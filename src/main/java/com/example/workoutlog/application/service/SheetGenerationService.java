package com.example.workoutlog.application.service;

import com.example.workoutlog.application.exception.SheetGenerationValidationException;
import com.example.workoutlog.domain.model.SheetLayout;
import com.example.workoutlog.domain.model.SheetTitle;
import com.example.workoutlog.infrastructure.pdf.WorkoutSheetGenerator;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Application-layer service that validates a sheet request and delegates rendering to PDFBox.
 */
@Service
public class SheetGenerationService {

    private final WorkoutSheetGenerator sheetGenerator;
    private final SheetProperties sheetProperties;
    private final SheetLayout layout = SheetLayout.a4();

    public SheetGenerationService(WorkoutSheetGenerator sheetGenerator, SheetProperties sheetProperties) {
        this.sheetGenerator = sheetGenerator;
        this.sheetProperties = sheetProperties;
    }

    /**
     * Builds a blank workout sheet.
     *
     * @param title         sheet title; blank falls back to today's date and the default workout name
     * @param exerciseLines exercise lines to print, blank entries skipped
     * @return PDF bytes
     * @throws SheetGenerationValidationException when there is nothing to print or too much for one page
     */
    public byte[] generate(String title, List<String> exerciseLines) {
        List<String> lines = exerciseLines == null ? List.of() : exerciseLines.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
        if (lines.isEmpty()) {
            throw new SheetGenerationValidationException("Please list at least one exercise for the sheet.");
        }
        if (lines.size() > layout.capacity()) {
            throw new SheetGenerationValidationException(
                    "A sheet holds at most " + layout.capacity() + " exercises; got " + lines.size() + ".");
        }
        return sheetGenerator.generate(layout, resolveTitle(title), lines);
    }

    /**
     * @param title requested title (may be blank)
     * @return title to print
     */
    String resolveTitle(String title) {
        if (title != null && !title.isBlank()) {
            return title.strip();
        }
        return SheetTitle.format(LocalDate.now(), sheetProperties.getDefaultWorkoutName());
    }
}
