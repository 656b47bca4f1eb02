package com.example.workoutlog.infrastructure.pdf;

import com.example.workoutlog.domain.model.SheetLayout;
import com.example.workoutlog.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WorkoutSheetGeneratorTest {

    private final WorkoutSheetGenerator generator = new WorkoutSheetGenerator();

    @Test
    void printsTitleAndExerciseLinesOnOneA4Page() throws Exception {
        byte[] pdf = generator.generate(SheetLayout.a4(), "2024-05-01 - Push Day",
                List.of("Bench Press - 3x10", "Split Squat - L/R 3x12"));

        try (PDDocument document = Loader.loadPDF(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
            assertThat(document.getPage(0).getMediaBox().getHeight()).isCloseTo(SheetLayout.A4_HEIGHT, within(0.01f));
            assertThat(document.getDocumentInformation().getTitle()).isEqualTo("2024-05-01 - Push Day");

            String text = new PDFTextStripper().getText(document);
            assertThat(text).contains("2024-05-01 - Push Day", "Bench Press - 3x10", "Split Squat - L/R 3x12");
        }
    }

    @Test
    void unprintableCharactersAreReportedAsProcessingFailure() {
        assertThrows(PdfProcessingException.class,
                () -> generator.generate(SheetLayout.a4(), "Workout", List.of("Squat 一")));
    }
}
