package com.example.workoutlog.application.service;

import com.example.workoutlog.application.exception.SheetGenerationValidationException;
import com.example.workoutlog.domain.model.SheetLayout;
import com.example.workoutlog.infrastructure.pdf.WorkoutSheetGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SheetGenerationServiceTest {

    private WorkoutSheetGenerator generator;
    private SheetGenerationService service;

    @BeforeEach
    void setUp() {
        generator = mock(WorkoutSheetGenerator.class);
        when(generator.generate(any(SheetLayout.class), anyString(), anyList())).thenReturn(new byte[]{1});
        service = new SheetGenerationService(generator, new SheetProperties());
    }

    @Test
    void blankLinesAreSkipped() {
        byte[] pdf = service.generate("2024-05-01 - Legs", Arrays.asList(" Squat - 5x5 ", "", null, "Calf Raise"));

        assertThat(pdf).containsExactly(1);
        verify(generator).generate(any(SheetLayout.class), eq("2024-05-01 - Legs"), eq(List.of("Squat - 5x5", "Calf Raise")));
    }

    @Test
    void requiresAtLeastOneExercise() {
        assertThrows(SheetGenerationValidationException.class, () -> service.generate("Legs", List.of(" ")));
        assertThrows(SheetGenerationValidationException.class, () -> service.generate("Legs", null));
    }

    @Test
    void rejectsMoreExercisesThanFitOnAPage() {
        List<String> lines = new ArrayList<>(Collections.nCopies(SheetLayout.a4().capacity() + 1, "Push-up"));

        assertThrows(SheetGenerationValidationException.class, () -> service.generate("Legs", lines));
    }

    @Test
    void blankTitleDefaultsToTodayAndWorkoutName() {
        String title = service.resolveTitle(" ");

        assertThat(title).isEqualTo(LocalDate.now() + " - Workout");
    }
}
