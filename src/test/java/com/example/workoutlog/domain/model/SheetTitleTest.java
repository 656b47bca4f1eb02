package com.example.workoutlog.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class SheetTitleTest {

    @Test
    void parsesDateAndWorkoutName() {
        SheetTitle title = SheetTitle.parse(" 2024-05-01 - Push Day ");

        assertThat(title.rawTitle()).isEqualTo("2024-05-01 - Push Day");
        assertThat(title.workoutDate()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(title.workoutName()).isEqualTo("Push Day");
    }

    @Test
    void titleWithoutDateKeepsName() {
        SheetTitle title = SheetTitle.parse("Monday - Legs");

        assertThat(title.workoutDate()).isNull();
        assertThat(title.workoutName()).isEqualTo("Legs");
    }

    @Test
    void impossibleDateIsIgnored() {
        SheetTitle title = SheetTitle.parse("2024-13-45");

        assertThat(title.workoutDate()).isNull();
        assertThat(title.workoutName()).isNull();
    }

    @Test
    void blankTitleHasNoFields() {
        assertThat(SheetTitle.parse("  ")).isEqualTo(new SheetTitle(null, null, null));
        assertThat(SheetTitle.parse(null).rawTitle()).isNull();
    }

    @Test
    void formatMatchesParse() {
        String line = SheetTitle.format(LocalDate.of(2024, 2, 29), "Pull");

        assertThat(line).isEqualTo("2024-02-29 - Pull");
        assertThat(SheetTitle.parse(line).workoutName()).isEqualTo("Pull");
    }
}
