package com.example.workoutlog.application.parser;

import com.example.workoutlog.domain.model.ParseWarning;
import com.example.workoutlog.domain.model.WarningReason;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenValidatorTest {

    private final AnnotationParserProperties properties = new AnnotationParserProperties();
    private final TokenValidator validator = new TokenValidator(properties);

    @Test
    void acceptsUpToThreeDigits() {
        List<ParseWarning> warnings = new ArrayList<>();

        assertThat(validator.validate("0", "box", warnings)).isEqualTo(0);
        assertThat(validator.validate("25", "box", warnings)).isEqualTo(25);
        assertThat(validator.validate("315", "box", warnings)).isEqualTo(315);
        assertThat(warnings).isEmpty();
    }

    @Test
    void rejectsFourDigitsWithOneWarning() {
        List<ParseWarning> warnings = new ArrayList<>();

        Integer value = validator.validate("1234", "90# x 10, 1234", warnings);

        assertThat(value).isNull();
        assertThat(warnings).containsExactly(
                new ParseWarning("90# x 10, 1234", "1234", WarningReason.DIGITS_TOO_LONG));
    }

    @Test
    void honorsConfiguredDigitLimit() {
        properties.setMaxDigits(2);

        assertThat(validator.isTrustedLength("99")).isTrue();
        assertThat(validator.isTrustedLength("100")).isFalse();
    }
}
