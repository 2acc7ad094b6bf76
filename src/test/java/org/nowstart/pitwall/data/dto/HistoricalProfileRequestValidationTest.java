package org.nowstart.pitwall.data.dto;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HistoricalProfileRequestValidationTest {

    private ValidatorFactory validatorFactory;
    private Validator validator;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void nullSequenceCode_isRejected() {
        HistoricalProfileRequest profile = profileWith(Arrays.asList("SOFT", null));

        Set<ConstraintViolation<HistoricalProfileRequest>> violations = validator.validate(profile);

        assertThat(violations)
                .extracting(ConstraintViolation::getMessage)
                .containsExactly("sequence codes must not be blank");
    }

    @Test
    void blankSequenceCode_isRejected() {
        assertThat(validator.validate(profileWith(List.of("SOFT", "  ")))).hasSize(1);
    }

    @Test
    void wellFormedSequence_passes() {
        assertThat(validator.validate(profileWith(List.of("SOFT", "MEDIUM")))).isEmpty();
    }

    private static HistoricalProfileRequest profileWith(List<String> codes) {
        return new HistoricalProfileRequest(
                "monza",
                null,
                null,
                List.of(new HistoricalProfileRequest.StrategySequence(1, codes, 45.0, 20)),
                null
        );
    }
}
