package com.rodoc.ocr.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.rodoc.ocr.model.Gender;
import com.rodoc.ocr.util.CnpValidator.CnpValidation;
import com.rodoc.ocr.util.CnpValidator.Reason;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CnpValidatorTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldAcceptKnownValidMaleCnp() {
        CnpValidation result = CnpValidator.validate("1800101221144", FIXED);

        assertThat(result.valid()).isTrue();
        assertThat(result.reason()).isNull();
        assertThat(result.birthDate()).isEqualTo(LocalDate.of(1980, 1, 1));
        assertThat(result.gender()).isEqualTo(Gender.M);
    }

    @Test
    void shouldAcceptKnownValidFemaleCnpFromTwoThousands() {
        CnpValidation result = CnpValidator.validate("6050315123453", FIXED);

        assertThat(result.valid()).isTrue();
        assertThat(result.birthDate()).isEqualTo(LocalDate.of(2005, 3, 15));
        assertThat(result.gender()).isEqualTo(Gender.F);
    }

    @Test
    void shouldRejectIncrementedControlDigitWithChecksumReason() {
        CnpValidation result = CnpValidator.validate("1800101221145", FIXED);

        assertThat(result.valid()).isFalse();
        assertThat(result.reasonCode()).isEqualTo("checksum");
        assertThat(result.birthDate()).isNull();
        assertThat(result.gender()).isNull();
    }

    @Test
    void shouldMapRemainderTenToControlDigitOne() {
        assertThat(CnpValidator.controlDigit("180010122111")).isEqualTo(1);
        assertThat(CnpValidator.validate("1800101221111", FIXED).valid()).isTrue();
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @ParameterizedTest
        @ValueSource(strings = {"", "180010122114", "18001012211440"})
        void rejectsWrongLength(String cnp) {
            assertThat(CnpValidator.validate(cnp, FIXED).reason()).isEqualTo(Reason.LENGTH);
        }

        @Test
        void rejectsNull() {
            assertThat(CnpValidator.validate(null, FIXED).reason()).isEqualTo(Reason.LENGTH);
        }

        @Test
        void rejectsNonDigits() {
            assertThat(CnpValidator.validate("18001012211A4", FIXED).reason()).isEqualTo(Reason.NON_DIGIT);
        }

        @Test
        void rejectsUnicodeDigits() {
            assertThat(CnpValidator.validate("١800101221144", FIXED).reason()).isEqualTo(Reason.NON_DIGIT);
        }

        @ParameterizedTest
        @ValueSource(strings = {"0800101221144", "7800101221144", "9800101221144"})
        void rejectsUnknownCenturyDigit(String cnp) {
            assertThat(CnpValidator.validate(cnp, FIXED).reason()).isEqualTo(Reason.CENTURY);
        }

        @Test
        void rejectsImpossibleCalendarDate() {
            assertThat(CnpValidator.validate("1800231221144", FIXED).reason()).isEqualTo(Reason.BIRTH_DATE);
        }

        @Test
        void rejectsBirthYearInTheFuture() {
            assertThat(CnpValidator.validate("5300101221144", FIXED).reason()).isEqualTo(Reason.BIRTH_YEAR);
        }
    }

    @Test
    void derivationHelpersOnlyAnswerForValidInput() {
        assertThat(CnpValidator.extractBirthDate("1800101221144")).contains(LocalDate.of(1980, 1, 1));
        assertThat(CnpValidator.extractGender("1800101221144")).contains(Gender.M);
        assertThat(CnpValidator.extractBirthDate("1800101221145")).isEmpty();
        assertThat(CnpValidator.extractGender("1800101221145")).isEmpty();
    }

    @Test
    void validityMatchesChecksumForEveryControlDigit() {
        String prefix = "280101221144";
        int expected = CnpValidator.controlDigit(prefix);
        for (int digit = 0; digit <= 9; digit++) {
            CnpValidation result = CnpValidator.validate(prefix + digit, FIXED);
            assertThat(result.valid()).as("control digit %d", digit).isEqualTo(digit == expected);
        }
    }
}
