package com.rodoc.ocr.service.registry;

import static org.assertj.core.api.Assertions.assertThat;

import com.rodoc.ocr.model.FieldValidation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FieldValidatorTest {

    @Nested
    @DisplayName("CNP")
    class Cnp {

        @Test
        void acceptsValidCnpAndTrimsIt() {
            FieldValidation result = FieldValidator.CNP.validate(" 1800101221144 ");

            assertThat(result.valid()).isTrue();
            assertThat(result.normalized()).isEqualTo("1800101221144");
            assertThat(result.error()).isNull();
        }

        @Test
        void rejectsChecksumMismatchWithoutNormalizedValue() {
            FieldValidation result = FieldValidator.CNP.validate("1800101221145");

            assertThat(result.valid()).isFalse();
            assertThat(result.error()).isEqualTo("Invalid CNP checksum");
            assertThat(result.normalized()).isNull();
        }
    }

    @Nested
    @DisplayName("NAME")
    class Name {

        @Test
        void capitalizesAndStandardizesDiacritics() {
            FieldValidation result = FieldValidator.NAME.validate("ŞTEFĂNESCU ANA-MARIA");

            assertThat(result.valid()).isTrue();
            assertThat(result.normalized()).isEqualTo("Ștefănescu Ana-Maria");
        }

        @Test
        void rejectsSingleLetter() {
            assertThat(FieldValidator.NAME.validate("A").error()).isEqualTo("Name too short");
        }

        @Test
        void rejectsDigitsAndSymbols() {
            assertThat(FieldValidator.NAME.validate("POP3SCU").error()).isEqualTo("Name contains invalid characters");
            assertThat(FieldValidator.NAME.validate("ION|").valid()).isFalse();
        }
    }

    @Nested
    @DisplayName("ADDRESS")
    class Address {

        @Test
        void acceptsFiveCharactersOrMore() {
            assertThat(FieldValidator.ADDRESS.validate("Str. Lalelelor 5").normalized()).isEqualTo("Str. Lalelelor 5");
        }

        @Test
        void rejectsShortAddress() {
            assertThat(FieldValidator.ADDRESS.validate(" Str ").error()).isEqualTo("Address too short");
        }
    }
}
