package com.rodoc.ocr.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RomanianTextTest {

    @Test
    void shouldReplaceCedillaFormsWithCommaBelow() {
        assertThat(RomanianText.standardizeDiacritics("Şoşea Ţării ãn")).isEqualTo("Șoșea Țării ăn");
    }

    @Test
    void shouldStripDiacriticsButKeepCase() {
        assertThat(RomanianText.stripDiacritics("ROMÂNIA Ștefănescu")).isEqualTo("ROMANIA Stefanescu");
    }

    @Test
    void shouldFoldToLowerCaseWithoutAccents() {
        assertThat(RomanianText.fold("HEMOGLOBINĂ")).isEqualTo("hemoglobina");
        assertThat(RomanianText.fold(null)).isEmpty();
    }

    @Test
    void shouldCapitalizeEveryWordAndHyphenatedPart() {
        assertThat(RomanianText.capitalizeWords("  ANA-MARIA   ȘTEFĂNESCU ")).isEqualTo("Ana-Maria Ștefănescu");
    }

    @Test
    void shouldDetectRomanianDiacritics() {
        assertThat(RomanianText.containsDiacritics("Glicemie crescută")).isTrue();
        assertThat(RomanianText.containsDiacritics("Glicemie crescuta")).isFalse();
    }
}
