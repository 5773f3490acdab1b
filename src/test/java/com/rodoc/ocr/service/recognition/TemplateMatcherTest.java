package com.rodoc.ocr.service.recognition;

import static org.assertj.core.api.Assertions.assertThat;

import com.rodoc.ocr.service.registry.DocumentTemplate;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import com.rodoc.ocr.util.RomanianText;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TemplateMatcherTest {

    static final String ID_CARD_TEXT = "ROMANIA\nCARTE DE IDENTITATE\nIDENTITY CARD\nSERIA RX NR 123456\n"
            + "CNP 1800101221144";
    static final String LAB_TEXT = "LABORATOR CENTRAL\nPACIENT: ION POPESCU\nHEMOGLOBINĂ 14 g/dL\nNORMAL";
    static final String PRESCRIPTION_TEXT = "REȚETĂ MEDICALĂ\nTRATAMENT\nDOZA: 1 comprimat\nDR. IONESCU\nPARACETAMOL 500 mg";

    static final Map<String, String> SAMPLE_BY_TEMPLATE = Map.of(
            "ro_identity_card", ID_CARD_TEXT,
            "ro_lab_results", LAB_TEXT,
            "ro_prescription", PRESCRIPTION_TEXT);

    private final TemplateRegistry registry = new TemplateRegistry();
    private final TemplateMatcher matcher = new TemplateMatcher(registry);

    @ParameterizedTest
    @ValueSource(strings = {"ro_identity_card", "ro_lab_results", "ro_prescription"})
    void sampleTextMatchesOnlyItsOwnTemplate(String templateId) {
        String text = SAMPLE_BY_TEMPLATE.get(templateId);
        String stripped = RomanianText.stripDiacritics(text);

        for (DocumentTemplate other : registry.templates()) {
            if (other.id().equals(templateId)) {
                continue;
            }
            for (Pattern pattern : other.identificationPatterns()) {
                assertThat(pattern.matcher(stripped).find())
                        .as("%s pattern %s on %s sample", other.id(), pattern.pattern(), templateId)
                        .isFalse();
            }
        }
        assertThat(matcher.match(text, null)).map(m -> m.template().id()).contains(templateId);
    }

    @Nested
    @DisplayName("selects the template whose identification patterns all match")
    class Selection {

        @Test
        void identityCard() {
            TemplateMatch match = matcher.match(ID_CARD_TEXT, null).orElseThrow();

            assertThat(match.template().id()).isEqualTo("ro_identity_card");
            assertThat(match.score()).isEqualTo(100.0);
        }

        @Test
        void labResults() {
            TemplateMatch match = matcher.match(LAB_TEXT, null).orElseThrow();

            assertThat(match.template().id()).isEqualTo("ro_lab_results");
            assertThat(match.matchedPatterns()).hasSize(5);
        }

        @Test
        void prescription() {
            assertThat(matcher.match(PRESCRIPTION_TEXT, null))
                    .map(m -> m.template().id())
                    .contains("ro_prescription");
        }
    }

    @Test
    void matchingIsIdempotent() {
        TemplateMatch first = matcher.match(LAB_TEXT, "lab_result").orElseThrow();
        TemplateMatch second = matcher.match(LAB_TEXT, "lab_result").orElseThrow();

        assertThat(second.template()).isSameAs(first.template());
        assertThat(second.score()).isEqualTo(first.score());
        assertThat(second.matchedPatterns()).isEqualTo(first.matchedPatterns());
    }

    @Test
    void returnsEmptyWhenNoTemplateClearsItsThreshold() {
        assertThat(matcher.match("lorem ipsum dolor sit amet", null)).isEmpty();
    }

    @Test
    void addsMedicalTermBonusOnlyToMedicalTemplates() {
        String text = "LABORATOR ANALIZE\nREZULTATE\nHemoglobina: 14.2 g/dL (12-16)";

        TemplateMatch lab = matcher.match(text, null).orElseThrow();

        // 3 of 5 patterns plus one recognized term
        assertThat(lab.template().id()).isEqualTo("ro_lab_results");
        assertThat(lab.score()).isEqualTo(65.0);
    }

    @Test
    void tiesFavorTheHintedTemplate() {
        String text = "LABORATOR\nPACIENT: ION POPESCU\nREȚETĂ\nTRATAMENT\nDOZA 10 mg/dL NORMAL\nDR. IONESCU";

        Optional<TemplateMatch> unhinted = matcher.match(text, null);
        Optional<TemplateMatch> hinted = matcher.match(text, "prescription");

        assertThat(unhinted).map(m -> m.template().id()).contains("ro_lab_results");
        assertThat(hinted).map(m -> m.template().id()).contains("ro_prescription");
        assertThat(hinted.get().score()).isEqualTo(unhinted.get().score());
    }
}
