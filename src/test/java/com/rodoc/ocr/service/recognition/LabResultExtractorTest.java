package com.rodoc.ocr.service.recognition;

import static org.assertj.core.api.Assertions.assertThat;

import com.rodoc.ocr.model.LabTestResult;
import com.rodoc.ocr.model.LabTestResult.Status;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;

class LabResultExtractorTest {

    private final LabResultExtractor extractor = new LabResultExtractor(new TemplateRegistry());

    @Test
    void readsValueUnitRangeAndStatus() {
        List<LabTestResult> results = extractor.extract("LABORATOR ANALIZE\nREZULTATE\nHemoglobina: 14.2 g/dL (12-16)");

        assertThat(results).hasSize(1);
        LabTestResult hemoglobin = results.get(0);
        assertThat(hemoglobin.testName()).isEqualTo("Hemoglobina");
        assertThat(hemoglobin.normalizedName()).isEqualTo("hemoglobin");
        assertThat(hemoglobin.value()).isEqualTo("14.2");
        assertThat(hemoglobin.unit()).isEqualTo("g/dL");
        assertThat(hemoglobin.referenceMin()).isEqualTo("12");
        assertThat(hemoglobin.referenceMax()).isEqualTo("16");
        assertThat(hemoglobin.status()).isEqualTo(Status.NORMAL);
    }

    @Test
    void normalizesDecimalCommasAndClassifiesEveryLine() {
        List<LabTestResult> results = extractor.extract(
                "Glicemie 132,5 mg/dL (70 - 110)\nColesterol: 180 mg/dL\nHematocrit 30 % (36-46)");

        assertThat(results).extracting(LabTestResult::normalizedName)
                .containsExactly("blood_glucose", "cholesterol", "hematocrit");
        assertThat(results).extracting(LabTestResult::value).containsExactly("132.5", "180", "30");
        assertThat(results).extracting(LabTestResult::status)
                .containsExactly(Status.HIGH, Status.UNKNOWN, Status.LOW);
        assertThat(results.get(1).referenceMin()).isNull();
    }

    @Test
    void statusIsUnknownWithoutRange() {
        assertThat(LabResultExtractor.status("5", null, null)).isEqualTo(Status.UNKNOWN);
        assertThat(LabResultExtractor.status("5", "1", "5")).isEqualTo(Status.NORMAL);
    }

    @Test
    void returnsNothingForEmptyText() {
        assertThat(extractor.extract("")).isEmpty();
    }
}
