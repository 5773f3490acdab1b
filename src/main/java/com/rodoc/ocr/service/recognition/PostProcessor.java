package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.model.ExtractedField;
import com.rodoc.ocr.model.FieldValidation;
import com.rodoc.ocr.model.Gender;
import com.rodoc.ocr.service.registry.DocumentTemplate;
import com.rodoc.ocr.service.registry.ExtractionField;
import com.rodoc.ocr.service.registry.PostProcessingRule;
import com.rodoc.ocr.util.CnpValidator;
import com.rodoc.ocr.util.RomanianText;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Template-keyed clean-up of extracted fields: name capitalization, CNP/birth-date consistency and
 * gender derivation.
 */
@Component
public class PostProcessor {

    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{2})[.\\-/](\\d{2})[.\\-/](\\d{4})");
    private static final Pattern YEAR_FIRST = Pattern.compile("(\\d{4})[.\\-/](\\d{2})[.\\-/](\\d{2})");

    public void apply(DocumentTemplate template, FieldExtraction extraction) {
        Map<String, Object> data = extraction.structuredData();
        if (template.hasRule(PostProcessingRule.NORMALIZE_NAMES)) {
            for (ExtractionField field : template.fields()) {
                if (field.personName() && data.get(field.name()) instanceof String) {
                    String normalized = RomanianText.capitalizeWords((String) data.get(field.name()));
                    data.put(field.name(), normalized);
                    replaceNormalized(extraction.fields(), field.name(), normalized);
                }
            }
        }
        Object cnp = data.get("cnp");
        if (template.hasRule(PostProcessingRule.CNP_DATE_CONSISTENCY)
                && cnp instanceof String && data.get("data_nasterii") instanceof String) {
            boolean consistent = isConsistent((String) cnp, (String) data.get("data_nasterii"));
            data.put("cnp_date_consistent", consistent);
            if (!consistent) {
                extraction.issues().add("cnp_birth_date_mismatch");
            }
        }
        if (template.hasRule(PostProcessingRule.GENDER_FROM_CNP) && cnp instanceof String) {
            Optional<Gender> gender = CnpValidator.extractGender((String) cnp);
            gender.ifPresent(value -> data.put("gender", value.name()));
        }
    }

    static boolean isConsistent(String cnp, String birthDate) {
        Optional<LocalDate> encoded = CnpValidator.extractBirthDate(cnp);
        Optional<LocalDate> printed = parseDate(birthDate);
        return encoded.isPresent() && encoded.equals(printed);
    }

    /**
     * Parses {@code DD.MM.YYYY} or {@code YYYY.MM.DD} with any of {@code . - /} as separator.
     */
    static Optional<LocalDate> parseDate(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            Matcher dayFirst = DAY_FIRST.matcher(trimmed);
            if (dayFirst.matches()) {
                return Optional.of(LocalDate.of(Integer.parseInt(dayFirst.group(3)),
                        Integer.parseInt(dayFirst.group(2)), Integer.parseInt(dayFirst.group(1))));
            }
            Matcher yearFirst = YEAR_FIRST.matcher(trimmed);
            if (yearFirst.matches()) {
                return Optional.of(LocalDate.of(Integer.parseInt(yearFirst.group(1)),
                        Integer.parseInt(yearFirst.group(2)), Integer.parseInt(yearFirst.group(3))));
            }
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static void replaceNormalized(List<ExtractedField> fields, String name, String normalized) {
        for (int i = 0; i < fields.size(); i++) {
            ExtractedField field = fields.get(i);
            if (field.name().equals(name) && field.valid()) {
                fields.set(i, new ExtractedField(name, field.rawText(), field.confidence(),
                        FieldValidation.accepted(normalized)));
            }
        }
    }
}
