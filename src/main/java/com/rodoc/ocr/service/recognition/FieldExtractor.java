package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.model.ExtractedField;
import com.rodoc.ocr.model.FieldValidation;
import com.rodoc.ocr.service.registry.DocumentTemplate;
import com.rodoc.ocr.service.registry.ExtractionField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies a template's regex fields to recognized text. A validated field is stored under its name
 * with {@code <name>_valid=true}; a rejected one only as {@code <name>_error} and
 * {@code <name>_valid=false}, so an invalid value never appears under the plain field name.
 */
@Component
public class FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    public FieldExtraction extract(String text, DocumentTemplate template, double confidence) {
        FieldExtraction extraction = new FieldExtraction(new LinkedHashMap<>(), new ArrayList<>(), new ArrayList<>());
        for (ExtractionField field : template.fields()) {
            Optional<String> candidate = firstMatch(text, field);
            if (candidate.isEmpty()) {
                if (field.required()) {
                    extraction.issues().add("missing_required_field:" + field.name());
                }
                continue;
            }
            String value = candidate.get();
            if (field.validator() == null) {
                extraction.structuredData().put(field.name(), value);
                extraction.fields().add(new ExtractedField(field.name(), value, confidence, FieldValidation.accepted(value)));
                continue;
            }
            FieldValidation validation = field.validator().validate(value);
            if (validation.valid()) {
                extraction.structuredData().put(field.name(), validation.normalized());
                extraction.structuredData().put(field.name() + "_valid", true);
            } else {
                log.debug("Field {} rejected: {}", field.name(), validation.error());
                extraction.structuredData().put(field.name() + "_error", validation.error());
                extraction.structuredData().put(field.name() + "_valid", false);
                extraction.issues().add("validation_error:" + field.name());
            }
            extraction.fields().add(new ExtractedField(field.name(), value, confidence, validation));
        }
        return extraction;
    }

    static Optional<String> firstMatch(String text, ExtractionField field) {
        for (Pattern pattern : field.patterns()) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String value = matcher.group(1);
                if (value != null && !value.isBlank()) {
                    return Optional.of(value.trim());
                }
            }
        }
        return Optional.empty();
    }
}
