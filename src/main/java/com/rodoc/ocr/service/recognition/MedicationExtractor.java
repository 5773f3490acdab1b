package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.model.Medication;
import com.rodoc.ocr.service.registry.MedicalTerms;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds medication mentions in prescription text: a capitalized word followed by an optional dosage
 * and pack quantity. A word counts when it is a known medication or carries a dosage.
 */
@Component
public class MedicationExtractor {

    private static final Pattern MEDICATION = Pattern.compile(
            "(?<name>[A-ZĂÂÎȘȚ][A-Za-zĂÂÎȘȚăâîșț]+)"
                    + "(?:[ \\t]*(?<dosage>\\d+(?:[.,]\\d+)?[ \\t]*(?:mg|mcg|ml|g)\\b))?"
                    + "(?:[ \\t]*(?<quantity>\\d+)[ \\t]*(?:tablete|capsule|comprimate|fiole|plicuri))?");

    private final MedicalTerms medicalTerms;

    public MedicationExtractor(TemplateRegistry registry) {
        this.medicalTerms = registry.medicalTerms();
    }

    public List<Medication> extract(String text) {
        List<Medication> medications = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return medications;
        }
        Matcher matcher = MEDICATION.matcher(text);
        while (matcher.find()) {
            String name = matcher.group("name");
            String dosage = matcher.group("dosage") == null ? "" : matcher.group("dosage").trim();
            String quantity = matcher.group("quantity") == null ? "" : matcher.group("quantity");
            Optional<String> normalized = medicalTerms.normalizeMedication(name);
            if (normalized.isEmpty() && dosage.isEmpty()) {
                continue;
            }
            medications.add(new Medication(name, normalized.orElse(null), dosage, quantity, normalized.isPresent()));
        }
        return medications;
    }
}
