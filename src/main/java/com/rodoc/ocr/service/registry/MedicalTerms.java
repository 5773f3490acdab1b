package com.rodoc.ocr.service.registry;

import com.rodoc.ocr.util.RomanianText;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Romanian medical vocabulary: laboratory tests, units, reference qualifiers and common medications,
 * each mapped to a canonical English name. Lookups ignore case and diacritics.
 */
public final class MedicalTerms {

    private final Map<String, String> tests;
    private final Map<String, String> units;
    private final Map<String, String> referenceTerms;
    private final Map<String, String> medications;

    MedicalTerms() {
        Map<String, String> testTable = new LinkedHashMap<>();
        testTable.put("hemoglobină", "hemoglobin");
        testTable.put("hematocrit", "hematocrit");
        testTable.put("leucocite", "white_blood_cells");
        testTable.put("eritrocite", "red_blood_cells");
        testTable.put("trombocite", "platelets");
        testTable.put("glicemie", "blood_glucose");
        testTable.put("colesterol", "cholesterol");
        testTable.put("trigliceride", "triglycerides");
        testTable.put("creatinină", "creatinine");
        testTable.put("uree", "urea");
        testTable.put("bilirubină", "bilirubin");
        testTable.put("transaminaze", "transaminases");
        testTable.put("proteina c reactivă", "c_reactive_protein");
        testTable.put("viteza sedimentării", "erythrocyte_sedimentation_rate");
        this.tests = Collections.unmodifiableMap(testTable);

        Map<String, String> unitTable = new LinkedHashMap<>();
        unitTable.put("mg/dL", "milligrams per deciliter");
        unitTable.put("g/dL", "grams per deciliter");
        unitTable.put("μL", "microliters");
        unitTable.put("mmol/L", "millimoles per liter");
        unitTable.put("U/L", "units per liter");
        unitTable.put("ng/mL", "nanograms per milliliter");
        unitTable.put("μg/mL", "micrograms per milliliter");
        this.units = Collections.unmodifiableMap(unitTable);

        Map<String, String> referenceTable = new LinkedHashMap<>();
        referenceTable.put("normal", "normal");
        referenceTable.put("patologic", "abnormal");
        referenceTable.put("scăzut", "low");
        referenceTable.put("crescut", "high");
        referenceTable.put("în limite normale", "within_normal_limits");
        referenceTable.put("peste limita normală", "above_normal");
        referenceTable.put("sub limita normală", "below_normal");
        this.referenceTerms = Collections.unmodifiableMap(referenceTable);

        Map<String, String> medicationTable = new LinkedHashMap<>();
        medicationTable.put("paracetamol", "acetaminophen");
        medicationTable.put("ibuprofen", "ibuprofen");
        medicationTable.put("aspirin", "aspirin");
        medicationTable.put("amoxicilină", "amoxicillin");
        medicationTable.put("diclofenac", "diclofenac");
        medicationTable.put("metamizol", "metamizole");
        medicationTable.put("omeprazol", "omeprazole");
        medicationTable.put("enalapril", "enalapril");
        this.medications = Collections.unmodifiableMap(medicationTable);
    }

    /**
     * Test and medication terms occurring in {@code text}, tests first, each reported once in its
     * table spelling.
     */
    public List<String> findTerms(String text) {
        String folded = RomanianText.fold(text);
        List<String> found = new ArrayList<>();
        for (String term : tests.keySet()) {
            if (folded.contains(RomanianText.fold(term))) {
                found.add(term);
            }
        }
        for (String term : medications.keySet()) {
            if (folded.contains(RomanianText.fold(term))) {
                found.add(term);
            }
        }
        return found;
    }

    public boolean isTest(String term) {
        return tests.containsKey(term);
    }

    public boolean isMedication(String term) {
        return medications.containsKey(term);
    }

    /**
     * Canonical name of a test label; unknown labels become lower-case with underscores.
     */
    public String normalizeTestName(String label) {
        String folded = RomanianText.fold(label).trim();
        return lookup(tests, folded)
                .orElseGet(() -> label.trim().toLowerCase(RomanianText.ROMANIAN).replace(' ', '_'));
    }

    public Optional<String> normalizeMedication(String token) {
        return lookup(medications, RomanianText.fold(token));
    }

    /**
     * Units from the unit table that occur verbatim in {@code text}.
     */
    public List<String> findUnits(String text) {
        List<String> found = new ArrayList<>();
        if (text == null) {
            return found;
        }
        for (String unit : units.keySet()) {
            if (text.contains(unit)) {
                found.add(unit);
            }
        }
        return found;
    }

    /**
     * Canonical meanings of the reference qualifiers ({@code normal}, {@code crescut}, ...) in
     * {@code text}.
     */
    public List<String> findReferenceQualifiers(String text) {
        String folded = RomanianText.fold(text);
        List<String> found = new ArrayList<>();
        for (Map.Entry<String, String> entry : referenceTerms.entrySet()) {
            if (folded.contains(RomanianText.fold(entry.getKey())) && !found.contains(entry.getValue())) {
                found.add(entry.getValue());
            }
        }
        return found;
    }

    private static Optional<String> lookup(Map<String, String> table, String foldedText) {
        for (Map.Entry<String, String> entry : table.entrySet()) {
            if (foldedText.contains(RomanianText.fold(entry.getKey()))) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
