package com.rodoc.ocr.service.registry;

import static com.rodoc.ocr.service.registry.ExtractionField.field;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Static catalog of Romanian document templates, identity-card region maps and medical vocabulary.
 * Built once and never modified, so any number of threads may read it.
 */
@Component
public class TemplateRegistry {

    private static final Logger log = LoggerFactory.getLogger(TemplateRegistry.class);

    public static final String IDENTITY_CARD_TYPE = "romanian_id";
    public static final String LAB_RESULT_TYPE = "lab_result";
    public static final String PRESCRIPTION_TYPE = "prescription";

    private static final String DATE = "(\\d{2}[.\\-/]\\d{2}[.\\-/]\\d{4})";
    private static final String UPPER_NAME = "([A-ZĂÂÎȘȚ][A-ZĂÂÎȘȚ \\t\\-]*)";

    private final List<DocumentTemplate> templates;
    private final Map<IdCardSubtype, RegionMap> regionMaps;
    private final MedicalTerms medicalTerms;

    public TemplateRegistry() {
        this.templates = List.of(identityCard(), labResults(), prescription());
        Map<IdCardSubtype, RegionMap> maps = new EnumMap<>(IdCardSubtype.class);
        maps.put(IdCardSubtype.STANDARD, standardCard());
        maps.put(IdCardSubtype.ELECTRONIC, electronicCard());
        maps.put(IdCardSubtype.LEGACY_BULLETIN, legacyBulletin());
        this.regionMaps = Collections.unmodifiableMap(maps);
        this.medicalTerms = new MedicalTerms();
        log.info("Template registry loaded {} templates and {} identity-card layouts",
                templates.size(), regionMaps.size());
    }

    public List<DocumentTemplate> templates() {
        return templates;
    }

    public Optional<DocumentTemplate> findById(String id) {
        return templates.stream().filter(template -> template.id().equals(id)).findFirst();
    }

    public Optional<DocumentTemplate> findByDocumentType(String documentType) {
        return templates.stream().filter(template -> template.documentType().equals(documentType)).findFirst();
    }

    public RegionMap regionMap(IdCardSubtype subtype) {
        return regionMaps.get(subtype);
    }

    /**
     * Region maps in search order: standard card, electronic card, legacy bulletin.
     */
    public List<RegionMap> regionMaps() {
        return List.of(
                regionMaps.get(IdCardSubtype.STANDARD),
                regionMaps.get(IdCardSubtype.ELECTRONIC),
                regionMaps.get(IdCardSubtype.LEGACY_BULLETIN));
    }

    public MedicalTerms medicalTerms() {
        return medicalTerms;
    }

    private static DocumentTemplate identityCard() {
        return new DocumentTemplate(
                "ro_identity_card",
                IDENTITY_CARD_TYPE,
                "romanian",
                70,
                List.of(
                        "ROMANIA|ROMÂNIA|ROUMANIE",
                        "CARTE DE IDENTITATE|CARTE D'IDENTITE",
                        "IDENTITY CARD",
                        "CNP[\\s:]*\\d{13}",
                        "SERIA(\\s+[A-Z]{2})?"),
                List.of(
                        field("nume").pattern("\\bNUME[:\\s]+" + UPPER_NAME).required().personName().build(),
                        field("prenume").pattern("\\bPRENUME[:\\s]+" + UPPER_NAME).required().personName().build(),
                        field("cnp").pattern("\\bCNP[\\s:]*(\\d{13})").validator(FieldValidator.CNP).required().build(),
                        field("data_nasterii")
                                .pattern("DATA NA[SȘŞ]TERII[:\\s]+" + DATE)
                                .pattern(DATE)
                                .required().build(),
                        field("seria").pattern("\\bSERIA\\s+([A-Z]{2})\\b").build(),
                        field("numar").pattern("\\bNR[.\\s]*(\\d+)").build(),
                        field("eliberata_de")
                                .pattern("ELIBERAT[AĂ] DE[:\\s]+([A-ZĂÂÎȘȚ][A-ZĂÂÎȘȚ \\t,.\\-]*)")
                                .pattern("ISSUED BY[:\\s]+([A-ZĂÂÎȘȚ][A-ZĂÂÎȘȚ \\t,.\\-]*)")
                                .build()),
                EnumSet.of(PostProcessingRule.NORMALIZE_NAMES,
                        PostProcessingRule.CNP_DATE_CONSISTENCY,
                        PostProcessingRule.GENDER_FROM_CNP));
    }

    private static DocumentTemplate labResults() {
        return new DocumentTemplate(
                "ro_lab_results",
                LAB_RESULT_TYPE,
                "romanian",
                65,
                List.of(
                        "LABORATOR|ANALIZE|REZULTATE",
                        "PACIENT|PATIENT",
                        "HEMOGLOBINĂ|GLICEMIE|COLESTEROL",
                        "NORMAL|PATOLOGIC|REFERINȚĂ",
                        "mg/dL|g/dL|μL|mmol/L"),
                List.of(
                        field("nume_pacient")
                                .pattern("\\bPACIENT[:\\s]+" + UPPER_NAME)
                                .pattern("\\bPATIENT[:\\s]+" + UPPER_NAME)
                                .pattern("\\bNUME[:\\s]+" + UPPER_NAME)
                                .required().personName().build(),
                        field("data_prelevare")
                                .pattern("DATA PRELEV[AĂ]RII?[:\\s]*" + DATE)
                                .pattern("DATA ANALIZEI[:\\s]*" + DATE)
                                .pattern(DATE)
                                .required().build(),
                        field("laborator")
                                .pattern("\\bLABORATOR[: \\t]+([A-ZĂÂÎȘȚ][A-ZĂÂÎȘȚ \\t.,\\-]*)")
                                .pattern("\\bLAB[: \\t]+([A-ZĂÂÎȘȚ][A-ZĂÂÎȘȚ \\t.,\\-]*)")
                                .build(),
                        field("medic")
                                .pattern("\\bDR[.\\s]+" + UPPER_NAME)
                                .pattern("\\bMEDIC[:\\s]+" + UPPER_NAME)
                                .personName().build()),
                EnumSet.of(PostProcessingRule.NORMALIZE_NAMES,
                        PostProcessingRule.EXTRACT_TEST_RESULTS,
                        PostProcessingRule.MEDICAL_TERM_ENRICHMENT));
    }

    private static DocumentTemplate prescription() {
        return new DocumentTemplate(
                "ro_prescription",
                PRESCRIPTION_TYPE,
                "romanian",
                60,
                List.of(
                        "REȚETĂ|PRESCRIPȚIE",
                        "MEDICAMENT|TRATAMENT",
                        "DOZA|ADMINISTRARE",
                        "DR\\.|MEDIC",
                        "PARACETAMOL|ASPIRIN|IBUPROFEN"),
                List.of(
                        field("nume_pacient")
                                .pattern("\\bPENTRU[:\\s]+" + UPPER_NAME)
                                .pattern("\\bPACIENT[:\\s]+" + UPPER_NAME)
                                .required().personName().build(),
                        field("data_prescriere").pattern("\\bDATA[:\\s]*" + DATE).required().build(),
                        field("medic_prescriptor")
                                .pattern("\\bDR[.\\s]+" + UPPER_NAME)
                                .pattern("\\bMEDIC[:\\s]+" + UPPER_NAME)
                                .required().personName().build()),
                EnumSet.of(PostProcessingRule.NORMALIZE_NAMES,
                        PostProcessingRule.EXTRACT_MEDICATIONS,
                        PostProcessingRule.MEDICAL_TERM_ENRICHMENT));
    }

    private static RegionMap standardCard() {
        return new RegionMap(IdCardSubtype.STANDARD, List.of(
                new FieldRegion("nume", new FractionalRect(0.305, 0.935, 0.365, 0.415), RegionOcrConfig.NAME, FieldValidator.NAME),
                new FieldRegion("prenume", new FractionalRect(0.305, 0.935, 0.463, 0.513), RegionOcrConfig.NAME, FieldValidator.NAME),
                new FieldRegion("cnp", new FractionalRect(0.305, 0.570, 0.267, 0.307), RegionOcrConfig.NUMERIC, FieldValidator.CNP),
                new FieldRegion("address", new FractionalRect(0.305, 0.935, 0.755, 0.855), RegionOcrConfig.ADDRESS, FieldValidator.ADDRESS)),
                new FractionalRect(0.035, 0.280, 0.155, 0.800));
    }

    private static RegionMap electronicCard() {
        return new RegionMap(IdCardSubtype.ELECTRONIC, List.of(
                new FieldRegion("nume", new FractionalRect(0.538, 0.938, 0.190, 0.240), RegionOcrConfig.NAME, FieldValidator.NAME),
                new FieldRegion("prenume", new FractionalRect(0.538, 0.938, 0.252, 0.340), RegionOcrConfig.NAME, FieldValidator.NAME),
                new FieldRegion("cnp", new FractionalRect(0.538, 0.845, 0.488, 0.538), RegionOcrConfig.NUMERIC, FieldValidator.CNP)),
                new FractionalRect(0.048, 0.485, 0.155, 0.590));
    }

    private static RegionMap legacyBulletin() {
        return new RegionMap(IdCardSubtype.LEGACY_BULLETIN, List.of(
                new FieldRegion("nume", new FractionalRect(0.251, 0.600, 0.360, 0.420), RegionOcrConfig.NAME, FieldValidator.NAME),
                new FieldRegion("prenume", new FractionalRect(0.251, 0.600, 0.440, 0.500), RegionOcrConfig.NAME, FieldValidator.NAME),
                new FieldRegion("address", new FractionalRect(0.620, 0.950, 0.360, 0.500), RegionOcrConfig.ADDRESS, FieldValidator.ADDRESS)),
                new FractionalRect(0.025, 0.225, 0.225, 0.665));
    }
}
