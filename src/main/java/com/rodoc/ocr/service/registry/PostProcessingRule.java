package com.rodoc.ocr.service.registry;

/**
 * Template-keyed steps run after regex extraction.
 */
public enum PostProcessingRule {
    /** Per-word capitalization of person-name fields. */
    NORMALIZE_NAMES,
    /** Compares the birth date encoded in a valid CNP with the extracted birth date. */
    CNP_DATE_CONSISTENCY,
    /** Derives {@code gender} from a valid CNP. */
    GENDER_FROM_CNP,
    /** Scans result lines into {@code test_results}. */
    EXTRACT_TEST_RESULTS,
    /** Scans medication tokens into {@code medications}. */
    EXTRACT_MEDICATIONS,
    /** Adds the medical terms found and the lab/medication flags. */
    MEDICAL_TERM_ENRICHMENT
}
