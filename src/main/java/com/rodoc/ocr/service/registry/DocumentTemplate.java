package com.rodoc.ocr.service.registry;

import com.rodoc.ocr.util.RomanianText;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * How one document category is recognized and parsed. Identification patterns are matched
 * case-insensitively against text with its diacritics stripped, so OCR output that lost or gained
 * accents still counts.
 */
public final class DocumentTemplate {

    private final String id;
    private final String documentType;
    private final String language;
    private final int confidenceThreshold;
    private final List<String> identificationSources;
    private final List<Pattern> identificationPatterns;
    private final List<ExtractionField> fields;
    private final Set<PostProcessingRule> rules;

    DocumentTemplate(String id, String documentType, String language, int confidenceThreshold,
                     List<String> identificationSources, List<ExtractionField> fields, Set<PostProcessingRule> rules) {
        if (confidenceThreshold < 0 || confidenceThreshold > 100) {
            throw new IllegalArgumentException("Confidence threshold must be within [0, 100]: " + confidenceThreshold);
        }
        if (identificationSources.isEmpty()) {
            throw new IllegalArgumentException("Template " + id + " declares no identification pattern");
        }
        this.id = Objects.requireNonNull(id, "id");
        this.documentType = Objects.requireNonNull(documentType, "documentType");
        this.language = language;
        this.confidenceThreshold = confidenceThreshold;
        this.identificationSources = List.copyOf(identificationSources);
        List<Pattern> compiled = new ArrayList<>(identificationSources.size());
        for (String source : identificationSources) {
            compiled.add(Pattern.compile(RomanianText.stripDiacritics(source),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        this.identificationPatterns = Collections.unmodifiableList(compiled);
        this.fields = List.copyOf(fields);
        this.rules = rules.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(rules));
    }

    public String id() {
        return id;
    }

    public String documentType() {
        return documentType;
    }

    public String language() {
        return language;
    }

    public int confidenceThreshold() {
        return confidenceThreshold;
    }

    /**
     * @return identification patterns as declared, parallel to {@link #identificationPatterns()}
     */
    public List<String> identificationSources() {
        return identificationSources;
    }

    public List<Pattern> identificationPatterns() {
        return identificationPatterns;
    }

    public List<ExtractionField> fields() {
        return fields;
    }

    public boolean hasRule(PostProcessingRule rule) {
        return rules.contains(rule);
    }

    public Set<PostProcessingRule> rules() {
        return rules;
    }

    /**
     * Whether matched medical terms raise this template's score.
     */
    public boolean medical() {
        return rules.contains(PostProcessingRule.MEDICAL_TERM_ENRICHMENT);
    }

    @Override
    public String toString() {
        return "DocumentTemplate[" + id + ", " + documentType + ", threshold=" + confidenceThreshold + "]";
    }
}
