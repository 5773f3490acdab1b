package com.rodoc.ocr.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one processing call.
 *
 * @param rawText            recognized full text; empty on the region-based path
 * @param matchedTemplateId  id of the registry template that matched, or {@code null}
 * @param documentType       document type tag, {@code unknown} when no template matched
 * @param overallConfidence  bounded confidence on a 0-100 scale
 * @param structuredData     field name to value or nested structure, insertion ordered
 * @param fields             per-field extraction records
 * @param processingMetadata diagnostics about how the result was produced
 */
public record ProcessingResult(
        String rawText,
        String matchedTemplateId,
        String documentType,
        int overallConfidence,
        Map<String, Object> structuredData,
        List<ExtractedField> fields,
        Map<String, Object> processingMetadata) {

    public static final String UNKNOWN_TYPE = "unknown";

    public ProcessingResult {
        if (overallConfidence < 0 || overallConfidence > 100) {
            throw new IllegalArgumentException("Overall confidence must be within [0, 100]: " + overallConfidence);
        }
        rawText = rawText == null ? "" : rawText;
        documentType = documentType == null ? UNKNOWN_TYPE : documentType;
        structuredData = freeze(structuredData);
        fields = fields == null ? List.of() : List.copyOf(fields);
        processingMetadata = freeze(processingMetadata);
    }

    public boolean templateMatched() {
        return matchedTemplateId != null;
    }

    /**
     * Copy of this result with {@code extra} entries added to the processing metadata; existing keys
     * are overwritten.
     */
    public ProcessingResult withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(processingMetadata);
        merged.putAll(extra);
        return new ProcessingResult(rawText, matchedTemplateId, documentType, overallConfidence,
                structuredData, fields, merged);
    }

    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
