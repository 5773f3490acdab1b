package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.model.ExtractedField;
import java.util.List;
import java.util.Map;

/**
 * Mutable working set of one template extraction: the structured data map in insertion order, the
 * per-field records and the issues noticed on the way. Confined to a single call.
 */
public record FieldExtraction(Map<String, Object> structuredData, List<ExtractedField> fields, List<String> issues) {
}
