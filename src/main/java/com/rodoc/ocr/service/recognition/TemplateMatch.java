package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.service.registry.DocumentTemplate;
import java.util.List;

/**
 * Score of one template against recognized text.
 *
 * @param template        scored template
 * @param score           0-100, pattern ratio plus the medical-term bonus
 * @param matchedPatterns identification patterns that matched, as declared
 */
public record TemplateMatch(DocumentTemplate template, double score, List<String> matchedPatterns) {

    public TemplateMatch {
        matchedPatterns = List.copyOf(matchedPatterns);
    }

    public boolean clearsThreshold() {
        return score >= template.confidenceThreshold();
    }
}
