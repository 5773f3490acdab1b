package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.service.registry.DocumentTemplate;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import com.rodoc.ocr.util.RomanianText;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the registry template that best explains a text. Templates are scored in registry order with
 * the hinted type moved to the front; the highest score that clears its template's threshold wins and
 * ties keep the earlier template.
 */
@Component
public class TemplateMatcher {

    private static final Logger log = LoggerFactory.getLogger(TemplateMatcher.class);

    static final int TERM_BONUS = 5;
    static final int TERM_BONUS_CAP = 20;

    private final TemplateRegistry registry;

    public TemplateMatcher(TemplateRegistry registry) {
        this.registry = registry;
    }

    public Optional<TemplateMatch> match(String text, String hintedType) {
        int termCount = registry.medicalTerms().findTerms(text).size();
        String stripped = RomanianText.stripDiacritics(text);
        TemplateMatch best = null;
        for (DocumentTemplate template : orderFor(hintedType)) {
            TemplateMatch candidate = score(stripped, termCount, template);
            log.debug("Template {} scored {} (threshold {})", template.id(), candidate.score(),
                    template.confidenceThreshold());
            if (candidate.clearsThreshold() && (best == null || candidate.score() > best.score())) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Scores a single template against raw recognized text.
     */
    public TemplateMatch score(String text, DocumentTemplate template) {
        int termCount = registry.medicalTerms().findTerms(text).size();
        return score(RomanianText.stripDiacritics(text), termCount, template);
    }

    private TemplateMatch score(String strippedText, int termCount, DocumentTemplate template) {
        List<String> matched = new ArrayList<>();
        List<Pattern> patterns = template.identificationPatterns();
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(strippedText).find()) {
                matched.add(template.identificationSources().get(i));
            }
        }
        double score = (double) matched.size() / patterns.size() * 100.0;
        if (template.medical()) {
            score += Math.min(termCount * TERM_BONUS, TERM_BONUS_CAP);
        }
        return new TemplateMatch(template, Math.min(score, 100.0), matched);
    }

    private List<DocumentTemplate> orderFor(String hintedType) {
        List<DocumentTemplate> all = registry.templates();
        if (hintedType == null) {
            return all;
        }
        List<DocumentTemplate> ordered = new ArrayList<>(all.size());
        for (DocumentTemplate template : all) {
            if (isHinted(template, hintedType)) {
                ordered.add(template);
            }
        }
        for (DocumentTemplate template : all) {
            if (!isHinted(template, hintedType)) {
                ordered.add(template);
            }
        }
        return ordered;
    }

    private static boolean isHinted(DocumentTemplate template, String hintedType) {
        return template.documentType().equals(hintedType) || template.id().equals(hintedType);
    }
}
