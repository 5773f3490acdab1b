package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.util.RomanianText;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Heuristic 0-100 score of recognized text: longer text, domain keywords and Romanian diacritics raise
 * it, a high share of stray symbols lowers it.
 */
@Component
public class TextQualityEstimator {

    static final List<String> DOMAIN_KEYWORDS = List.of(
            "pacient", "patient", "data", "date", "laborator", "laboratory",
            "rezultate", "results", "normal", "analize", "test", "medic",
            "doctor", "spital", "hospital", "diagnostic", "diagnosis");

    private static final String PLAIN_PUNCTUATION = " \n\t.,:-()";

    public int estimate(String text) {
        if (text == null || text.length() < 5) {
            return 0;
        }
        int score = 50;
        if (text.length() > 100) {
            score += 10;
        }
        String lower = text.toLowerCase(RomanianText.ROMANIAN);
        for (String keyword : DOMAIN_KEYWORDS) {
            if (lower.contains(keyword)) {
                score += 5;
            }
        }
        if (specialCharacterRatio(text) > 0.3) {
            score -= 20;
        }
        if (RomanianText.containsDiacritics(text)) {
            score += 10;
        }
        return Math.min(100, Math.max(0, score));
    }

    static double specialCharacterRatio(String text) {
        int special = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetterOrDigit(c) && PLAIN_PUNCTUATION.indexOf(c) < 0) {
                special++;
            }
        }
        return (double) special / text.length();
    }
}
