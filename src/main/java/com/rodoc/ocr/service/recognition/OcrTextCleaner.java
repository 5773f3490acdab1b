package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.util.RomanianText;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Repairs recurring Tesseract misreads in Romanian documents before the text is scored or matched.
 */
@Component
public class OcrTextCleaner {

    private static final Map<Pattern, String> WORD_FIXES = new LinkedHashMap<>();
    private static final Pattern SPLIT_DIGITS = Pattern.compile("(\\d)[ \\t]+(?=\\d)");

    static {
        WORD_FIXES.put(word("CNF"), "CNP");
        WORD_FIXES.put(word("RESULTATE"), "REZULTATE");
        WORD_FIXES.put(word("LABDRATDR"), "LABORATOR");
        WORD_FIXES.put(word("HEMDGLDBINA"), "HEMOGLOBINĂ");
    }

    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = RomanianText.standardizeDiacritics(text);
        for (Map.Entry<Pattern, String> fix : WORD_FIXES.entrySet()) {
            cleaned = fix.getKey().matcher(cleaned).replaceAll(fix.getValue());
        }
        // digit groups split by horizontal whitespace; line breaks are kept
        return SPLIT_DIGITS.matcher(cleaned).replaceAll("$1");
    }

    private static Pattern word(String misread) {
        return Pattern.compile("\\b" + misread + "\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
