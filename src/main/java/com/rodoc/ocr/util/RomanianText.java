package com.rodoc.ocr.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text helpers aware of the Romanian alphabet (ă, â, î, ș, ț and their legacy cedilla forms).
 */
public final class RomanianText {

    public static final Locale ROMANIAN = Locale.forLanguageTag("ro-RO");

    /**
     * Letters accepted in personal names: Latin letters plus Romanian diacritics.
     */
    public static final String NAME_LETTERS = "A-Za-zĂÂÎȘȚăâîșțŞŢşţ";

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String DIACRITICS = "ăâîșțĂÂÎȘȚşţŞŢ";

    private RomanianText() {
    }

    /**
     * Replaces the legacy cedilla letters (ş, ţ) and the common {@code ã} misread with the standard
     * comma-below forms.
     */
    public static String standardizeDiacritics(String text) {
        if (text == null) {
            return null;
        }
        return text
                .replace('ş', 'ș')
                .replace('Ş', 'Ș')
                .replace('ţ', 'ț')
                .replace('Ţ', 'Ț')
                .replace('ã', 'ă')
                .replace('Ã', 'Ă');
    }

    /**
     * Strips every diacritic and keeps letter case ({@code ROMÂNIA} becomes {@code ROMANIA}).
     */
    public static String stripDiacritics(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return Normalizer.normalize(COMBINING_MARKS.matcher(decomposed).replaceAll(""), Normalizer.Form.NFC);
    }

    /**
     * Lower-cases and strips every diacritic, for lookups that must tolerate OCR dropping accents.
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        return stripDiacritics(text.toLowerCase(ROMANIAN));
    }

    public static boolean containsDiacritics(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (DIACRITICS.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Capitalizes the first letter of every whitespace-separated token and lower-cases the rest,
     * collapsing runs of whitespace. Hyphenated parts keep their own capital ({@code ANA-MARIA} becomes
     * {@code Ana-Maria}).
     */
    public static String capitalizeWords(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(trimmed.length());
        for (String word : WHITESPACE.split(trimmed)) {
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(capitalizeHyphenated(word));
        }
        return out.toString();
    }

    private static String capitalizeHyphenated(String word) {
        String[] parts = word.split("-", -1);
        StringBuilder out = new StringBuilder(word.length());
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                out.append('-');
            }
            String part = parts[i];
            if (!part.isEmpty()) {
                out.append(part.substring(0, 1).toUpperCase(ROMANIAN))
                        .append(part.substring(1).toLowerCase(ROMANIAN));
            }
        }
        return out.toString();
    }
}
