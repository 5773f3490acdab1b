package com.rodoc.ocr.service.ocr;

import java.util.Objects;

/**
 * Per-invocation recognition settings.
 *
 * @param language    Tesseract language selector, for example {@code ron+eng}
 * @param pageSegMode Tesseract page segmentation mode
 * @param whitelist   characters the engine may emit, {@code null} for no restriction
 * @param granularity level at which confidences are reported
 */
public record OcrRequest(String language, int pageSegMode, String whitelist, Granularity granularity) {

    public static final int PSM_SINGLE_BLOCK = 6;
    public static final int PSM_SINGLE_WORD = 8;

    public OcrRequest {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(granularity, "granularity");
        if (whitelist != null && whitelist.isEmpty()) {
            whitelist = null;
        }
    }

    public static OcrRequest of(String language, int pageSegMode) {
        return new OcrRequest(language, pageSegMode, null, Granularity.WORD);
    }

    public String describe() {
        return language + "/psm" + pageSegMode + (whitelist == null ? "" : "/whitelist");
    }

    public enum Granularity {
        WORD,
        SYMBOL
    }
}
