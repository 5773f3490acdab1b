package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.config.RodocProperties.OcrProperties;
import com.rodoc.ocr.service.image.ImageEnhancer;
import com.rodoc.ocr.service.ocr.OcrRequest;
import java.awt.image.BufferedImage;

/**
 * Full-page recognition strategies, in the order they are attempted.
 */
public enum RecognitionStrategy {

    AGGRESSIVE_COMBINED("aggressive_preprocessing", OcrRequest.PSM_SINGLE_BLOCK) {
        @Override
        BufferedImage preprocess(BufferedImage page) {
            return ImageEnhancer.aggressive(page);
        }

        @Override
        String language(OcrProperties ocr) {
            return ocr.languages();
        }
    },

    SIMPLE_SINGLE_WORD("simple_preprocessing", OcrRequest.PSM_SINGLE_WORD) {
        @Override
        BufferedImage preprocess(BufferedImage page) {
            return ImageEnhancer.simple(page);
        }

        @Override
        String language(OcrProperties ocr) {
            return ocr.languages();
        }
    },

    SIMPLE_FALLBACK_LANGUAGE("fallback_language", OcrRequest.PSM_SINGLE_BLOCK) {
        @Override
        BufferedImage preprocess(BufferedImage page) {
            return ImageEnhancer.simple(page);
        }

        @Override
        String language(OcrProperties ocr) {
            return ocr.fallbackLanguage();
        }
    };

    private final String label;
    private final int pageSegMode;

    RecognitionStrategy(String label, int pageSegMode) {
        this.label = label;
        this.pageSegMode = pageSegMode;
    }

    public String label() {
        return label;
    }

    abstract BufferedImage preprocess(BufferedImage page);

    abstract String language(OcrProperties ocr);

    OcrRequest request(OcrProperties ocr) {
        return OcrRequest.of(language(ocr), pageSegMode);
    }
}
