package com.rodoc.ocr.service.registry;

import com.rodoc.ocr.service.ocr.OcrRequest;

/**
 * Recognition settings of one card region: segmentation mode and character whitelist.
 */
public record RegionOcrConfig(int pageSegMode, String whitelist) {

    private static final String LETTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyzĂÎÂȘȚăîâșț";
    private static final String DIGITS = "0123456789";

    public static final RegionOcrConfig NAME = new RegionOcrConfig(OcrRequest.PSM_SINGLE_WORD, LETTERS);
    public static final RegionOcrConfig NUMERIC = new RegionOcrConfig(OcrRequest.PSM_SINGLE_WORD, DIGITS);
    public static final RegionOcrConfig ADDRESS = new RegionOcrConfig(OcrRequest.PSM_SINGLE_BLOCK, LETTERS + DIGITS + " .,-/");

    public OcrRequest toRequest(String language) {
        return new OcrRequest(language, pageSegMode, whitelist, OcrRequest.Granularity.SYMBOL);
    }
}
