package com.rodoc.ocr.service.layout;

import com.rodoc.ocr.service.image.RawImage;

/**
 * Default detector: never claims a lab header, so non-card pages fall through to text-based matching.
 */
public class NoOpLabHeaderDetector implements LabHeaderDetector {

    @Override
    public boolean looksLikeLabHeader(RawImage image) {
        return false;
    }
}
