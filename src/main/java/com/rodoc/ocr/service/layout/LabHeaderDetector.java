package com.rodoc.ocr.service.layout;

import com.rodoc.ocr.service.image.RawImage;

/**
 * Recognizes a laboratory report from its header layout alone. Implementations can be wired in through
 * Spring configuration to replace the default that never matches.
 */
public interface LabHeaderDetector {

    /**
     * @param image canonical page image
     * @return {@code true} when the page header looks like a laboratory report
     */
    boolean looksLikeLabHeader(RawImage image);
}
