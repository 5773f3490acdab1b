package com.rodoc.ocr.service.ocr;

import java.awt.image.BufferedImage;

/**
 * Seam to the external text-recognition capability.
 */
public interface OcrEngine {

    /**
     * Recognizes the text of one image.
     *
     * @param image    image to read; never modified
     * @param request  language, segmentation mode, whitelist and confidence granularity
     * @param deadline remaining time budget of the calling operation
     * @return recognized text and per-token confidences
     * @throws RecognitionException the engine ran but could not read this image
     * @throws com.rodoc.ocr.exception.OcrEngineUnavailableException the engine could not be invoked or
     *         ran past the deadline
     */
    OcrOutput recognize(BufferedImage image, OcrRequest request, Deadline deadline) throws RecognitionException;
}
