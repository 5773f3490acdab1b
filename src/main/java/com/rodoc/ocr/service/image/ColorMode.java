package com.rodoc.ocr.service.image;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;

/**
 * Colour layout of a decoded input, kept for diagnostics. The canonical buffer is always {@link #RGB}.
 */
public enum ColorMode {
    RGB,
    RGBA,
    GRAY,
    PALETTE,
    OTHER;

    static ColorMode of(BufferedImage image) {
        switch (image.getType()) {
            case BufferedImage.TYPE_INT_RGB:
            case BufferedImage.TYPE_3BYTE_BGR:
            case BufferedImage.TYPE_INT_BGR:
                return RGB;
            case BufferedImage.TYPE_INT_ARGB:
            case BufferedImage.TYPE_INT_ARGB_PRE:
            case BufferedImage.TYPE_4BYTE_ABGR:
            case BufferedImage.TYPE_4BYTE_ABGR_PRE:
                return RGBA;
            case BufferedImage.TYPE_BYTE_GRAY:
            case BufferedImage.TYPE_USHORT_GRAY:
                return GRAY;
            case BufferedImage.TYPE_BYTE_BINARY:
            case BufferedImage.TYPE_BYTE_INDEXED:
                return PALETTE;
            default:
                if (image.getColorModel() instanceof IndexColorModel) {
                    return PALETTE;
                }
                return image.getColorModel().hasAlpha() ? RGBA : OTHER;
        }
    }
}
