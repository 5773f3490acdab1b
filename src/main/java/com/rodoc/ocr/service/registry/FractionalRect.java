package com.rodoc.ocr.service.registry;

import java.awt.Rectangle;

/**
 * Resolution-independent rectangle; every coordinate is a fraction of the card width or height.
 */
public record FractionalRect(double xStart, double xEnd, double yStart, double yEnd) {

    public FractionalRect {
        requireFraction("xStart", xStart);
        requireFraction("xEnd", xEnd);
        requireFraction("yStart", yStart);
        requireFraction("yEnd", yEnd);
        if (xStart >= xEnd || yStart >= yEnd) {
            throw new IllegalArgumentException("Fractional rectangle must have positive extent");
        }
    }

    /**
     * Pixel rectangle for an image of the given size; coordinates are truncated toward zero.
     */
    public Rectangle toPixels(int width, int height) {
        int x1 = (int) (xStart * width);
        int x2 = (int) (xEnd * width);
        int y1 = (int) (yStart * height);
        int y2 = (int) (yEnd * height);
        return new Rectangle(x1, y1, x2 - x1, y2 - y1);
    }

    private static void requireFraction(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
        }
    }
}
