package com.rodoc.ocr.service.image;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Canonical pixel buffer of one processing call: an RGB {@link BufferedImage} plus the colour mode the
 * input arrived in. Callers never receive the backing buffer; {@link #copy()} and {@link #crop} hand out
 * independent copies.
 */
public final class RawImage {

    private final BufferedImage pixels;
    private final ColorMode sourceMode;

    RawImage(BufferedImage pixels, ColorMode sourceMode) {
        if (pixels.getType() != BufferedImage.TYPE_INT_RGB) {
            throw new IllegalArgumentException("Canonical buffer must be TYPE_INT_RGB");
        }
        this.pixels = pixels;
        this.sourceMode = Objects.requireNonNull(sourceMode, "sourceMode");
    }

    public int width() {
        return pixels.getWidth();
    }

    public int height() {
        return pixels.getHeight();
    }

    public double aspectRatio() {
        return (double) width() / height();
    }

    public ColorMode sourceMode() {
        return sourceMode;
    }

    public BufferedImage copy() {
        return crop(new Rectangle(0, 0, width(), height()));
    }

    /**
     * Copies the pixels inside {@code area}, clipped to the image bounds.
     *
     * @throws IllegalArgumentException when the clipped area is empty
     */
    public BufferedImage crop(Rectangle area) {
        Rectangle clipped = area.intersection(new Rectangle(0, 0, width(), height()));
        if (clipped.isEmpty()) {
            throw new IllegalArgumentException("Crop area " + area + " lies outside the image");
        }
        BufferedImage out = new BufferedImage(clipped.width, clipped.height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        g.drawImage(pixels.getSubimage(clipped.x, clipped.y, clipped.width, clipped.height), 0, 0, null);
        g.dispose();
        return out;
    }

    /**
     * @return row-major luminance plane (0-255), ITU-R 601 weights
     */
    public int[] luminance() {
        int w = width();
        int h = height();
        int[] rgb = pixels.getRGB(0, 0, w, h, null, 0, w);
        int[] luma = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            luma[i] = ImageEnhancer.luminance(rgb[i]);
        }
        return luma;
    }
}
