package com.rodoc.ocr.service.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.awt.image.RescaleOp;
import java.awt.image.WritableRaster;

/**
 * Java2D image operations applied before recognition. Every method returns a new image and leaves its
 * input untouched.
 */
public final class ImageEnhancer {

    private static final int AGGRESSIVE_MIN_DIMENSION = 1000;
    private static final float AGGRESSIVE_CONTRAST = 1.5f;
    private static final float SIMPLE_CONTRAST = 2.0f;

    private ImageEnhancer() {
    }

    /**
     * Full-page pipeline for noisy photos: upscale small pages, grayscale, auto-contrast, contrast boost
     * and sharpen.
     */
    public static BufferedImage aggressive(BufferedImage input) {
        BufferedImage scaled = input;
        int width = input.getWidth();
        int height = input.getHeight();
        if (width < AGGRESSIVE_MIN_DIMENSION || height < AGGRESSIVE_MIN_DIMENSION) {
            double factor = Math.max((double) AGGRESSIVE_MIN_DIMENSION / width, (double) AGGRESSIVE_MIN_DIMENSION / height);
            scaled = resize(input, (int) (width * factor), (int) (height * factor));
        }
        return sharpen(contrast(autocontrast(toGrayscale(scaled)), AGGRESSIVE_CONTRAST));
    }

    public static BufferedImage simple(BufferedImage input) {
        return contrast(toGrayscale(input), SIMPLE_CONTRAST);
    }

    public static BufferedImage toGrayscale(BufferedImage input) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        int width = input.getWidth();
        int height = input.getHeight();
        BufferedImage grayscale = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = grayscale.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                raster.setSample(x, y, 0, luminance(input.getRGB(x, y)));
            }
        }
        return grayscale;
    }

    /**
     * Moves every gray level away from the image mean by {@code factor}; 1 leaves the image unchanged.
     */
    public static BufferedImage contrast(BufferedImage gray, float factor) {
        int mean = (int) Math.round(mean(gray));
        RescaleOp rescaleOp = new RescaleOp(factor, mean * (1f - factor), null);
        return rescaleOp.filter(gray, null);
    }

    /**
     * Stretches the darkest gray level to 0 and the brightest to 255.
     */
    public static BufferedImage autocontrast(BufferedImage gray) {
        int[] histogram = histogram(gray);
        int lo = 0;
        while (lo < 255 && histogram[lo] == 0) {
            lo++;
        }
        int hi = 255;
        while (hi > 0 && histogram[hi] == 0) {
            hi--;
        }
        if (hi <= lo) {
            return copyGray(gray);
        }
        float scale = 255f / (hi - lo);
        RescaleOp rescaleOp = new RescaleOp(scale, -lo * scale, null);
        return rescaleOp.filter(gray, null);
    }

    public static BufferedImage sharpen(BufferedImage gray) {
        float[] sharpenKernel = new float[]{
                -2f / 16, -2f / 16, -2f / 16,
                -2f / 16, 32f / 16, -2f / 16,
                -2f / 16, -2f / 16, -2f / 16
        };
        ConvolveOp convolve = new ConvolveOp(new Kernel(3, 3, sharpenKernel), ConvolveOp.EDGE_NO_OP, null);
        BufferedImage destination = new BufferedImage(gray.getWidth(), gray.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        convolve.filter(gray, destination);
        return destination;
    }

    /**
     * Bicubic resize to exactly {@code width} x {@code height}.
     */
    public static BufferedImage resize(BufferedImage input, int width, int height) {
        int type = input.getType() == BufferedImage.TYPE_BYTE_GRAY ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_INT_RGB;
        BufferedImage resized = new BufferedImage(Math.max(1, width), Math.max(1, height), type);
        Graphics2D g = resized.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.drawImage(input, 0, 0, resized.getWidth(), resized.getHeight(), null);
        g.dispose();
        return resized;
    }

    static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (r * 299 + g * 587 + b * 114 + 500) / 1000;
    }

    private static double mean(BufferedImage gray) {
        int[] histogram = histogram(gray);
        long total = 0;
        long count = 0;
        for (int level = 0; level < histogram.length; level++) {
            total += (long) level * histogram[level];
            count += histogram[level];
        }
        return count == 0 ? 0.0 : (double) total / count;
    }

    private static int[] histogram(BufferedImage gray) {
        int[] histogram = new int[256];
        WritableRaster raster = gray.getRaster();
        for (int y = 0; y < gray.getHeight(); y++) {
            for (int x = 0; x < gray.getWidth(); x++) {
                histogram[raster.getSample(x, y, 0)]++;
            }
        }
        return histogram;
    }

    private static BufferedImage copyGray(BufferedImage gray) {
        BufferedImage copy = new BufferedImage(gray.getWidth(), gray.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        copy.setData(gray.getRaster());
        return copy;
    }
}
