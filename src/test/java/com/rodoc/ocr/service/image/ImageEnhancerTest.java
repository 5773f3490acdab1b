package com.rodoc.ocr.service.image;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;

class ImageEnhancerTest {

    @Test
    void convertsToGrayscaleWithItuWeights() {
        BufferedImage red = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        red.setRGB(0, 0, 0xFF0000);

        BufferedImage gray = ImageEnhancer.toGrayscale(red);

        assertThat(gray.getType()).isEqualTo(BufferedImage.TYPE_BYTE_GRAY);
        assertThat(gray.getRaster().getSample(0, 0, 0)).isEqualTo(76);
        assertThat(ImageEnhancer.luminance(0xFFFFFF)).isEqualTo(255);
    }

    @Test
    void autocontrastStretchesToFullRange() {
        BufferedImage gray = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_GRAY);
        gray.getRaster().setSample(0, 0, 0, 100);
        gray.getRaster().setSample(1, 0, 0, 151);

        BufferedImage stretched = ImageEnhancer.autocontrast(gray);

        assertThat(stretched.getRaster().getSample(0, 0, 0)).isZero();
        assertThat(stretched.getRaster().getSample(1, 0, 0)).isEqualTo(255);
    }

    @Test
    void contrastPushesLevelsAwayFromTheMean() {
        BufferedImage gray = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_GRAY);
        gray.getRaster().setSample(0, 0, 0, 100);
        gray.getRaster().setSample(1, 0, 0, 140);

        BufferedImage boosted = ImageEnhancer.contrast(gray, 2.0f);

        assertThat(boosted.getRaster().getSample(0, 0, 0)).isEqualTo(80);
        assertThat(boosted.getRaster().getSample(1, 0, 0)).isEqualTo(160);
    }

    @Test
    void aggressivePreprocessingUpscalesSmallPages() {
        BufferedImage page = new BufferedImage(200, 100, BufferedImage.TYPE_INT_RGB);

        BufferedImage prepared = ImageEnhancer.aggressive(page);

        assertThat(prepared.getWidth()).isEqualTo(2000);
        assertThat(prepared.getHeight()).isEqualTo(1000);
        assertThat(prepared.getType()).isEqualTo(BufferedImage.TYPE_BYTE_GRAY);
    }

    @Test
    void simplePreprocessingKeepsSize() {
        BufferedImage prepared = ImageEnhancer.simple(new BufferedImage(30, 20, BufferedImage.TYPE_INT_RGB));

        assertThat(prepared.getWidth()).isEqualTo(30);
        assertThat(prepared.getHeight()).isEqualTo(20);
    }
}
