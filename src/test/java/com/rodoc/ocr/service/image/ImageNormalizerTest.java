package com.rodoc.ocr.service.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rodoc.ocr.exception.InvalidDocumentException;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class ImageNormalizerTest {

    private final ImageNormalizer normalizer = new ImageNormalizer();

    @Test
    void shouldDecodePngIntoCanonicalBuffer() throws Exception {
        BufferedImage gray = new BufferedImage(64, 40, BufferedImage.TYPE_BYTE_GRAY);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(gray, "png", out);

        RawImage image = normalizer.load(out.toByteArray());

        assertThat(image.width()).isEqualTo(64);
        assertThat(image.height()).isEqualTo(40);
        assertThat(image.aspectRatio()).isEqualTo(1.6);
        assertThat(image.sourceMode()).isEqualTo(ColorMode.GRAY);
    }

    @Test
    void shouldRejectEmptyContent() {
        assertThatThrownBy(() -> normalizer.load(new byte[0]))
                .isInstanceOf(InvalidDocumentException.class)
                .satisfies(ex -> assertThat(((InvalidDocumentException) ex).errorCode()).isEqualTo("INPUT_ERROR"));
    }

    @Test
    void shouldRejectBytesThatAreNotAnImage() {
        byte[] text = "definitely not a picture".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> normalizer.load(text)).isInstanceOf(InvalidDocumentException.class);
    }

    @Test
    void shouldPaintTransparentPixelsWhite() {
        BufferedImage transparent = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);

        RawImage image = normalizer.normalize(transparent);

        assertThat(image.sourceMode()).isEqualTo(ColorMode.RGBA);
        assertThat(image.luminance()).containsOnly(255);
    }

    @Test
    void cropsAreIndependentCopies() {
        BufferedImage source = new BufferedImage(20, 10, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = source.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 20, 10);
        g.dispose();
        RawImage image = normalizer.normalize(source);

        BufferedImage crop = image.crop(new Rectangle(15, 5, 10, 10));
        crop.setRGB(0, 0, Color.BLACK.getRGB());

        assertThat(crop.getWidth()).isEqualTo(5);
        assertThat(crop.getHeight()).isEqualTo(5);
        assertThat(image.luminance()).containsOnly(255);
        assertThatThrownBy(() -> image.crop(new Rectangle(30, 30, 5, 5))).isInstanceOf(IllegalArgumentException.class);
    }
}
