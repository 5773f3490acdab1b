package com.rodoc.ocr.service.image;

import com.rodoc.ocr.exception.InvalidDocumentException;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns uploaded bytes or an in-memory image into the canonical {@link RawImage}.
 */
@Component
public class ImageNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ImageNormalizer.class);

    public RawImage load(byte[] content) {
        if (content == null || content.length == 0) {
            throw new InvalidDocumentException("Document content is empty");
        }
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException | RuntimeException ex) {
            throw new InvalidDocumentException("Unable to decode document image: " + ex.getMessage(), ex);
        }
        if (decoded == null) {
            throw new InvalidDocumentException("Unsupported image format or corrupt image data");
        }
        return normalize(decoded);
    }

    public RawImage normalize(BufferedImage image) {
        if (image == null) {
            throw new InvalidDocumentException("Document image is missing");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new InvalidDocumentException("Document image has no pixels");
        }
        ColorMode mode = ColorMode.of(image);
        BufferedImage canonical = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canonical.createGraphics();
        // transparent areas become paper white
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, image.getWidth(), image.getHeight());
        g.drawImage(image, 0, 0, null);
        g.dispose();
        log.debug("Normalized {}x{} {} image", image.getWidth(), image.getHeight(), mode);
        return new RawImage(canonical, mode);
    }
}
