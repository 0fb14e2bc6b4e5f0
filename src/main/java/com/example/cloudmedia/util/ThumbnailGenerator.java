package com.example.cloudmedia.util;

import com.example.cloudmedia.config.StorageProperties;
import lombok.RequiredArgsConstructor;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ThumbnailGenerator {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailGenerator.class);

    private final StorageProperties props;

    public Optional<byte[]> generate(String label, InputStream source) {
        try {
            BufferedImage image = ImageIO.read(source);
            if (image == null) {
                log.warn("Failed to build thumbnail for {}: no decoder accepted the content", label);
                return Optional.empty();
            }

            BufferedImage canvas = flatten(image);
            Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(canvas);
            if (canvas.getWidth() <= props.getThumbnailWidth() && canvas.getHeight() <= props.getThumbnailHeight()) {
                builder.scale(1.0);
            } else {
                builder.size(props.getThumbnailWidth(), props.getThumbnailHeight()).keepAspectRatio(true);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            builder.outputQuality(props.getThumbnailQuality() / 100.0)
                .outputFormat("jpg")
                .toOutputStream(out);
            return Optional.of(out.toByteArray());
        } catch (Exception ex) {
            log.warn("Failed to build thumbnail for {}: {}", label, ex.getMessage());
            return Optional.empty();
        }
    }

    private BufferedImage flatten(BufferedImage image) {
        BufferedImage canvas = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return canvas;
    }
}
