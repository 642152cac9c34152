package com.nilsson.imagecropper.service.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;

/**
 Catch-all strategy: lets ImageIO sniff the format from the bytes and uses whichever plugin
 claims it. Works entirely from memory so seeking is safe for every plugin.
 */
public class GeneralDecodeStrategy implements DecodeStrategy {

    private static final Logger logger = LoggerFactory.getLogger(GeneralDecodeStrategy.class);

    @Override
    public String name() {
        return "imageio";
    }

    @Override
    public boolean appliesTo(Path path) {
        return true;
    }

    @Override
    public Optional<BufferedImage> decode(Path path, byte[] bytes) {
        try (ImageInputStream iis = new MemoryCacheImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);

            // Some WebP files are not recognised by signature sniffing
            if (!readers.hasNext() && path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".webp")) {
                iis.seek(0);
                readers = ImageIO.getImageReadersByMIMEType("image/webp");
            }

            if (!readers.hasNext()) {
                logger.debug("No ImageIO reader claims {}", path.getFileName());
                return Optional.empty();
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                return Optional.ofNullable(reader.read(0, reader.getDefaultReadParam()));
            } finally {
                reader.dispose();
            }
        } catch (Exception e) {
            logger.debug("ImageIO decode failed for {}: {}", path.getFileName(), e.toString());
            return Optional.empty();
        }
    }
}
