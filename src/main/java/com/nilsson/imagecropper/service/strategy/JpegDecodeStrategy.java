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
 Fast path for {@code .jpg}/{@code .jpeg} files: goes straight to the registered JPEG reader
 (TwelveMonkeys when present, which also copes with CMYK and truncated streams) without format
 sniffing, and skips metadata parsing.
 */
public class JpegDecodeStrategy implements DecodeStrategy {

    private static final Logger logger = LoggerFactory.getLogger(JpegDecodeStrategy.class);

    @Override
    public String name() {
        return "jpeg";
    }

    @Override
    public boolean appliesTo(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jpg") || name.endsWith(".jpeg");
    }

    @Override
    public Optional<BufferedImage> decode(Path path, byte[] bytes) {
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("jpeg");
        if (!readers.hasNext()) {
            return Optional.empty();
        }

        ImageReader reader = readers.next();
        try (ImageInputStream iis = new MemoryCacheImageInputStream(new ByteArrayInputStream(bytes))) {
            reader.setInput(iis, true, true);
            return Optional.ofNullable(reader.read(0, reader.getDefaultReadParam()));
        } catch (Exception e) {
            logger.debug("JPEG fast path failed for {}: {}", path.getFileName(), e.toString());
            return Optional.empty();
        } finally {
            reader.dispose();
        }
    }
}
