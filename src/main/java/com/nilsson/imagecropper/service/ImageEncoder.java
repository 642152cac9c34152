package com.nilsson.imagecropper.service;

import com.nilsson.imagecropper.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;

/**
 Writes a {@link BufferedImage} in one of the {@link OutputFormat}s through the matching ImageIO writer.
 */
public class ImageEncoder {

    private static final Logger logger = LoggerFactory.getLogger(ImageEncoder.class);

    static {
        ImageIO.scanForPlugins();
        ImageIO.setUseCache(false);
    }

    /**
     Encodes {@code image} into {@code target}, truncating whatever is there.

     @param quality 1-100, applied to lossy formats only.
     @throws IOException if no writer is registered for the format or the write fails.
     */
    public void encode(BufferedImage image, OutputFormat format, int quality, Path target) throws IOException {
        BufferedImage pixels = format.supportsAlpha() || !image.getColorModel().hasAlpha()
                ? image
                : ImageResizer.flattenOnWhite(image);

        ImageWriter writer = writerFor(format);
        try (OutputStream out = Files.newOutputStream(target);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            if (ios == null) {
                throw new IOException("Unable to open an image stream for " + target);
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(pixels, null, null), paramsFor(writer, format, quality));
            ios.flush();
        } finally {
            writer.dispose();
        }
    }

    /**
     Whether a writer for {@code format} is registered with ImageIO.
     */
    public boolean isAvailable(OutputFormat format) {
        return ImageIO.getImageWritersByFormatName(formatName(format)).hasNext();
    }

    private ImageWriter writerFor(OutputFormat format) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName(format));
        if (!writers.hasNext()) {
            throw new IOException("No " + format.extension() + " encoder available");
        }
        return writers.next();
    }

    private String formatName(OutputFormat format) {
        return switch (format) {
            case JPG -> "jpeg";
            case PNG -> "png";
            case WEBP -> "webp";
        };
    }

    private ImageWriteParam paramsFor(ImageWriter writer, OutputFormat format, int quality) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        switch (format) {
            case JPG -> {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality / 100f);
            }
            case PNG -> {
                // lossless, defaults are fine
            }
            case WEBP -> {
                if (param.canWriteCompressed()) {
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    String[] types = param.getCompressionTypes();
                    if (types != null && types.length > 0) {
                        String lossless = Arrays.stream(types)
                                .filter(t -> t.toLowerCase().contains("lossless"))
                                .findFirst()
                                .orElse(types[0]);
                        param.setCompressionType(lossless);
                    }
                } else {
                    logger.debug("WebP writer does not expose compression settings, using defaults");
                }
            }
        }
        return param;
    }
}
