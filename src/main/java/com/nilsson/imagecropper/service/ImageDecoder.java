package com.nilsson.imagecropper.service;

import com.nilsson.imagecropper.model.ImageRecord;
import com.nilsson.imagecropper.model.LoadTimings;
import com.nilsson.imagecropper.service.strategy.DecodeStrategy;
import com.nilsson.imagecropper.service.strategy.GeneralDecodeStrategy;
import com.nilsson.imagecropper.service.strategy.JpegDecodeStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 <h2>ImageDecoder</h2>
 <p>
 The unit of work a preloader worker runs for one path:
 </p>
 <ol>
 <li>Read the whole file into memory.</li>
 <li>Try each {@link DecodeStrategy} in order until one yields pixels.</li>
 <li>Downscale to fit {@value #MAX_WIDTH}x{@value #MAX_HEIGHT} if the image is larger.</li>
 <li>Prepare the ARGB display buffer.</li>
 </ol>
 <p>
 The default chain is the JPEG fast path followed by the general ImageIO reader, so a JPEG the
 fast path rejects still gets a second chance.
 </p>
 */
public class ImageDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ImageDecoder.class);

    public static final int MAX_WIDTH = 3840;
    public static final int MAX_HEIGHT = 2160;

    static {
        // Pick up TwelveMonkeys and the WebP writer from the classpath
        ImageIO.scanForPlugins();
        // Decode from RAM; a disk cache would leave temp files behind on forced exit
        ImageIO.setUseCache(false);
    }

    private final List<DecodeStrategy> strategies;

    public ImageDecoder() {
        this(List.of(new JpegDecodeStrategy(), new GeneralDecodeStrategy()));
    }

    public ImageDecoder(List<DecodeStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     Decodes {@code path} into a display-ready record.

     @throws IOException if the file cannot be read, or {@link DecodeException} if no strategy could decode it.
     */
    public ImageRecord decode(Path path) throws IOException {
        long start = System.nanoTime();

        byte[] bytes = Files.readAllBytes(path);
        long readDone = System.nanoTime();

        BufferedImage image = null;
        for (DecodeStrategy strategy : strategies) {
            if (!strategy.appliesTo(path)) continue;
            Optional<BufferedImage> decoded = strategy.decode(path, bytes);
            if (decoded.isPresent()) {
                image = decoded.get();
                break;
            }
            logger.debug("Strategy '{}' could not decode {}, trying next", strategy.name(), path.getFileName());
        }
        if (image == null) {
            throw new DecodeException(path, "No decoder could read " + path);
        }
        long decodeDone = System.nanoTime();

        Dimension target = ImageResizer.fitWithin(image.getWidth(), image.getHeight(), MAX_WIDTH, MAX_HEIGHT);
        if (target.width != image.getWidth() || target.height != image.getHeight()) {
            logger.debug("Downscaling {} from {}x{} to {}x{}", path.getFileName(),
                    image.getWidth(), image.getHeight(), target.width, target.height);
            image = ImageResizer.resize(image, target.width, target.height);
        }
        long resizeDone = System.nanoTime();

        BufferedImage display = ImageResizer.toDisplayImage(image);
        long displayDone = System.nanoTime();

        LoadTimings timings = new LoadTimings(
                Duration.ofNanos(readDone - start),
                Duration.ofNanos(decodeDone - readDone),
                Duration.ofNanos(resizeDone - decodeDone),
                Duration.ofNanos(displayDone - resizeDone),
                Duration.ofNanos(displayDone - start));
        return new ImageRecord(path, image, display, timings);
    }
}
