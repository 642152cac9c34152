package com.nilsson.imagecropper.service.strategy;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Optional;

/**
 One way of turning file bytes into pixels. The decoder tries its strategies in order and uses the
 first non-empty result.
 */
public interface DecodeStrategy {

    /**
     Short name used in log lines.
     */
    String name();

    /**
     Whether this strategy should be attempted for {@code path} at all.
     */
    boolean appliesTo(Path path);

    /**
     @param path  The source file, for format hints and logging.
     @param bytes The full file contents.
     @return The decoded image, or empty if this strategy could not decode it. Never throws for bad input.
     */
    Optional<BufferedImage> decode(Path path, byte[] bytes);
}
