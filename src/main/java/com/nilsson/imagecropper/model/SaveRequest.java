package com.nilsson.imagecropper.model;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;

/**
 An encode job handed from the controller to the saver. Consumed by exactly one worker.

 @param image        Pixels to encode. The controller never touches this image again after queueing.
 @param destination  Final path of the encoded file.
 @param originalPath The file being replaced; it is moved into the originals holding area first.
 @param quality      Encoder quality 1-100, used by lossy formats only.
 @param format       Target container.
 */
public record SaveRequest(BufferedImage image, Path destination, Path originalPath, int quality, OutputFormat format) {

    public SaveRequest {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(originalPath, "originalPath");
        Objects.requireNonNull(format, "format");
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("Quality must be within 1-100, got " + quality);
        }
    }
}
