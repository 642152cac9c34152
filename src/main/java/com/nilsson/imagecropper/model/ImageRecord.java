package com.nilsson.imagecropper.model;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 A decoded image ready for display.
 * <p>A record is owned by exactly one holder at a time: the preloader cache, the controller's
 "current" slot, or the history ring. Holders hand it over by removing it from themselves,
 never by sharing it.</p>

 @param path         The file the record was decoded from.
 @param image        The decoded pixels, already downsampled if the source exceeded the size ceiling.
 @param displayImage An {@code TYPE_INT_ARGB} copy suitable for direct upload to a renderer.
 @param timings      Where the worker spent its time.
 */
public record ImageRecord(Path path, BufferedImage image, BufferedImage displayImage, LoadTimings timings) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
