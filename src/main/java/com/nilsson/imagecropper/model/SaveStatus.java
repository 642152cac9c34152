package com.nilsson.imagecropper.model;

import java.nio.file.Path;
import java.util.OptionalLong;

/**
 Outcome of a single {@link SaveRequest}. Produced once by a saver worker, observed once by the controller.
 */
public final class SaveStatus {

    private final Path destination;
    private final String error;
    private final Long originalSize;
    private final Long newSize;
    private final boolean metadataCopied;

    private SaveStatus(Path destination, String error, Long originalSize, Long newSize, boolean metadataCopied) {
        this.destination = destination;
        this.error = error;
        this.originalSize = originalSize;
        this.newSize = newSize;
        this.metadataCopied = metadataCopied;
    }

    public static SaveStatus success(Path destination, Long originalSize, Long newSize, boolean metadataCopied) {
        return new SaveStatus(destination, null, originalSize, newSize, metadataCopied);
    }

    public static SaveStatus failure(Path destination, String reason, Long originalSize) {
        return new SaveStatus(destination, reason == null ? "unknown error" : reason, originalSize, null, false);
    }

    public Path getDestination() {
        return destination;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     @return The failure reason, or {@code null} on success.
     */
    public String getError() {
        return error;
    }

    public OptionalLong getOriginalSize() {
        return originalSize == null ? OptionalLong.empty() : OptionalLong.of(originalSize);
    }

    public OptionalLong getNewSize() {
        return newSize == null ? OptionalLong.empty() : OptionalLong.of(newSize);
    }

    /**
     @return {@code newSize - originalSize} when both sizes were captured.
     */
    public OptionalLong getSizeDelta() {
        if (originalSize == null || newSize == null) return OptionalLong.empty();
        return OptionalLong.of(newSize - originalSize);
    }

    public boolean isMetadataCopied() {
        return metadataCopied;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "SaveStatus[" + destination + " ok, " + originalSize + " -> " + newSize + "]"
                : "SaveStatus[" + destination + " failed: " + error + "]";
    }
}
