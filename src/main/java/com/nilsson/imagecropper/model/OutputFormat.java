package com.nilsson.imagecropper.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 The closed set of containers the saver can produce.
 */
public enum OutputFormat {

    JPG("jpg", true, false, true, true),
    PNG("png", false, true, true, true),
    WEBP("webp", false, true, false, false);

    private final String extension;
    private final boolean lossy;
    private final boolean alphaSupported;
    private final boolean iccSupported;
    private final boolean exifSupported;

    OutputFormat(String extension, boolean lossy, boolean alphaSupported, boolean iccSupported, boolean exifSupported) {
        this.extension = extension;
        this.lossy = lossy;
        this.alphaSupported = alphaSupported;
        this.iccSupported = iccSupported;
        this.exifSupported = exifSupported;
    }

    @JsonValue
    public String extension() {
        return extension;
    }

    public boolean isLossy() {
        return lossy;
    }

    public boolean supportsAlpha() {
        return alphaSupported;
    }

    /**
     Whether the container can carry an embedded ICC profile once written by the saver.
     */
    public boolean supportsIccProfile() {
        return iccSupported;
    }

    public boolean supportsExif() {
        return exifSupported;
    }

    /**
     True when {@code fileName} has an extension other than this format's own (compared
     case-insensitively). A {@code .jpeg} file is converted to {@code .jpg}; a name without an
     extension is left alone.
     */
    public boolean isForeignExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return false;
        return !fileName.substring(dot + 1).toLowerCase(Locale.ROOT).equals(extension);
    }

    @JsonCreator
    public static OutputFormat fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Output format must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) normalized = normalized.substring(1);
        if (normalized.equals("jpeg")) return JPG;
        for (OutputFormat format : values()) {
            if (format.extension.equals(normalized)) return format;
        }
        throw new IllegalArgumentException("Unsupported output format: " + name);
    }
}
