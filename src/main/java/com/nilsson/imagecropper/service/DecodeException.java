package com.nilsson.imagecropper.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 No decode strategy could turn a file into pixels.
 */
public class DecodeException extends IOException {

    private final Path path;

    public DecodeException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
