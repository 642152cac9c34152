package com.nilsson.imagecropper.service;

import java.nio.file.Path;
import java.util.List;

/**
 Raised when the scanned roots contain no supported image at all.
 */
public class NoImagesFoundException extends ScanException {

    public NoImagesFoundException(List<Path> roots) {
        super("No supported image files found in " + roots);
    }
}
