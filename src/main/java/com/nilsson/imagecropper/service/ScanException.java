package com.nilsson.imagecropper.service;

/**
 Raised when an input root is missing or cannot be listed. Fatal at startup.
 */
public class ScanException extends Exception {

    public ScanException(String message) {
        super(message);
    }

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
