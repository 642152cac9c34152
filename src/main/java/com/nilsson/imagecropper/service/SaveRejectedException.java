package com.nilsson.imagecropper.service;

/**
 The saver no longer accepts work because its pool has been shut down.
 */
public class SaveRejectedException extends Exception {

    public SaveRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
