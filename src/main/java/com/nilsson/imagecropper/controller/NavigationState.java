package com.nilsson.imagecropper.controller;

public enum NavigationState {
    /** Browsing the list; the current slot is valid. */
    READY,
    /** Advanced past the last entry (or the list ran empty). Only restart and quit apply. */
    LIST_COMPLETED,
    /** Shutdown requested; waiting for pending saves unless forced. */
    EXITING
}
