package com.nilsson.imagecropper.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 Decides when the application may terminate. Exit waits for outstanding saves, but repeating the
 request {@code threshold} times forces it.
 */
public class ExitCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ExitCoordinator.class);

    public enum Decision {
        WAIT, TERMINATE
    }

    private final int threshold;
    private boolean requested;
    private boolean forced;
    private int attempts;

    public ExitCoordinator(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Threshold must be at least 1, got " + threshold);
        }
        this.threshold = threshold;
    }

    public Decision requestShutdown(int pendingSaves) {
        requested = true;
        if (pendingSaves == 0) {
            return Decision.TERMINATE;
        }
        attempts++;
        if (remainingSignals() == 0) {
            forced = true;
            logger.warn("Forcing exit with {} save(s) still pending", pendingSaves);
            return Decision.TERMINATE;
        }
        logger.info("Exit requested, waiting for {} pending save(s)", pendingSaves);
        return Decision.WAIT;
    }

    /**
     @return {@code true} once a requested exit has no saves left to wait for.
     */
    public boolean onTick(int pendingSaves) {
        return requested && pendingSaves == 0;
    }

    public int remainingSignals() {
        return Math.max(0, threshold - attempts);
    }

    public String waitingMessage() {
        return "Saving in progress! Press quit " + remainingSignals() + " more times to force exit.";
    }

    public boolean isForced() {
        return forced;
    }
}
