package com.nilsson.imagecropper.model;

import java.time.Duration;

/**
 Per-stage timing breakdown captured by a preloader worker.
 */
public record LoadTimings(Duration read, Duration decode, Duration resize, Duration displayPrep, Duration total) {

    public static LoadTimings none() {
        return new LoadTimings(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    public String describe() {
        return String.format("total %dms (read %dms, decode %dms, resize %dms, display %dms)",
                total.toMillis(), read.toMillis(), decode.toMillis(), resize.toMillis(), displayPrep.toMillis());
    }
}
