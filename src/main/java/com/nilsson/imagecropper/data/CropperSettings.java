package com.nilsson.imagecropper.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.nilsson.imagecropper.model.OutputFormat;

/**
 <h2>CropperSettings</h2>
 <p>
 Runtime options, bound from {@code imagecropper.json} by {@link SettingsRepository}.
 Every field has a default so a partial (or absent) file is valid.
 </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CropperSettings {

    public static final int MIN_QUALITY = 1;
    public static final int MAX_QUALITY = 100;

    // --- Worker pools ---
    private int loaderThreads = Runtime.getRuntime().availableProcessors();
    private int saverThreads = 4;

    // --- Output ---
    private OutputFormat outputFormat = OutputFormat.JPG;
    private int quality = 60;

    // --- Behaviour ---
    private boolean dryRun = false;
    private boolean resaveOnLeave = false;
    private boolean recursive = false;
    private boolean shuffle = true;
    private int preloadAhead = 3;
    private long firstImageTimeoutMillis = 5000;
    private int forceExitThreshold = 3;

    /**
     Clamps out-of-range values in place.

     @return {@code this}, for chaining.
     */
    public CropperSettings validated() {
        loaderThreads = Math.max(1, loaderThreads);
        saverThreads = Math.max(1, saverThreads);
        quality = Math.max(MIN_QUALITY, Math.min(MAX_QUALITY, quality));
        preloadAhead = Math.max(0, preloadAhead);
        firstImageTimeoutMillis = Math.max(0, firstImageTimeoutMillis);
        forceExitThreshold = Math.max(1, forceExitThreshold);
        if (outputFormat == null) {
            outputFormat = OutputFormat.JPG;
        }
        return this;
    }

    public int getLoaderThreads() {
        return loaderThreads;
    }

    public void setLoaderThreads(int loaderThreads) {
        this.loaderThreads = loaderThreads;
    }

    public int getSaverThreads() {
        return saverThreads;
    }

    public void setSaverThreads(int saverThreads) {
        this.saverThreads = saverThreads;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
    }

    public int getQuality() {
        return quality;
    }

    public void setQuality(int quality) {
        this.quality = quality;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isResaveOnLeave() {
        return resaveOnLeave;
    }

    public void setResaveOnLeave(boolean resaveOnLeave) {
        this.resaveOnLeave = resaveOnLeave;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public boolean isShuffle() {
        return shuffle;
    }

    public void setShuffle(boolean shuffle) {
        this.shuffle = shuffle;
    }

    public int getPreloadAhead() {
        return preloadAhead;
    }

    public void setPreloadAhead(int preloadAhead) {
        this.preloadAhead = preloadAhead;
    }

    public long getFirstImageTimeoutMillis() {
        return firstImageTimeoutMillis;
    }

    public void setFirstImageTimeoutMillis(long firstImageTimeoutMillis) {
        this.firstImageTimeoutMillis = firstImageTimeoutMillis;
    }

    public int getForceExitThreshold() {
        return forceExitThreshold;
    }

    public void setForceExitThreshold(int forceExitThreshold) {
        this.forceExitThreshold = forceExitThreshold;
    }
}
