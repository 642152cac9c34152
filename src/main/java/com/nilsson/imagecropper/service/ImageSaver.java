package com.nilsson.imagecropper.service;

import com.nilsson.imagecropper.model.SaveRequest;
import com.nilsson.imagecropper.model.SaveStatus;
import com.nilsson.imagecropper.service.metadata.MetadataTransplanter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 <h2>ImageSaver</h2>
 <p>
 Encodes and publishes images on a fixed worker pool. Each job runs:
 </p>
 <ol>
 <li>record the original's size,</li>
 <li>move the original into {@value HoldingAreas#ORIGINALS_DIR},</li>
 <li>encode into a reserved file under {@value HoldingAreas#TEMP_DIR},</li>
 <li>copy the original's ICC / EXIF into it (best-effort),</li>
 <li>rename it onto the destination in one step.</li>
 </ol>
 <p>
 So the destination is either absent or complete, and the original is never deleted.
 Bookkeeping of pending destinations is owned by the controller thread; workers only post
 {@link SaveStatus} results.
 </p>
 */
public class ImageSaver {

    private static final Logger logger = LoggerFactory.getLogger(ImageSaver.class);

    private final ImageEncoder encoder;
    private final MetadataTransplanter transplanter;
    private final ExecutorService workers;

    private final BlockingQueue<SaveStatus> completions = new LinkedBlockingQueue<>();
    // destination -> number of queued jobs still unobserved
    private final Map<Path, Integer> pending = new LinkedHashMap<>();

    public ImageSaver(ImageEncoder encoder, MetadataTransplanter transplanter, int threads) {
        this.encoder = encoder;
        this.transplanter = transplanter;
        this.workers = WorkerThreads.newPool("Saver-Worker", threads);
    }

    // --- Controller-thread API ---

    public void queue(SaveRequest request) throws SaveRejectedException {
        Path destination = request.destination();
        pending.merge(destination, 1, Integer::sum);
        try {
            workers.execute(() -> completions.add(process(request)));
        } catch (RejectedExecutionException e) {
            release(destination);
            throw new SaveRejectedException("Saver is shut down, cannot save " + destination, e);
        }
        logger.debug("Queued save of {} ({} pending)", destination.getFileName(), pendingCount());
    }

    /**
     Drains every status posted since the previous call and clears the matching pending entries.
     */
    public List<SaveStatus> pollCompletions() {
        List<SaveStatus> drained = new ArrayList<>();
        completions.drainTo(drained);
        for (SaveStatus status : drained) {
            release(status.getDestination());
        }
        return drained;
    }

    public int pendingCount() {
        int total = 0;
        for (int count : pending.values()) total += count;
        return total;
    }

    public Set<Path> pendingPaths() {
        return Set.copyOf(pending.keySet());
    }

    public boolean isPending(Path destination) {
        return pending.containsKey(destination);
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    /**
     Stops accepting work and waits up to {@code timeout} for running jobs.

     @return {@code true} if every job finished in time.
     */
    public boolean shutdown(Duration timeout) {
        workers.shutdown();
        try {
            return workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void release(Path destination) {
        pending.computeIfPresent(destination, (path, count) -> count > 1 ? count - 1 : null);
    }

    // --- Worker side ---

    SaveStatus process(SaveRequest request) {
        Path destination = request.destination();
        Path original = request.originalPath();
        Long originalSize = null;
        Path temp = null;
        try {
            originalSize = sizeOf(original);
            Path backup = HoldingAreas.backupOriginal(original);
            logger.debug("Backed up {} to {}", original.getFileName(), backup);

            Path tempDir = HoldingAreas.prepareSiblingDir(destination, HoldingAreas.TEMP_DIR);
            temp = HoldingAreas.reserveUnique(tempDir, destination.getFileName().toString());
            encoder.encode(request.image(), request.format(), request.quality(), temp);

            boolean metadataCopied = transplanter.transplant(backup, temp, request.format());

            publish(temp, destination);
            temp = null;

            Long newSize = sizeOf(destination);
            if (originalSize != null && newSize != null) {
                logger.info("Saved {} ({} -> {})", destination.getFileName(),
                        HoldingAreas.formatSize(originalSize), HoldingAreas.formatSize(newSize));
            } else {
                logger.info("Saved {}", destination.getFileName());
            }
            return SaveStatus.success(destination, originalSize, newSize, metadataCopied);
        } catch (IOException | RuntimeException | OutOfMemoryError e) {
            logger.error("Failed to save {}", destination, e);
            return SaveStatus.failure(destination, describe(e), originalSize);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    /**
     @return The size of {@code path}, or {@code null} if it cannot be read.
     */
    static Long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            logger.debug("Could not read size of {}: {}", path, e.getMessage());
            return null;
        }
    }

    private static void publish(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move unsupported for {}, falling back to replace", destination);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
