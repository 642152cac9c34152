package com.nilsson.imagecropper.service;

import com.nilsson.imagecropper.model.ImageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 <h2>ImagePreloader</h2>
 <p>
 Decodes images ahead of the operator on a fixed pool of workers and keeps the results in a
 path-keyed cache until the controller claims them.
 </p>

 <h3>Concurrency Model:</h3>
 <p>
 Workers never touch the cache. Each job posts exactly one {@link LoadResult} on the result
 channel; {@link #poll()} moves those into the cache on the controller thread. Because arrival
 order across workers is unspecified, everything is keyed by path. The cache, the pending set and
 the history are only accessed from the controller thread.
 </p>

 <h3>Ownership:</h3>
 <p>
 {@link #take(Path)} removes the record from the cache; the caller owns it from then on.
 Decode failures are logged and dropped, so a later {@link #load(Path)} simply tries again.
 </p>
 */
public class ImagePreloader {

    private static final Logger logger = LoggerFactory.getLogger(ImagePreloader.class);

    public static final int HISTORY_CAPACITY = 10;

    // --- Dependencies ---
    private final ImageDecoder decoder;
    private final ExecutorService workers;

    // --- Worker output channel ---
    private final BlockingQueue<LoadResult> results = new LinkedBlockingQueue<>();

    // --- Controller-thread state ---
    private final Map<Path, ImageRecord> cache = new HashMap<>();
    private final Set<Path> pending = new HashSet<>();
    private final Set<Path> discarded = new HashSet<>();
    private final List<Path> failures = new ArrayList<>();
    private final ImageHistory history = new ImageHistory(HISTORY_CAPACITY);

    public ImagePreloader(ImageDecoder decoder, int threads) {
        this.decoder = decoder;
        this.workers = WorkerThreads.newPool("Preloader-Worker", threads);
    }

    // --- Requests ---

    /**
     Starts decoding {@code path} in the background. Does nothing if it is already cached or in flight.
     */
    public void load(Path path) {
        if (pending.contains(path)) {
            discarded.remove(path);
            return;
        }
        if (cache.containsKey(path)) {
            return;
        }
        pending.add(path);
        try {
            workers.execute(() -> runJob(path));
        } catch (RejectedExecutionException e) {
            pending.remove(path);
            logger.warn("Preloader is shut down, not loading {}", path);
        }
    }

    /**
     Moves every finished result into the cache. Non-blocking; call once per control-loop tick.
     */
    public void poll() {
        LoadResult result;
        while ((result = results.poll()) != null) {
            accept(result);
        }
    }

    /**
     Removes and returns the cached record for {@code path}.
     */
    public Optional<ImageRecord> take(Path path) {
        return Optional.ofNullable(cache.remove(path));
    }

    /**
     Blocks up to {@code timeout} for {@code path} to finish decoding, then takes it. Only meant for
     the very first image at startup.
     */
    public Optional<ImageRecord> awaitRecord(Path path, Duration timeout) {
        load(path);
        poll();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!cache.containsKey(path) && pending.contains(path)) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                logger.info("Gave up waiting for {} after {}ms", path.getFileName(), timeout.toMillis());
                break;
            }
            try {
                LoadResult result = results.poll(remaining, TimeUnit.NANOSECONDS);
                if (result != null) accept(result);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return take(path);
    }

    /**
     Drops any cached record for {@code path}. The result of a decode still in flight is dropped on
     arrival unless the path is loaded again first.
     */
    public void discard(Path path) {
        cache.remove(path);
        if (pending.contains(path)) {
            discarded.add(path);
        }
    }

    /**
     @return Paths whose decode failed since the previous call.
     */
    public List<Path> drainFailures() {
        List<Path> drained = new ArrayList<>(failures);
        failures.clear();
        return drained;
    }

    public boolean isCached(Path path) {
        return cache.containsKey(path);
    }

    public boolean isPending(Path path) {
        return pending.contains(path);
    }

    public int cacheSize() {
        return cache.size();
    }

    // --- History ---

    public void pushHistory(ImageRecord record) {
        history.push(record);
    }

    public Optional<ImageRecord> popHistory() {
        return history.pop();
    }

    public ImageHistory history() {
        return history;
    }

    // --- Lifecycle ---

    public void shutdown() {
        workers.shutdownNow();
        cache.clear();
        discarded.clear();
        history.clear();
    }

    // --- Internal ---

    private void runJob(Path path) {
        try {
            ImageRecord record = decoder.decode(path);
            logger.debug("Loaded {} {}x{}: {}", path.getFileName(), record.width(), record.height(),
                    record.timings().describe());
            results.add(LoadResult.loaded(record));
        } catch (Exception | OutOfMemoryError e) {
            logger.warn("Failed to load {}: {}", path, e.toString());
            results.add(LoadResult.failed(path));
        }
    }

    private void accept(LoadResult result) {
        pending.remove(result.path());
        if (discarded.remove(result.path())) {
            logger.debug("Dropping result for discarded {}", result.path().getFileName());
            return;
        }
        if (result.record() != null) {
            cache.put(result.path(), result.record());
        } else {
            failures.add(result.path());
        }
    }

    private record LoadResult(Path path, ImageRecord record) {

        static LoadResult loaded(ImageRecord record) {
            return new LoadResult(record.path(), record);
        }

        static LoadResult failed(Path path) {
            return new LoadResult(path, null);
        }
    }
}
