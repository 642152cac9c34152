package com.nilsson.imagecropper.controller;

import com.nilsson.imagecropper.data.CropperSettings;
import com.nilsson.imagecropper.model.Command;
import com.nilsson.imagecropper.model.CropRect;
import com.nilsson.imagecropper.model.ImageRecord;
import com.nilsson.imagecropper.model.OutputFormat;
import com.nilsson.imagecropper.model.SaveRequest;
import com.nilsson.imagecropper.model.SaveStatus;
import com.nilsson.imagecropper.service.CropCompositor;
import com.nilsson.imagecropper.service.HoldingAreas;
import com.nilsson.imagecropper.service.ImagePreloader;
import com.nilsson.imagecropper.service.ImageResizer;
import com.nilsson.imagecropper.service.ImageSaver;
import com.nilsson.imagecropper.service.SaveRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 <h2>NavigationController</h2>
 <p>
 Owns the ordered file list and the cursor into it, and drives the {@link ImagePreloader} and
 {@link ImageSaver}. All methods must be called from a single control thread; the only blocking
 call is the bounded wait in {@link #start()}.
 </p>
 <ul>
 <li>{@link #handle(Command)} applies one operator command.</li>
 <li>{@link #tick()} polls both worker pools and must be called regularly.</li>
 <li>{@link #getStatus()} is the single line of operator feedback.</li>
 </ul>
 */
public class NavigationController {

    private static final Logger logger = LoggerFactory.getLogger(NavigationController.class);

    // --- Dependencies ---
    private final ImagePreloader preloader;
    private final ImageSaver saver;
    private final CropperSettings settings;
    private final ExitCoordinator exitCoordinator;

    // --- State ---
    private final List<Path> files;
    private int cursor;
    private NavigationState state = NavigationState.READY;
    private ImageRecord current;
    private String status = "Ready";
    private boolean terminated;

    // Saved paths whose decode was already in flight when the save completed
    private final Set<Path> reloadAfterFailure = new HashSet<>();

    public NavigationController(List<Path> files, ImagePreloader preloader, ImageSaver saver,
                                CropperSettings settings, ExitCoordinator exitCoordinator) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("At least one image path is required");
        }
        this.files = new ArrayList<>(files);
        this.preloader = preloader;
        this.saver = saver;
        this.settings = settings;
        this.exitCoordinator = exitCoordinator;
    }

    // --- Lifecycle ---

    /**
     Waits (bounded) for the first image so the operator does not start on an empty screen, then
     starts the preload window.
     */
    public void start() {
        Path first = files.get(cursor);
        Optional<ImageRecord> record = preloader.awaitRecord(first,
                Duration.ofMillis(settings.getFirstImageTimeoutMillis()));
        if (record.isPresent()) {
            adopt(record.get());
        } else {
            current = null;
            preloader.load(first);
            status = loadingStatus(first);
        }
        preloadWindow();
    }

    public void handle(Command command) {
        if (terminated) return;

        if (state == NavigationState.EXITING && command.type() != Command.Type.REQUEST_SHUTDOWN) {
            logger.debug("Ignoring {} while exiting", command.type());
            return;
        }
        if (state == NavigationState.LIST_COMPLETED
                && command.type() != Command.Type.RESTART
                && command.type() != Command.Type.REQUEST_SHUTDOWN) {
            logger.debug("Ignoring {} after the list was completed", command.type());
            return;
        }

        switch (command.type()) {
            case ADVANCE -> advance();
            case GO_BACK -> goBack();
            case DELETE -> delete();
            case CROP -> crop(command.rects());
            case RESTART -> restart();
            case REQUEST_SHUTDOWN -> requestShutdown();
        }
    }

    /**
     One control-loop iteration: collect worker output, update status, adopt arrivals, evaluate exit.
     */
    public void tick() {
        if (terminated) return;

        preloader.poll();

        for (SaveStatus saveStatus : saver.pollCompletions()) {
            reconcile(saveStatus);
        }

        Path path = currentPath();
        for (Path failed : preloader.drainFailures()) {
            boolean waiting = isWaitingFor(failed);
            if (reloadAfterFailure.remove(failed) && waiting) {
                logger.debug("Decode of {} predates its save, loading again", failed);
                preloader.load(failed);
                continue;
            }
            if (waiting && !preloader.isPending(failed)) {
                status = saver.isPending(failed)
                        ? "Waiting for " + failed + " to finish saving"
                        : "Unable to load " + failed;
            }
        }

        if (state != NavigationState.LIST_COMPLETED && current == null && path != null) {
            preloader.take(path).ifPresent(record -> {
                adopt(record);
                preloadWindow();
            });
        }

        if (state == NavigationState.EXITING && exitCoordinator.onTick(saver.pendingCount())) {
            logger.info("All saves finished, exiting");
            terminate("Exiting");
        }
    }

    // --- Operations ---

    public void advance() {
        if (resaveOnLeave()) {
            Path path = currentPath();
            OutputFormat format = settings.getOutputFormat();
            Path output = chooseOutputPath(path, format);
            if (queueSave(ImageResizer.copy(current.image()), output, path)) {
                files.set(cursor, output);
                status = "Converting " + output + " to " + format.extension().toUpperCase() + "...";
            }
        }

        if (current != null) {
            preloader.pushHistory(current);
            current = null;
        }

        if (cursor + 1 >= files.size()) {
            state = NavigationState.LIST_COMPLETED;
            status = "All images processed";
            return;
        }

        cursor++;
        showCurrent();
    }

    public void goBack() {
        int previous = cursor == 0 ? files.size() - 1 : cursor - 1;
        Path previousPath = files.get(previous);

        Optional<ImageRecord> popped = preloader.popHistory();
        if (popped.isPresent() && popped.get().path().equals(previousPath)) {
            cursor = previous;
            adopt(popped.get());
            preloadWindow();
            return;
        }
        popped.ifPresent(record ->
                logger.debug("History entry {} does not match {}, reloading", record.path(), previousPath));

        current = null;
        cursor = previous;
        showCurrent();
    }

    public void delete() {
        Path path = currentPath();
        if (path == null) {
            status = "No image selected";
            return;
        }

        if (settings.isDryRun()) {
            logger.info("Dry run: would move {} to {}", path, HoldingAreas.TRASH_DIR);
            advance();
            status = "Dry run: skipped deleting " + path;
            return;
        }

        try {
            Path trashed = HoldingAreas.moveToTrash(path);
            logger.info("Moved {} to {}", path, trashed);
        } catch (IOException e) {
            logger.warn("Failed to delete {}", path, e);
            status = "Failed to delete: " + e.getMessage();
            return;
        }

        preloader.discard(path);
        current = null;
        files.remove(cursor);
        status = "Moved " + path + " to " + HoldingAreas.TRASH_DIR;

        if (files.isEmpty()) {
            state = NavigationState.LIST_COMPLETED;
            status = "No images remaining";
        } else if (cursor >= files.size()) {
            state = NavigationState.LIST_COMPLETED;
            status = "All images processed";
        } else {
            showCurrent();
        }
    }

    /**
     Crops the current image to {@code rects}, queues the result and moves on.

     @return {@code true} if a save was queued.
     */
    public boolean crop(List<CropRect> rects) {
        if (rects == null || rects.isEmpty()) {
            status = "No selection to crop";
            return false;
        }
        if (current == null) {
            status = "Image not loaded";
            return false;
        }
        Path path = currentPath();
        if (path == null) {
            status = "No image selected";
            return false;
        }

        Optional<BufferedImage> composed = CropCompositor.compose(current.image(), rects);
        if (composed.isEmpty()) {
            status = "Selections too small";
            return false;
        }

        Path output = chooseOutputPath(path, settings.getOutputFormat());
        if (!queueSave(composed.get(), output, path)) {
            return false;
        }
        files.set(cursor, output);
        advance();
        status = "Saving " + output + " in background...";
        return true;
    }

    public void restart() {
        if (state != NavigationState.LIST_COMPLETED) {
            return;
        }
        if (files.isEmpty()) {
            status = "No images remaining";
            return;
        }
        cursor = 0;
        state = NavigationState.READY;
        current = null;
        showCurrent();
    }

    public void requestShutdown() {
        state = NavigationState.EXITING;
        ExitCoordinator.Decision decision = exitCoordinator.requestShutdown(saver.pendingCount());
        if (decision == ExitCoordinator.Decision.TERMINATE) {
            terminate("Exiting");
        } else {
            status = exitCoordinator.waitingMessage();
        }
    }

    // --- Internal ---

    private boolean resaveOnLeave() {
        if (!settings.isResaveOnLeave() || current == null) return false;
        Path path = currentPath();
        return path != null && settings.getOutputFormat().isForeignExtension(path.getFileName().toString());
    }

    private boolean queueSave(BufferedImage image, Path output, Path original) {
        try {
            saver.queue(new SaveRequest(image, output, original, settings.getQuality(), settings.getOutputFormat()));
            return true;
        } catch (SaveRejectedException e) {
            logger.warn("Could not queue save of {}", output, e);
            status = "Failed to queue save: " + e.getMessage();
            return false;
        }
    }

    /**
     The original path with the output extension. When that names a different file that already
     exists (or is about to be written), a {@code stem-N.ext} variant is used instead.
     */
    private Path chooseOutputPath(Path path, OutputFormat format) {
        HoldingAreas.NameParts parts = HoldingAreas.splitName(path.getFileName().toString());
        String fileName = parts.stem() + "." + format.extension();
        Path candidate = path.resolveSibling(fileName);
        if (candidate.equals(path) || !isTaken(candidate)) {
            return candidate;
        }
        for (int idx = 1; ; idx++) {
            candidate = path.resolveSibling(parts.stem() + "-" + idx + "." + format.extension());
            if (!isTaken(candidate)) {
                logger.debug("{} already exists, saving as {}", fileName, candidate.getFileName());
                return candidate;
            }
        }
    }

    private boolean isTaken(Path candidate) {
        return Files.exists(candidate) || saver.isPending(candidate) || files.contains(candidate);
    }

    private void reconcile(SaveStatus saveStatus) {
        Path destination = saveStatus.getDestination();
        if (saveStatus.isSuccess()) {
            String sizes = saveStatus.getOriginalSize().isPresent() && saveStatus.getNewSize().isPresent()
                    ? " (" + HoldingAreas.formatSize(saveStatus.getOriginalSize().getAsLong())
                    + " -> " + HoldingAreas.formatSize(saveStatus.getNewSize().getAsLong()) + ")"
                    : "";
            status = "Saved " + destination + sizes;
            if (isWaitingFor(destination)) {
                if (preloader.isPending(destination)) {
                    reloadAfterFailure.add(destination);
                } else {
                    preloader.load(destination);
                }
            }
        } else {
            logger.error("Error saving {}: {}", destination, saveStatus.getError());
            status = "Error saving " + destination + ": " + saveStatus.getError();
        }
    }

    private boolean isWaitingFor(Path path) {
        return current == null && state != NavigationState.LIST_COMPLETED && path.equals(currentPath());
    }

    private void showCurrent() {
        Path path = currentPath();
        if (path == null) return;
        preloader.poll();
        Optional<ImageRecord> cached = preloader.take(path);
        if (cached.isPresent()) {
            adopt(cached.get());
        } else {
            current = null;
            preloader.load(path);
            status = loadingStatus(path);
        }
        preloadWindow();
    }

    private void adopt(ImageRecord record) {
        current = record;
        reloadAfterFailure.remove(record.path());
        status = "Loaded " + record.path() + " (" + position() + "/" + files.size() + ")";
    }

    private String loadingStatus(Path path) {
        return "Loading " + path + " (" + position() + "/" + files.size() + ")";
    }

    private void preloadWindow() {
        for (int i = 1; i <= settings.getPreloadAhead(); i++) {
            int index = cursor + i;
            if (index >= files.size()) break;
            preloader.load(files.get(index));
        }
    }

    private void terminate(String message) {
        terminated = true;
        status = message;
    }

    // --- Outputs ---

    public Optional<ImageRecord> getCurrentRecord() {
        return Optional.ofNullable(current);
    }

    /**
     @return The path at the cursor, or {@code null} when the list is empty or exhausted.
     */
    public Path currentPath() {
        return cursor < files.size() ? files.get(cursor) : null;
    }

    public List<Path> getFiles() {
        return Collections.unmodifiableList(files);
    }

    /** 1-based. */
    public int position() {
        return cursor + 1;
    }

    public int total() {
        return files.size();
    }

    public String getStatus() {
        return status;
    }

    public NavigationState getState() {
        return state;
    }

    public boolean isLoading() {
        return state != NavigationState.LIST_COMPLETED && current == null && currentPath() != null;
    }

    public boolean isListCompleted() {
        return state == NavigationState.LIST_COMPLETED;
    }

    public boolean isExiting() {
        return state == NavigationState.EXITING;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public int pendingSaveCount() {
        return saver.pendingCount();
    }

    public Set<Path> pendingSavePaths() {
        return saver.pendingPaths();
    }

    public boolean isForcedExit() {
        return exitCoordinator.isForced();
    }
}
