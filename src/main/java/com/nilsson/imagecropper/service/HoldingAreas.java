package com.nilsson.imagecropper.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 <h2>HoldingAreas</h2>
 <p>
 File system helpers for the hidden holding directories that sit next to every processed image.
 Nothing in this class ever overwrites an existing file: when a name is taken, an incrementing
 {@code -N} suffix is appended to the stem.
 </p>
 <ul>
 <li>{@value #TRASH_DIR} receives deleted originals.</li>
 <li>{@value #ORIGINALS_DIR} receives backups taken before an overwrite or conversion.</li>
 <li>{@value #TEMP_DIR} holds encodes in progress until they are published.</li>
 </ul>
 <p>
 Saver workers share these directories, so a free name is claimed by atomically creating an empty
 placeholder ({@link #reserveUnique}) before anything is moved into it.
 </p>
 */
public final class HoldingAreas {

    private static final Logger logger = LoggerFactory.getLogger(HoldingAreas.class);

    public static final String TRASH_DIR = ".imagecropper-trash";
    public static final String ORIGINALS_DIR = ".imagecropper-originals";
    public static final String TEMP_DIR = ".imagecropper-tmp";

    private static final String HOLDING_PREFIX = ".imagecropper-";

    private HoldingAreas() {}

    // --- Directories ---

    /**
     Creates {@code base/name} (including missing parents) and returns it.
     */
    public static Path prepareDir(Path base, String name) throws IOException {
        Path dir = base.resolve(name);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IOException("Unable to create " + dir, e);
        }
        return dir;
    }

    /**
     Creates the holding directory {@code name} next to {@code file}.
     */
    public static Path prepareSiblingDir(Path file, String name) throws IOException {
        return prepareDir(parentOf(file), name);
    }

    public static boolean isHoldingDirectory(Path dir) {
        Path fileName = dir.getFileName();
        return fileName != null && fileName.toString().startsWith(HOLDING_PREFIX);
    }

    // --- Naming ---

    /**
     Splits a file name at its last dot. {@code "photo.avif"} gives {@code ("photo", "avif")},
     {@code "archive"} gives {@code ("archive", null)}.
     */
    public static NameParts splitName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return new NameParts(fileName, null);
        }
        return new NameParts(fileName.substring(0, dot), fileName.substring(dot + 1));
    }

    /**
     Returns {@code dir/fileName} if it does not exist yet, otherwise the first free
     {@code stem-N.ext} with N counting up from 1.
     */
    public static Path uniqueDestination(Path dir, String fileName) {
        Path candidate = dir.resolve(fileName);
        if (!Files.exists(candidate)) {
            return candidate;
        }
        NameParts parts = splitName(fileName);
        for (int idx = 1; ; idx++) {
            candidate = dir.resolve(parts.withSuffix(idx));
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }

    /**
     Claims a free name in {@code dir} by creating an empty file there. Safe against other threads
     picking the same name concurrently.
     */
    public static Path reserveUnique(Path dir, String fileName) throws IOException {
        while (true) {
            Path candidate = uniqueDestination(dir, fileName);
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException raced) {
                logger.debug("Name {} was claimed concurrently, retrying", candidate.getFileName());
            }
        }
    }

    // --- Moves ---

    /**
     Moves {@code source} into {@code targetDir} under a collision-free name.

     @return The path the file now lives at.
     */
    public static Path moveWithUniqueName(Path source, Path targetDir) throws IOException {
        Path fileName = source.getFileName();
        if (fileName == null) {
            throw new IOException(source + " has no file name");
        }
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString(), null, "Unable to move, file does not exist");
        }

        Path destination = reserveUnique(targetDir, fileName.toString());
        try {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(destination);
            throw new IOException("Unable to move " + source + " to " + destination, e);
        }
        return destination;
    }

    /**
     Moves {@code path} into its sibling {@value #ORIGINALS_DIR} directory.
     */
    public static Path backupOriginal(Path path) throws IOException {
        return moveWithUniqueName(path, prepareSiblingDir(path, ORIGINALS_DIR));
    }

    /**
     Moves {@code path} into its sibling {@value #TRASH_DIR} directory.
     */
    public static Path moveToTrash(Path path) throws IOException {
        return moveWithUniqueName(path, prepareSiblingDir(path, TRASH_DIR));
    }

    // --- Formatting ---

    /**
     Formats a byte count with 1024-based units: {@code 0 -> "0 B"}, {@code 2048 -> "2.0 KB"},
     {@code 1_500_000 -> "1.4 MB"}.
     */
    public static String formatSize(long bytes) {
        final double kb = 1024.0;
        final double mb = kb * 1024.0;
        final double gb = mb * 1024.0;

        if (bytes <= 0) return "0 B";
        double b = bytes;
        if (b < kb) return bytes + " B";
        if (b < mb) return String.format(Locale.ROOT, "%.1f KB", b / kb);
        if (b < gb) return String.format(Locale.ROOT, "%.1f MB", b / mb);
        return String.format(Locale.ROOT, "%.2f GB", b / gb);
    }

    private static Path parentOf(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }

    /**
     A file name split at its last dot. {@code extension} is {@code null} when there is no dot.
     */
    public record NameParts(String stem, String extension) {

        String withSuffix(int idx) {
            return extension == null ? stem + "-" + idx : stem + "-" + idx + "." + extension;
        }
    }
}
