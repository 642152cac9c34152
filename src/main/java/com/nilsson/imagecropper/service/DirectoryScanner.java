package com.nilsson.imagecropper.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 <h2>DirectoryScanner</h2>
 <p>
 Builds the work list: every supported image under the given roots. A root may be a single file
 or a directory; directories are listed one level deep unless {@code recursive} is set.
 </p>
 <p>
 Matching is by extension only and case-insensitive. The {@code .imagecropper-*} holding
 directories are never descended into, so backups and trashed files do not come back as work.
 Flat listings are sorted by name; duplicates across roots are dropped.
 </p>
 */
public class DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
            "png", "jpg", "jpeg", "bmp", "gif", "webp", "tiff", "tif", "ico", "avif");

    /**
     Collects supported images under {@code roots}.

     @throws ScanException if a root does not exist or a directory cannot be listed.
     */
    public List<Path> collect(List<Path> roots, boolean recursive) throws ScanException {
        Set<Path> files = new LinkedHashSet<>();
        for (Path root : roots) {
            Path path = root.toAbsolutePath().normalize();
            if (!Files.exists(path)) {
                throw new ScanException(root + " does not exist");
            }

            if (Files.isRegularFile(path)) {
                if (isSupportedImage(path)) files.add(path);
            } else if (Files.isDirectory(path)) {
                if (recursive) {
                    walk(path, files);
                } else {
                    list(path, files);
                }
            }
        }
        logger.info("Collected {} image(s) from {} root(s){}", files.size(), roots.size(),
                recursive ? " (recursive)" : "");
        return new ArrayList<>(files);
    }

    /**
     Same as {@link #collect} but treats an empty result as fatal.
     */
    public List<Path> requireImages(List<Path> roots, boolean recursive) throws ScanException {
        List<Path> files = collect(roots, recursive);
        if (files.isEmpty()) {
            throw new NoImagesFoundException(roots);
        }
        return files;
    }

    public static boolean isSupportedImage(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return false;
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) return false;
        return SUPPORTED_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    // --- Internal Helpers ---

    private void list(Path dir, Set<Path> files) throws ScanException {
        try (Stream<Path> stream = Files.list(dir)) {
            files.addAll(stream
                    .filter(Files::isRegularFile)
                    .filter(DirectoryScanner::isSupportedImage)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList()));
        } catch (IOException | java.io.UncheckedIOException e) {
            throw new ScanException("Unable to read directory " + dir, e);
        }
    }

    private void walk(Path root, Set<Path> files) throws ScanException {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && HoldingAreas.isHoldingDirectory(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isSupportedImage(file)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Skipping unreadable entry {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ScanException("Unable to walk directory " + root, e);
        }
    }
}
