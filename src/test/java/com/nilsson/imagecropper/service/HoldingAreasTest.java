package com.nilsson.imagecropper.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 Tests for the holding-directory helpers: collision-safe naming, backups and trash moves.
 */
class HoldingAreasTest {

    @TempDir
    Path tempDir;

    // --- Naming ---

    @Test
    void testSplitName_withAndWithoutExtension() {
        HoldingAreas.NameParts photo = HoldingAreas.splitName("photo.avif");
        assertEquals("photo", photo.stem());
        assertEquals("avif", photo.extension());

        HoldingAreas.NameParts archive = HoldingAreas.splitName("archive");
        assertEquals("archive", archive.stem());
        assertNull(archive.extension());
    }

    @Test
    void testUniqueDestination_addsIncrementingSuffix() throws IOException {
        Files.write(tempDir.resolve("image.png"), new byte[0]);
        Files.write(tempDir.resolve("image-1.png"), new byte[0]);

        Path candidate = HoldingAreas.uniqueDestination(tempDir, "image.png");

        assertEquals("image-2.png", candidate.getFileName().toString());
    }

    @Test
    void testUniqueDestination_freeNameIsKept() {
        assertEquals(tempDir.resolve("fresh.jpg"), HoldingAreas.uniqueDestination(tempDir, "fresh.jpg"));
    }

    @Test
    void testReserveUnique_concurrentCallersGetDistinctNames() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Path>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return HoldingAreas.reserveUnique(tempDir, "same.png");
                }));
            }
            go.countDown();

            List<Path> reserved = new ArrayList<>();
            for (Future<Path> f : futures) reserved.add(f.get());

            assertEquals(callers, new HashSet<>(reserved).size(), "Every caller must get its own name");
            for (Path p : reserved) assertTrue(Files.exists(p));
        } finally {
            pool.shutdownNow();
        }
    }

    // --- Moves ---

    @Test
    void testBackupOriginal_movesIntoOriginalsDir() throws IOException {
        Path source = Files.write(tempDir.resolve("sample.png"), "data".getBytes());

        Path backup = HoldingAreas.backupOriginal(source);

        assertFalse(Files.exists(source));
        assertEquals(tempDir.resolve(HoldingAreas.ORIGINALS_DIR).resolve("sample.png"), backup);
        assertEquals("data", Files.readString(backup));
    }

    @Test
    void testBackupOriginal_collisionKeepsBothCopies() throws IOException {
        Path first = Files.write(tempDir.resolve("sample.png"), "one".getBytes());
        HoldingAreas.backupOriginal(first);
        Path second = Files.write(tempDir.resolve("sample.png"), "two".getBytes());

        Path backup = HoldingAreas.backupOriginal(second);

        assertEquals("sample-1.png", backup.getFileName().toString());
        Path originals = tempDir.resolve(HoldingAreas.ORIGINALS_DIR);
        assertEquals("one", Files.readString(originals.resolve("sample.png")));
        assertEquals("two", Files.readString(backup));
    }

    @Test
    void testMoveToTrash_missingSourceFails() {
        assertThrows(NoSuchFileException.class, () -> HoldingAreas.moveToTrash(tempDir.resolve("ghost.png")));
    }

    @Test
    void testMoveToTrash_movesIntoTrashDir() throws IOException {
        Path source = Files.write(tempDir.resolve("bad.jpg"), new byte[]{1, 2, 3});

        Path trashed = HoldingAreas.moveToTrash(source);

        assertFalse(Files.exists(source));
        assertEquals(tempDir.resolve(HoldingAreas.TRASH_DIR), trashed.getParent());
    }

    @Test
    void testIsHoldingDirectory() {
        assertTrue(HoldingAreas.isHoldingDirectory(tempDir.resolve(HoldingAreas.TRASH_DIR)));
        assertTrue(HoldingAreas.isHoldingDirectory(tempDir.resolve(HoldingAreas.TEMP_DIR)));
        assertFalse(HoldingAreas.isHoldingDirectory(tempDir.resolve("photos")));
    }

    // --- Formatting ---

    @Test
    void testFormatSize() {
        assertEquals("0 B", HoldingAreas.formatSize(0));
        assertEquals("512 B", HoldingAreas.formatSize(512));
        assertEquals("2.0 KB", HoldingAreas.formatSize(2048));
        assertEquals("1.4 MB", HoldingAreas.formatSize(1_500_000));
        assertEquals("2.00 GB", HoldingAreas.formatSize(2L * 1024 * 1024 * 1024));
    }
}
