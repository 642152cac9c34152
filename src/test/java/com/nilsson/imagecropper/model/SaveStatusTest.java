package com.nilsson.imagecropper.model;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SaveStatusTest {

    @Test
    void testSuccess_reportsSizeDelta() {
        SaveStatus status = SaveStatus.success(Path.of("x.jpg"), 3000L, 1000L, true);

        assertTrue(status.isSuccess());
        assertNull(status.getError());
        assertEquals(-2000, status.getSizeDelta().getAsLong());
        assertTrue(status.isMetadataCopied());
    }

    @Test
    void testFailure_hasNoNewSize() {
        SaveStatus status = SaveStatus.failure(Path.of("x.jpg"), "boom", null);

        assertFalse(status.isSuccess());
        assertEquals("boom", status.getError());
        assertTrue(status.getNewSize().isEmpty());
        assertTrue(status.getSizeDelta().isEmpty());
    }

    @Test
    void testSaveRequest_rejectsQualityOutOfRange() {
        BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        assertThrows(IllegalArgumentException.class,
                () -> new SaveRequest(image, Path.of("a.jpg"), Path.of("a.png"), 0, OutputFormat.JPG));
        assertThrows(IllegalArgumentException.class,
                () -> new SaveRequest(image, Path.of("a.jpg"), Path.of("a.png"), 101, OutputFormat.JPG));
    }
}
