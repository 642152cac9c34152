package com.nilsson.imagecropper.service;

import com.nilsson.imagecropper.TestImages;
import com.nilsson.imagecropper.model.ImageRecord;
import com.nilsson.imagecropper.service.strategy.DecodeStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ImageDecoderTest {

    @TempDir
    Path tempDir;

    @Test
    void testDecode_jpegThroughDefaultStrategies() throws Exception {
        Path file = TestImages.writeJpg(tempDir.resolve("photo.jpg"), 64, 48, Color.ORANGE);

        ImageRecord record = new ImageDecoder().decode(file);

        assertEquals(64, record.width());
        assertEquals(48, record.height());
        assertEquals(BufferedImage.TYPE_INT_ARGB, record.displayImage().getType());
        assertTrue(record.timings().total().toNanos() >= 0);
    }

    @Test
    void testDecode_fallsThroughToNextStrategy() throws Exception {
        Path file = Files.write(tempDir.resolve("any.png"), new byte[]{9});
        DecodeStrategy failing = mock(DecodeStrategy.class);
        when(failing.name()).thenReturn("failing");
        when(failing.appliesTo(any())).thenReturn(true);
        when(failing.decode(any(), any())).thenReturn(Optional.empty());
        DecodeStrategy working = mock(DecodeStrategy.class);
        when(working.appliesTo(any())).thenReturn(true);
        when(working.decode(any(), any())).thenReturn(Optional.of(TestImages.solid(5, 5, Color.BLACK)));

        ImageRecord record = new ImageDecoder(List.of(failing, working)).decode(file);

        assertEquals(5, record.width());
        verify(failing).decode(eq(file), any());
    }

    @Test
    void testDecode_skipsStrategiesThatDoNotApply() throws Exception {
        Path file = Files.write(tempDir.resolve("any.png"), new byte[]{9});
        DecodeStrategy jpegOnly = mock(DecodeStrategy.class);
        when(jpegOnly.appliesTo(any())).thenReturn(false);

        assertThrows(DecodeException.class, () -> new ImageDecoder(List.of(jpegOnly)).decode(file));
        verify(jpegOnly, never()).decode(any(), any());
    }

    @Test
    void testDecode_garbageFails() throws Exception {
        Path file = Files.write(tempDir.resolve("garbage.jpg"), "not an image".getBytes());

        DecodeException e = assertThrows(DecodeException.class, () -> new ImageDecoder().decode(file));
        assertEquals(file, e.getPath());
    }

    @Test
    void testFitWithin_preservesAspectRatio() {
        assertEquals(3840, ImageResizer.fitWithin(4000, 1000, 3840, 2160).width);
        assertEquals(960, ImageResizer.fitWithin(4000, 1000, 3840, 2160).height);
        assertEquals(100, ImageResizer.fitWithin(100, 50, 3840, 2160).width, "Small images are untouched");
    }
}
