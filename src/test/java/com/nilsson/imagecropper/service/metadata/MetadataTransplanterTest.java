package com.nilsson.imagecropper.service.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.icc.IccDirectory;
import com.nilsson.imagecropper.TestImages;
import com.nilsson.imagecropper.model.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 Tests that ICC profiles and EXIF blocks survive a re-encode, verified with metadata-extractor.
 */
class MetadataTransplanterTest {

    @TempDir
    Path tempDir;

    private final SourceMetadataReader reader = new SourceMetadataReader();
    private final MetadataTransplanter transplanter = new MetadataTransplanter(reader);

    static final byte[] SRGB = ICC_Profile.getInstance(ColorSpace.CS_sRGB).getData();

    /**
     Minimal big-endian TIFF with one IFD0 entry: Make = "Test".
     */
    static byte[] exifWithMake() {
        return new byte[]{
                'M', 'M', 0, 42, 0, 0, 0, 8,          // header, IFD0 at 8
                0, 1,                                  // one entry
                0x01, 0x0F, 0, 2, 0, 0, 0, 5, 0, 0, 0, 26, // Make, ASCII, count 5, value at 26
                0, 0, 0, 0,                            // no next IFD
                'T', 'e', 's', 't', 0
        };
    }

    private Path jpegWithMetadata(String name) throws Exception {
        Path file = TestImages.writeJpg(tempDir.resolve(name), 16, 16, Color.RED);
        byte[] spliced = JpegSegments.splice(Files.readAllBytes(file), new SourceMetadata(SRGB, exifWithMake()));
        return Files.write(file, spliced);
    }

    private Path pngWithMetadata(String name) throws Exception {
        Path file = TestImages.writePng(tempDir.resolve(name), 16, 16, Color.RED);
        byte[] spliced = PngChunks.splice(Files.readAllBytes(file), new SourceMetadata(SRGB, exifWithMake()));
        return Files.write(file, spliced);
    }

    // --- Transplants ---

    @Test
    void testTransplant_jpegToJpegKeepsIccAndExif() throws Exception {
        Path source = jpegWithMetadata("source.jpg");
        Path encoded = TestImages.writeJpg(tempDir.resolve("encoded.jpg"), 8, 8, Color.BLUE);

        assertTrue(transplanter.transplant(source, encoded, OutputFormat.JPG));

        Metadata metadata = ImageMetadataReader.readMetadata(encoded.toFile());
        assertNotNull(metadata.getFirstDirectoryOfType(IccDirectory.class), "ICC profile should be present");
        ExifIFD0Directory exif = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        assertNotNull(exif, "EXIF should be present");
        assertEquals("Test", exif.getString(ExifIFD0Directory.TAG_MAKE));
        assertEquals(8, ImageIO.read(encoded.toFile()).getWidth(), "Output must still decode");
    }

    @Test
    void testTransplant_pngSourceIntoJpeg() throws Exception {
        Path source = pngWithMetadata("source.png");
        Path encoded = TestImages.writeJpg(tempDir.resolve("encoded.jpg"), 8, 8, Color.BLUE);

        assertTrue(transplanter.transplant(source, encoded, OutputFormat.JPG));

        SourceMetadata copied = reader.read(encoded);
        assertArrayEquals(SRGB, copied.iccProfile());
        assertArrayEquals(exifWithMake(), copied.exif());
    }

    @Test
    void testTransplant_jpegSourceIntoPng() throws Exception {
        Path source = jpegWithMetadata("source.jpg");
        Path encoded = TestImages.writePng(tempDir.resolve("encoded.png"), 8, 8, Color.BLUE);

        assertTrue(transplanter.transplant(source, encoded, OutputFormat.PNG));

        Metadata metadata = ImageMetadataReader.readMetadata(encoded.toFile());
        assertNotNull(metadata.getFirstDirectoryOfType(IccDirectory.class));
        SourceMetadata copied = reader.read(encoded);
        assertArrayEquals(SRGB, copied.iccProfile());
        assertArrayEquals(exifWithMake(), copied.exif());
        assertEquals(8, ImageIO.read(encoded.toFile()).getHeight());
    }

    @Test
    void testTransplant_webpIsNotSupported() throws Exception {
        Path source = jpegWithMetadata("source.jpg");
        Path encoded = Files.write(tempDir.resolve("encoded.webp"), "RIFF".getBytes(StandardCharsets.US_ASCII));

        assertFalse(transplanter.transplant(source, encoded, OutputFormat.WEBP));
        assertEquals("RIFF", Files.readString(encoded, StandardCharsets.US_ASCII));
    }

    @Test
    void testTransplant_sourceWithoutMetadataLeavesFileAlone() throws Exception {
        Path source = TestImages.writePng(tempDir.resolve("plain.png"), 8, 8, Color.RED);
        Path encoded = TestImages.writeJpg(tempDir.resolve("encoded.jpg"), 8, 8, Color.BLUE);
        byte[] before = Files.readAllBytes(encoded);

        assertFalse(transplanter.transplant(source, encoded, OutputFormat.JPG));
        assertArrayEquals(before, Files.readAllBytes(encoded));
    }

    @Test
    void testTransplant_corruptTargetIsLeftUntouched() throws Exception {
        Path source = jpegWithMetadata("source.jpg");
        Path encoded = Files.write(tempDir.resolve("broken.jpg"), new byte[]{1, 2, 3, 4, 5});

        assertFalse(transplanter.transplant(source, encoded, OutputFormat.JPG));
        assertArrayEquals(new byte[]{1, 2, 3, 4, 5}, Files.readAllBytes(encoded));
    }

    @Test
    void testTransplant_replacesExistingSegmentsInsteadOfDuplicating() throws Exception {
        Path source = jpegWithMetadata("source.jpg");
        Path encoded = jpegWithMetadata("encoded.jpg");
        long before = Files.size(encoded);

        assertTrue(transplanter.transplant(source, encoded, OutputFormat.JPG));

        assertEquals(before, Files.size(encoded));
    }

    // --- Reader ---

    @Test
    void testRead_largeIccProfileSpansSegments() throws Exception {
        byte[] profile = new byte[JpegSegments.MAX_ICC_CHUNK * 2 + 100];
        for (int i = 0; i < profile.length; i++) profile[i] = (byte) (i * 31);
        Path file = TestImages.writeJpg(tempDir.resolve("big.jpg"), 8, 8, Color.RED);
        Files.write(file, JpegSegments.splice(Files.readAllBytes(file), new SourceMetadata(profile, null)));

        SourceMetadata read = reader.read(file);

        assertArrayEquals(profile, read.iccProfile());
        assertNull(read.exif());
    }

    @Test
    void testRead_unsupportedContainerIsEmpty() throws Exception {
        Path file = Files.write(tempDir.resolve("x.gif"), "GIF89a".getBytes(StandardCharsets.US_ASCII));
        assertTrue(reader.read(file).isEmpty());
    }
}
