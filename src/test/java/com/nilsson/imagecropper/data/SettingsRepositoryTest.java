package com.nilsson.imagecropper.data;

import com.nilsson.imagecropper.model.OutputFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 Tests for {@link SettingsRepository}: defaults, partial files, clamping and parse failures.
 */
class SettingsRepositoryTest {

    @TempDir
    Path tempDir;

    private final SettingsRepository repository = new SettingsRepository();

    @AfterEach
    void clearProperty() {
        System.clearProperty(SettingsRepository.CONFIG_PROPERTY);
    }

    @Test
    void testLoad_missingFileGivesDefaults() throws IOException {
        CropperSettings settings = repository.load(tempDir.resolve("absent.json"));

        assertEquals(OutputFormat.JPG, settings.getOutputFormat());
        assertEquals(60, settings.getQuality());
        assertEquals(4, settings.getSaverThreads());
        assertEquals(Runtime.getRuntime().availableProcessors(), settings.getLoaderThreads());
        assertEquals(3, settings.getPreloadAhead());
        assertEquals(3, settings.getForceExitThreshold());
        assertTrue(settings.isShuffle());
        assertFalse(settings.isDryRun());
        assertFalse(settings.isResaveOnLeave());
    }

    @Test
    void testLoad_partialFileOverridesOnlyGivenKeys() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cfg.json"),
                "{ \"outputFormat\": \"webp\", \"dryRun\": true, \"somethingElse\": 1 }");

        CropperSettings settings = repository.load(file);

        assertEquals(OutputFormat.WEBP, settings.getOutputFormat());
        assertTrue(settings.isDryRun());
        assertEquals(60, settings.getQuality());
    }

    @Test
    void testLoad_clampsOutOfRangeValues() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cfg.json"),
                "{ \"quality\": 400, \"loaderThreads\": 0, \"saverThreads\": -2 }");

        CropperSettings settings = repository.load(file);

        assertEquals(100, settings.getQuality());
        assertEquals(1, settings.getLoaderThreads());
        assertEquals(1, settings.getSaverThreads());
    }

    @Test
    void testLoad_jpegAliasAccepted() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cfg.json"), "{ \"outputFormat\": \"JPEG\" }");
        assertEquals(OutputFormat.JPG, repository.load(file).getOutputFormat());
    }

    @Test
    void testLoad_malformedFileFails() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cfg.json"), "{ not json");
        assertThrows(IOException.class, () -> repository.load(file));
    }

    @Test
    void testLoad_unknownFormatFails() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cfg.json"), "{ \"outputFormat\": \"avif\" }");
        assertThrows(IOException.class, () -> repository.load(file));
    }

    @Test
    void testResolveLocation_honoursSystemProperty() {
        Path custom = tempDir.resolve("custom.json");
        System.setProperty(SettingsRepository.CONFIG_PROPERTY, custom.toString());

        assertEquals(custom, repository.resolveLocation());
    }
}
