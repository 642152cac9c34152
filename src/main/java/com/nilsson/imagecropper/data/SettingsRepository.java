package com.nilsson.imagecropper.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 Loads {@link CropperSettings} from a JSON file.
 <p>
 The file is {@value #DEFAULT_FILE} in the working directory unless the system property
 {@value #CONFIG_PROPERTY} points elsewhere. A missing file yields the defaults.
 </p>
 */
public class SettingsRepository {

    private static final Logger logger = LoggerFactory.getLogger(SettingsRepository.class);

    public static final String DEFAULT_FILE = "imagecropper.json";
    public static final String CONFIG_PROPERTY = "imagecropper.config";

    private final ObjectMapper mapper;

    public SettingsRepository() {
        this(new ObjectMapper());
    }

    public SettingsRepository(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Path resolveLocation() {
        String override = System.getProperty(CONFIG_PROPERTY);
        return override != null && !override.isBlank() ? Path.of(override) : Path.of(DEFAULT_FILE);
    }

    public CropperSettings load() throws IOException {
        return load(resolveLocation());
    }

    /**
     @throws IOException if the file exists but cannot be read or parsed.
     */
    public CropperSettings load(Path file) throws IOException {
        if (!Files.exists(file)) {
            logger.info("No settings file at {}, using defaults", file.toAbsolutePath());
            return new CropperSettings().validated();
        }
        try {
            CropperSettings settings = mapper.readValue(file.toFile(), CropperSettings.class);
            if (settings == null) {
                return new CropperSettings().validated();
            }
            logger.info("Loaded settings from {}", file.toAbsolutePath());
            return settings.validated();
        } catch (IOException e) {
            logger.error("Failed to parse settings file {}", file, e);
            throw new IOException("Invalid settings file " + file + ": " + e.getMessage(), e);
        }
    }
}
