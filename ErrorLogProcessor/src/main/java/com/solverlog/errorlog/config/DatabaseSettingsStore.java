package com.solverlog.errorlog.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.solverlog.errorlog.exception.ErrorKind;
import com.solverlog.errorlog.exception.ErrorLogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Loads and saves the database settings chosen at runtime as a JSON file,
 * so a reconfigured connection survives a restart.
 */
@Slf4j
@Component
public class DatabaseSettingsStore {

    private final ObjectMapper objectMapper;
    private final Path file;

    @Autowired
    public DatabaseSettingsStore(ObjectMapper objectMapper, ErrorLogProperties properties) {
        this(objectMapper, toPath(properties.getSettingsFile()));
    }

    public DatabaseSettingsStore(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.file = file;
    }

    /**
     * Returns the saved settings, or empty when persistence is disabled or nothing was saved yet.
     */
    public Optional<DatabaseSettings> load() {
        if (file == null || !Files.exists(file)) {
            return Optional.empty();
        }
        try {
            DatabaseSettings settings = objectMapper.readValue(file.toFile(), DatabaseSettings.class);
            log.info("Loaded database settings from {}", file);
            return Optional.of(settings);
        } catch (IOException e) {
            throw new ErrorLogException(ErrorKind.IO, "Cannot read database settings from " + file + ": " + e.getMessage(), e);
        }
    }

    public void save(DatabaseSettings settings) {
        if (file == null) {
            log.debug("No settings file configured, database settings not saved");
            return;
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), settings);
            log.info("Saved database settings to {}", file);
        } catch (IOException e) {
            throw new ErrorLogException(ErrorKind.IO, "Cannot write database settings to " + file + ": " + e.getMessage(), e);
        }
    }

    private static Path toPath(String location) {
        return location == null || location.isBlank() ? null : Paths.get(location);
    }
}
