package com.solverlog.errorlog.service;

import com.solverlog.errorlog.cache.SharedResultCache;
import com.solverlog.errorlog.config.DatabaseSettings;
import com.solverlog.errorlog.config.DatabaseSettingsStore;
import com.solverlog.errorlog.config.ErrorLogProperties;
import com.solverlog.errorlog.storage.ErrorLogRepository;
import com.solverlog.errorlog.storage.StorageHandle;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Database connection lifecycle: schema check at startup, runtime switch to
 * new settings, persistence of the chosen settings.
 */
@Slf4j
@Service
public class DatabaseConfigService {

    private final StorageHandle storageHandle;
    private final DatabaseSettingsStore settingsStore;
    private final ErrorLogRepository repository;
    private final SharedResultCache cache;
    private final boolean initializeSchema;

    public DatabaseConfigService(StorageHandle storageHandle,
                                 DatabaseSettingsStore settingsStore,
                                 ErrorLogRepository repository,
                                 SharedResultCache cache,
                                 ErrorLogProperties properties) {
        this.storageHandle = storageHandle;
        this.settingsStore = settingsStore;
        this.repository = repository;
        this.cache = cache;
        this.initializeSchema = properties.getStorage().isInitializeSchema();
    }

    @PostConstruct
    public void init() {
        if (!initializeSchema) {
            return;
        }
        try {
            repository.ensureSchema();
        } catch (Exception e) {
            log.warn("Schema check skipped, database not available: {}", e.getMessage());
        }
    }

    public DatabaseSettings currentSettings() {
        return storageHandle.currentSettings();
    }

    /**
     * Switches the shared connection to the given settings, then saves them.
     *
     * The new database is reached and, when enabled, its schema checked before
     * the swap; on failure nothing changes. Cached aggregates belong to the
     * previous database and are dropped.
     */
    public DatabaseSettings reconfigure(DatabaseSettings settings) {
        log.info("Reconfiguring database connection to {}", settings.jdbcUrl());
        storageHandle.reconfigure(settings, dataSource -> {
            if (initializeSchema) {
                repository.ensureSchema(dataSource);
            }
        });
        cache.clear();
        settingsStore.save(settings);
        return storageHandle.currentSettings();
    }
}
