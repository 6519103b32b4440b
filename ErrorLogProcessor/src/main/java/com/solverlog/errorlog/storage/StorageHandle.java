package com.solverlog.errorlog.storage;

import com.solverlog.errorlog.config.DatabaseSettings;
import com.solverlog.errorlog.config.DatabaseSettingsStore;
import com.solverlog.errorlog.config.ErrorLogProperties;
import com.solverlog.errorlog.exception.ErrorKind;
import com.solverlog.errorlog.exception.ErrorLogException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The single shared connection pool, swappable at runtime.
 *
 * Imports and queries run under the read lock; {@link #reconfigure} takes the
 * write lock, so a swap waits for running work and blocks new work until the
 * new pool is in place. A replacement pool is only swapped in after it has
 * handed out a connection.
 */
@Slf4j
@Component
public class StorageHandle {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Function<DatabaseSettings, DataSource> dataSourceFactory;

    private DataSource dataSource;
    private DatabaseSettings settings;

    @Autowired
    public StorageHandle(ErrorLogProperties properties, DatabaseSettingsStore settingsStore) {
        this(settingsStore.load().orElse(properties.getDatabase()),
            settings -> createPool(settings,
                properties.getStorage().getMaximumPoolSize(),
                properties.getStorage().getConnectionTimeoutMs()));
    }

    public StorageHandle(DatabaseSettings settings, Function<DatabaseSettings, DataSource> dataSourceFactory) {
        this.dataSourceFactory = dataSourceFactory;
        this.settings = settings;
        this.dataSource = dataSourceFactory.apply(settings);
        log.info("Storage handle opened for {}", settings.jdbcUrl());
    }

    /**
     * Runs the work against the current pool while holding the shared lock.
     */
    public <T> T withDataSource(Function<DataSource, T> work) {
        lock.readLock().lock();
        try {
            return work.apply(dataSource);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void reconfigure(DatabaseSettings next) {
        reconfigure(next, dataSource -> { });
    }

    /**
     * Replaces the pool with one built from the given settings and closes the old one.
     * The new pool must hand out a connection and pass {@code preparation} first;
     * otherwise it is closed and the current pool stays in place.
     *
     * @throws ErrorLogException (STORAGE) if the new database cannot be reached
     */
    public void reconfigure(DatabaseSettings next, Consumer<DataSource> preparation) {
        DataSource replacement = dataSourceFactory.apply(next);
        try {
            verify(replacement, next);
            preparation.accept(replacement);
        } catch (RuntimeException e) {
            close(replacement);
            log.warn("Kept current database, {} rejected: {}", next.jdbcUrl(), e.getMessage());
            throw e;
        }

        DataSource previous;

        lock.writeLock().lock();
        try {
            previous = dataSource;
            dataSource = replacement;
            settings = next;
            log.info("Storage handle switched to {}", next.jdbcUrl());
        } finally {
            lock.writeLock().unlock();
        }

        close(previous);
    }

    public DatabaseSettings currentSettings() {
        lock.readLock().lock();
        try {
            return settings;
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        lock.writeLock().lock();
        try {
            close(dataSource);
            log.info("Storage handle closed");
        } finally {
            lock.writeLock().unlock();
        }
    }

    static DataSource createPool(DatabaseSettings settings, int maximumPoolSize, long connectionTimeoutMs) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(settings.jdbcUrl());
        cfg.setUsername(settings.getUser());
        cfg.setPassword(settings.getPassword());
        cfg.setMaximumPoolSize(maximumPoolSize);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(connectionTimeoutMs);
        cfg.setPoolName("solverlog-" + settings.getHost() + "-" + settings.getDatabase());
        // start even if the database is not reachable yet
        cfg.setInitializationFailTimeout(-1);
        return new HikariDataSource(cfg);
    }

    private static void verify(DataSource ds, DatabaseSettings settings) {
        try (Connection connection = ds.getConnection()) {
            log.debug("Connection check passed for {}", settings.jdbcUrl());
        } catch (SQLException e) {
            throw new ErrorLogException(ErrorKind.STORAGE,
                "Cannot connect to " + settings.jdbcUrl() + ": " + e.getMessage(), e);
        }
    }

    private void close(DataSource ds) {
        if (ds instanceof AutoCloseable) {
            try {
                ((AutoCloseable) ds).close();
            } catch (Exception e) {
                log.warn("Error closing connection pool: {}", e.getMessage());
            }
        }
    }
}
