package com.solverlog.errorlog.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed binding for all solverlog.* configuration.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "solverlog")
public class ErrorLogProperties {

    /** Initial database connection. Overridden by the settings file when present. */
    @Valid
    private DatabaseSettings database = new DatabaseSettings();

    /** JSON file where reconfigured database settings are saved. Empty = no persistence. */
    private String settingsFile = "config/database.json";

    private Storage storage = new Storage();

    private Cache cache = new Cache();

    private Parser parser = new Parser();

    private Query query = new Query();

    @Data
    public static class Storage {

        /** Hikari pool size per connection handle. */
        @Min(2)
        private int maximumPoolSize = 8;

        /** How long a caller waits for a pooled connection, also bounds the check on reconfigure. */
        @Min(250)
        private long connectionTimeoutMs = 5000;

        /** Create tables and the summary view at startup if missing. */
        private boolean initializeSchema = true;
    }

    @Data
    public static class Cache {

        /** Maximum number of job aggregates kept in memory. */
        @Min(1)
        private int capacity = 8;
    }

    @Data
    public static class Parser {

        /** Worker threads for metric line transcoding. 1 = sequential. */
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Query {

        /** Threads running the aggregate reads. */
        @Min(2)
        private int threads = 4;

        /** Threads populating the cache after a miss. */
        @Min(1)
        private int cacheThreads = 1;
    }
}
