package com.solverlog.errorlog;

import com.solverlog.errorlog.config.ErrorLogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * ErrorLogProcessor - Solver Error Log Import and Aggregates
 *
 * This application imports solver log files (job header, parameter blob and
 * per-iteration error metrics) into PostgreSQL and serves per-job aggregate
 * views back to the caller.
 *
 * Features:
 * - Parallel, order-preserving log transcoding to CSV
 * - All-or-nothing import through a single COPY transaction
 * - Bounded gzip-compressed result cache in front of the aggregate queries
 * - Runtime database reconfiguration with settings persistence
 * - REST API for import, job management and aggregates
 */
@SpringBootApplication
@EnableConfigurationProperties(ErrorLogProperties.class)
public class ErrorLogProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ErrorLogProcessorApplication.class, args);
    }
}
