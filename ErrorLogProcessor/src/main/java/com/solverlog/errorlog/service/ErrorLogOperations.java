package com.solverlog.errorlog.service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Operations exposed to the dispatch layer. Built once and injected by
 * reference into the controllers.
 */
public interface ErrorLogOperations {

    /**
     * Imports a log file in one transaction.
     *
     * @return the job id read from the header
     */
    long importLog(Path file);

    /**
     * Sends the serialized aggregate of a job to the channel, from cache when possible.
     */
    void queryAggregate(long jobId, PayloadChannel channel);

    /**
     * Seconds between the first and last record of a job.
     */
    Optional<Double> totalTime(long jobId);

    /**
     * Drops every cached aggregate.
     */
    void clearCache();
}
