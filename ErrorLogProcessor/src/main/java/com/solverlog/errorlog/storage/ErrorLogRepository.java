package com.solverlog.errorlog.storage;

import com.solverlog.errorlog.model.ErrorLogEntry;
import com.solverlog.errorlog.model.ErrorLogSummary;
import com.solverlog.errorlog.model.JobInfo;
import com.solverlog.errorlog.model.JobSummary;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Persistence of jobs and their error log records.
 *
 * Implementations throw {@link com.solverlog.errorlog.exception.ErrorLogException}
 * of kind STORAGE on any database failure.
 */
public interface ErrorLogRepository {

    /**
     * Creates tables and the per load step summary view if missing.
     */
    void ensureSchema();

    /**
     * Same as {@link #ensureSchema()} against a pool that is not in use yet.
     */
    void ensureSchema(DataSource dataSource);

    /**
     * Runs the work against the current pool, holding it until the work returns.
     * Reads passed that pool see the same database even if a reconfiguration
     * is requested meanwhile. The work must not call the pool-less variants.
     */
    <T> T withStorage(Function<DataSource, T> work);

    /**
     * Inserts the job row and bulk-loads its CSV rows in one transaction.
     *
     * @return number of records loaded
     */
    long importJob(long jobId, JobInfo jobInfo, String csvRows);

    /**
     * Per-iteration series ordered by timestamp.
     */
    List<ErrorLogEntry> findEntries(long jobId);

    List<ErrorLogEntry> findEntries(DataSource dataSource, long jobId);

    /**
     * Per load step summary in chronological order.
     */
    List<ErrorLogSummary> findSummary(long jobId);

    List<ErrorLogSummary> findSummary(DataSource dataSource, long jobId);

    /**
     * Seconds between the first and last record, empty if the job has none.
     */
    Optional<Double> totalTime(long jobId);

    List<JobSummary> findAllJobs();

    Optional<JobSummary> findJob(long jobId);

    /**
     * Deletes the job and, by cascade, its records.
     *
     * @return true if a job was deleted
     */
    boolean removeJob(long jobId);
}
