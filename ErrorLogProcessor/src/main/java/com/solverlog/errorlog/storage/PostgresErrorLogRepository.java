package com.solverlog.errorlog.storage;

import com.solverlog.errorlog.exception.ErrorKind;
import com.solverlog.errorlog.exception.ErrorLogException;
import com.solverlog.errorlog.model.ErrorLogEntry;
import com.solverlog.errorlog.model.ErrorLogSummary;
import com.solverlog.errorlog.model.JobInfo;
import com.solverlog.errorlog.model.JobSummary;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.postgresql.PGConnection;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.StringReader;
import java.sql.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * PostgreSQL storage through ActiveJDBC. Every call opens a connection on the
 * calling thread from the current {@link StorageHandle} pool and closes it
 * before returning.
 */
@Slf4j
@Component
public class PostgresErrorLogRepository implements ErrorLogRepository {

    private static final List<String> SCHEMA = List.of(
        "CREATE TABLE IF NOT EXISTS job_info (" +
            "id BIGINT PRIMARY KEY, " +
            "name TEXT NOT NULL, " +
            "queue TEXT NOT NULL, " +
            "num_cpu INTEGER NOT NULL, " +
            "nodes TEXT[] NOT NULL DEFAULT '{}', " +
            "parameters TEXT)",
        "CREATE TABLE IF NOT EXISTS error_log (" +
            "timestamp TIMESTAMP NOT NULL, " +
            "load DOUBLE PRECISION NOT NULL, " +
            "iter INTEGER NOT NULL, " +
            "error_u DOUBLE PRECISION NOT NULL, " +
            "error_phi DOUBLE PRECISION NOT NULL, " +
            "job_id BIGINT NOT NULL REFERENCES job_info (id) ON DELETE CASCADE)",
        "CREATE INDEX IF NOT EXISTS idx_error_log_job_time ON error_log (job_id, timestamp)",
        // one row per load step: iterations to converge and when the step ran
        "CREATE OR REPLACE VIEW error_log_summary AS " +
            "SELECT job_id, load, MAX(iter) AS iters, MIN(timestamp) AS started_at, MAX(timestamp) AS finished_at " +
            "FROM error_log GROUP BY job_id, load"
    );

    private static final String INSERT_JOB_SQL =
        "INSERT INTO job_info (id, name, queue, num_cpu, nodes, parameters) VALUES (?, ?, ?, ?, ?, ?)";

    private static final String COPY_SQL =
        "COPY error_log (timestamp, load, iter, error_u, error_phi, job_id) FROM STDIN (FORMAT csv)";

    private static final String ENTRIES_SQL =
        "SELECT (ROW_NUMBER() OVER (ORDER BY timestamp))::INTEGER AS iters, load, error_u, error_phi " +
        "FROM error_log WHERE job_id = ? ORDER BY timestamp";

    private static final String SUMMARY_SQL =
        "SELECT load, iters, " +
        "EXTRACT(EPOCH FROM LEAD(started_at) OVER (ORDER BY started_at) - started_at)::DOUBLE PRECISION AS cost " +
        "FROM error_log_summary WHERE job_id = ? ORDER BY started_at";

    private static final String TOTAL_TIME_SQL =
        "SELECT EXTRACT(EPOCH FROM MAX(timestamp) - MIN(timestamp))::DOUBLE PRECISION AS total " +
        "FROM error_log WHERE job_id = ?";

    private static final String JOB_COLUMNS = "SELECT id, name, queue, num_cpu, nodes, parameters FROM job_info";

    private final StorageHandle storage;

    public PostgresErrorLogRepository(StorageHandle storage) {
        this.storage = storage;
    }

    @FunctionalInterface
    private interface SessionWork<T> {
        T run() throws Exception;
    }

    @Override
    public void ensureSchema() {
        storage.withDataSource(dataSource -> {
            ensureSchema(dataSource);
            return null;
        });
    }

    @Override
    public void ensureSchema(DataSource dataSource) {
        inSession(dataSource, "Schema initialization", () -> {
            for (String ddl : SCHEMA) {
                Base.exec(ddl);
            }
            return null;
        });
        log.info("Schema verified: job_info, error_log, error_log_summary");
    }

    @Override
    public <T> T withStorage(Function<DataSource, T> work) {
        return storage.withDataSource(work);
    }

    @Override
    public long importJob(long jobId, JobInfo jobInfo, String csvRows) {
        return inSession("Import of job " + jobId, () -> {
            Base.openTransaction();
            try {
                Array nodes = Base.connection().createArrayOf("text", jobInfo.getNodes().toArray());
                Base.exec(INSERT_JOB_SQL,
                    jobId, jobInfo.getName(), jobInfo.getQueue(), jobInfo.getNumCpu(), nodes, jobInfo.getParameters());

                long copied = Base.connection()
                    .unwrap(PGConnection.class)
                    .getCopyAPI()
                    .copyIn(COPY_SQL, new StringReader(csvRows));

                Base.commitTransaction();
                log.debug("Committed job {} with {} records", jobId, copied);
                return copied;
            } catch (Exception e) {
                rollback(jobId, e);
                throw e;
            }
        });
    }

    @Override
    public List<ErrorLogEntry> findEntries(long jobId) {
        return storage.withDataSource(dataSource -> findEntries(dataSource, jobId));
    }

    @Override
    public List<ErrorLogEntry> findEntries(DataSource dataSource, long jobId) {
        return inSession(dataSource, "Error log query for job " + jobId, () -> {
            List<ErrorLogEntry> entries = new ArrayList<>();
            for (Map<String, Object> row : Base.findAll(ENTRIES_SQL, jobId)) {
                entries.add(ErrorLogEntry.builder()
                    .iters(toInt(row.get("iters")))
                    .load(toDouble(row.get("load")))
                    .errorU(toDouble(row.get("error_u")))
                    .errorPhi(toDouble(row.get("error_phi")))
                    .build());
            }
            return entries;
        });
    }

    @Override
    public List<ErrorLogSummary> findSummary(long jobId) {
        return storage.withDataSource(dataSource -> findSummary(dataSource, jobId));
    }

    @Override
    public List<ErrorLogSummary> findSummary(DataSource dataSource, long jobId) {
        return inSession(dataSource, "Summary query for job " + jobId, () -> {
            List<ErrorLogSummary> summary = new ArrayList<>();
            for (Map<String, Object> row : Base.findAll(SUMMARY_SQL, jobId)) {
                Object cost = row.get("cost");
                summary.add(ErrorLogSummary.builder()
                    .load(toDouble(row.get("load")))
                    .iters(toInt(row.get("iters")))
                    .cost(cost != null ? toDouble(cost) : null)
                    .build());
            }
            return summary;
        });
    }

    @Override
    public Optional<Double> totalTime(long jobId) {
        return inSession("Total time query for job " + jobId, () -> {
            Object total = Base.firstCell(TOTAL_TIME_SQL, jobId);
            return total != null ? Optional.of(toDouble(total)) : Optional.<Double>empty();
        });
    }

    @Override
    public List<JobSummary> findAllJobs() {
        return inSession("Job list query", () -> {
            List<JobSummary> jobs = new ArrayList<>();
            for (Map<String, Object> row : Base.findAll(JOB_COLUMNS + " ORDER BY id")) {
                jobs.add(toJobSummary(row));
            }
            return jobs;
        });
    }

    @Override
    public Optional<JobSummary> findJob(long jobId) {
        return inSession("Job query for " + jobId, () -> {
            for (Map<String, Object> row : Base.findAll(JOB_COLUMNS + " WHERE id = ?", jobId)) {
                return Optional.of(toJobSummary(row));
            }
            return Optional.<JobSummary>empty();
        });
    }

    @Override
    public boolean removeJob(long jobId) {
        return inSession("Removal of job " + jobId, () -> Base.exec("DELETE FROM job_info WHERE id = ?", jobId) > 0);
    }

    // --- helpers ---

    private <T> T inSession(String operation, SessionWork<T> work) {
        return storage.withDataSource(dataSource -> inSession(dataSource, operation, work));
    }

    // caller holds the storage lock or owns the pool
    private <T> T inSession(DataSource dataSource, String operation, SessionWork<T> work) {
        try {
            Base.open(dataSource);
            return work.run();
        } catch (ErrorLogException e) {
            throw e;
        } catch (Exception e) {
            log.error("{} failed: {}", operation, e.getMessage());
            throw new ErrorLogException(ErrorKind.STORAGE, operation + " failed: " + e.getMessage(), e);
        } finally {
            if (Base.hasConnection()) {
                Base.close();
            }
        }
    }

    private void rollback(long jobId, Exception cause) {
        try {
            Base.rollbackTransaction();
            log.warn("Rolled back import of job {}: {}", jobId, cause.getMessage());
        } catch (Exception e) {
            cause.addSuppressed(e);
        }
    }

    private JobSummary toJobSummary(Map<String, Object> row) throws SQLException {
        return JobSummary.builder()
            .id(((Number) row.get("id")).longValue())
            .name((String) row.get("name"))
            .queue((String) row.get("queue"))
            .numCpu(toInt(row.get("num_cpu")))
            .nodes(toStringList(row.get("nodes")))
            .parameters((String) row.get("parameters"))
            .build();
    }

    private List<String> toStringList(Object value) throws SQLException {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Array) {
            value = ((Array) value).getArray();
        }
        if (value instanceof Object[]) {
            return Arrays.stream((Object[]) value).map(String::valueOf).toList();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }

    private static int toInt(Object value) {
        return ((Number) value).intValue();
    }

    private static double toDouble(Object value) {
        return ((Number) value).doubleValue();
    }
}
