package com.solverlog.errorlog.service;

import com.solverlog.errorlog.cache.SharedResultCache;
import com.solverlog.errorlog.model.JobSummary;
import com.solverlog.errorlog.storage.ErrorLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Listing, lookup and removal of imported jobs.
 */
@Slf4j
@Service
public class JobService {

    private final ErrorLogRepository repository;
    private final ErrorLogQueryService queryService;

    public JobService(ErrorLogRepository repository, ErrorLogQueryService queryService) {
        this.repository = repository;
        this.queryService = queryService;
    }

    public List<JobSummary> listJobs() {
        return repository.findAllJobs();
    }

    public Optional<JobSummary> findJob(long jobId) {
        return repository.findJob(jobId);
    }

    /**
     * Deletes the job with its records and drops its cached aggregate. A cache
     * fill still running for the job is discarded, see {@link SharedResultCache}.
     */
    public boolean removeJob(long jobId) {
        boolean removed = repository.removeJob(jobId);
        queryService.evict(jobId);
        if (removed) {
            log.info("Removed job {}", jobId);
        } else {
            log.debug("Job {} not found, nothing removed", jobId);
        }
        return removed;
    }
}
