package com.solverlog.errorlog.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solverlog.errorlog.cache.SharedResultCache;
import com.solverlog.errorlog.exception.ErrorKind;
import com.solverlog.errorlog.exception.ErrorLogException;
import com.solverlog.errorlog.model.ErrorLogEntry;
import com.solverlog.errorlog.model.ErrorLogPayload;
import com.solverlog.errorlog.model.ErrorLogSummary;
import com.solverlog.errorlog.storage.ErrorLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Serves per-job aggregates: cache first, otherwise two concurrent reads,
 * MessagePack serialization, delivery, then a detached cache fill.
 */
@Slf4j
@Service
public class ErrorLogQueryService {

    private final ErrorLogRepository repository;
    private final SharedResultCache cache;
    private final ObjectMapper msgpackMapper;
    private final Executor queryExecutor;
    private final Executor cacheExecutor;

    public ErrorLogQueryService(ErrorLogRepository repository,
                                SharedResultCache cache,
                                @Qualifier("msgpackObjectMapper") ObjectMapper msgpackMapper,
                                @Qualifier("aggregateQueryExecutor") Executor queryExecutor,
                                @Qualifier("cachePopulationExecutor") Executor cacheExecutor) {
        this.repository = repository;
        this.cache = cache;
        this.msgpackMapper = msgpackMapper;
        this.queryExecutor = queryExecutor;
        this.cacheExecutor = cacheExecutor;
    }

    /**
     * Delivers the aggregate of a job. On a miss the cache is filled only
     * after the payload has been handed to the channel.
     */
    public void queryAggregate(long jobId, PayloadChannel channel) {
        Optional<byte[]> cached = cache.get(jobId);
        if (cached.isPresent()) {
            log.debug("Aggregate for job {} served from cache", jobId);
            deliver(jobId, cached.get(), channel);
            return;
        }

        long generation = cache.generation();
        byte[] payload = serialize(jobId, loadPayload(jobId));
        deliver(jobId, payload, channel);
        populateCache(jobId, payload, generation);
    }

    public Optional<Double> totalTime(long jobId) {
        return repository.totalTime(jobId);
    }

    public void clearCache() {
        cache.clear();
        log.info("Aggregate cache cleared");
    }

    public void evict(long jobId) {
        cache.remove(jobId);
    }

    /**
     * Both reads run against the one pool held for the whole call, so a
     * reconfiguration waits until they are done.
     */
    ErrorLogPayload loadPayload(long jobId) {
        return repository.withStorage(dataSource -> loadPayload(dataSource, jobId));
    }

    private ErrorLogPayload loadPayload(DataSource dataSource, long jobId) {
        CompletableFuture<List<ErrorLogSummary>> summary =
            CompletableFuture.supplyAsync(() -> repository.findSummary(dataSource, jobId), queryExecutor);
        CompletableFuture<List<ErrorLogEntry>> entries =
            CompletableFuture.supplyAsync(() -> repository.findEntries(dataSource, jobId), queryExecutor);

        try {
            ErrorLogPayload payload = new ErrorLogPayload(summary.join(), entries.join());
            log.debug("Loaded aggregate for job {}: {} load steps, {} iterations",
                jobId, payload.getSummary().size(), payload.getEntries().size());
            return payload;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ErrorLogException) {
                throw (ErrorLogException) cause;
            }
            throw new ErrorLogException(ErrorKind.STORAGE,
                "Aggregate query for job " + jobId + " failed: " + cause.getMessage(), cause);
        }
    }

    private byte[] serialize(long jobId, ErrorLogPayload payload) {
        try {
            return msgpackMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new ErrorLogException(ErrorKind.SERIALIZATION,
                "Cannot serialize aggregate for job " + jobId + ": " + e.getMessage(), e);
        }
    }

    private void deliver(long jobId, byte[] payload, PayloadChannel channel) {
        try {
            channel.send(payload);
        } catch (IOException e) {
            throw new ErrorLogException(ErrorKind.DELIVERY,
                "Cannot deliver aggregate for job " + jobId + ": " + e.getMessage(), e);
        }
    }

    private void populateCache(long jobId, byte[] payload, long generation) {
        try {
            CompletableFuture.runAsync(() -> cache.setIfCurrent(jobId, payload, generation), cacheExecutor)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("Failed to cache aggregate for job {}: {}", jobId, error.getMessage(), error);
                    }
                });
        } catch (RejectedExecutionException e) {
            log.warn("Cache fill for job {} rejected: {}", jobId, e.getMessage());
        }
    }
}
