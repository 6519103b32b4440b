package com.solverlog.errorlog.service;

import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Default {@link ErrorLogOperations}: import goes to the importer, everything
 * else to the query side.
 */
@Service
public class ErrorLogService implements ErrorLogOperations {

    private final ErrorLogImportService importService;
    private final ErrorLogQueryService queryService;

    public ErrorLogService(ErrorLogImportService importService, ErrorLogQueryService queryService) {
        this.importService = importService;
        this.queryService = queryService;
    }

    @Override
    public long importLog(Path file) {
        return importService.importLog(file);
    }

    @Override
    public void queryAggregate(long jobId, PayloadChannel channel) {
        queryService.queryAggregate(jobId, channel);
    }

    @Override
    public Optional<Double> totalTime(long jobId) {
        return queryService.totalTime(jobId);
    }

    @Override
    public void clearCache() {
        queryService.clearCache();
    }
}
