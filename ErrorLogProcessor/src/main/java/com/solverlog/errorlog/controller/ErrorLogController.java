package com.solverlog.errorlog.controller;

import com.solverlog.errorlog.dto.TotalTimeResponse;
import com.solverlog.errorlog.service.ErrorLogOperations;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for per-job error log aggregates.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ErrorLogController {

    static final String MSGPACK_CONTENT_TYPE = "application/x-msgpack";

    private final ErrorLogOperations operations;

    /**
     * Streams the MessagePack encoded {@code [summary, entries]} aggregate of a job.
     *
     * @param id The job id
     */
    @GetMapping("/jobs/{id}/error-log")
    public void getErrorLog(@PathVariable long id, HttpServletResponse response) {
        operations.queryAggregate(id, payload -> {
            response.setContentType(MSGPACK_CONTENT_TYPE);
            response.setContentLength(payload.length);
            response.getOutputStream().write(payload);
            response.flushBuffer();
        });
    }

    /**
     * Returns the wall time between the first and last record of a job.
     *
     * @param id The job id
     * @return Total time in seconds, 404 if the job has no records
     */
    @GetMapping("/jobs/{id}/total-time")
    public ResponseEntity<TotalTimeResponse> getTotalTime(@PathVariable long id) {
        return operations.totalTime(id)
            .map(seconds -> ResponseEntity.ok(new TotalTimeResponse(id, seconds)))
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/error-log/cache")
    public ResponseEntity<Void> clearCache() {
        log.info("Cache clear requested via API");
        operations.clearCache();
        return ResponseEntity.noContent().build();
    }
}
