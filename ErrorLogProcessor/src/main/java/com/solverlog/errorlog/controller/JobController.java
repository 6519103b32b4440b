package com.solverlog.errorlog.controller;

import com.solverlog.errorlog.dto.ImportRequest;
import com.solverlog.errorlog.dto.ImportResponse;
import com.solverlog.errorlog.model.JobSummary;
import com.solverlog.errorlog.service.ErrorLogOperations;
import com.solverlog.errorlog.service.JobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Paths;
import java.util.List;

/**
 * REST API for importing and managing jobs.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final ErrorLogOperations operations;
    private final JobService jobService;

    /**
     * Imports a solver log file from the server filesystem.
     *
     * @param request Path of the log file
     * @return Id of the imported job
     */
    @PostMapping("/import")
    public ResponseEntity<ImportResponse> importLog(@Valid @RequestBody ImportRequest request) {
        long jobId = operations.importLog(Paths.get(request.path()));
        return ResponseEntity.ok(new ImportResponse(jobId));
    }

    /**
     * Returns all imported jobs ordered by id.
     */
    @GetMapping
    public ResponseEntity<List<JobSummary>> listJobs() {
        return ResponseEntity.ok(jobService.listJobs());
    }

    @GetMapping("/{id}")
    public ResponseEntity<JobSummary> findJob(@PathVariable long id) {
        return jobService.findJob(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Deletes a job with all its records.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> removeJob(@PathVariable long id) {
        return jobService.removeJob(id)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }
}
