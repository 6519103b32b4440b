package com.solverlog.errorlog.service;

import com.solverlog.errorlog.exception.ErrorKind;
import com.solverlog.errorlog.exception.ErrorLogException;
import com.solverlog.errorlog.exception.LogFormatException;
import com.solverlog.errorlog.exception.ParseStage;
import com.solverlog.errorlog.model.ParsedErrorLog;
import com.solverlog.errorlog.parser.ErrorLogParser;
import com.solverlog.errorlog.storage.ErrorLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a log file, parses it and stores the job with all its records
 * atomically.
 */
@Slf4j
@Service
public class ErrorLogImportService {

    private final ErrorLogParser parser;
    private final ErrorLogRepository repository;

    public ErrorLogImportService(ErrorLogParser parser, ErrorLogRepository repository) {
        this.parser = parser;
        this.repository = repository;
    }

    public long importLog(Path file) {
        log.info("Importing error log {}", file);

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ErrorLogException(ErrorKind.IO, "Cannot read log file " + file + ": " + e.getMessage(), e);
        }

        ParsedErrorLog parsed = parser.parse(content);
        long jobId = parseJobId(parsed.jobInfo().getId());

        long stored = repository.importJob(jobId, parsed.jobInfo(), parsed.rows());

        log.info("Imported job {} ({}, queue {}): {} records from {}",
            jobId, parsed.jobInfo().getName(), parsed.jobInfo().getQueue(), stored, file);
        return jobId;
    }

    private long parseJobId(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new LogFormatException(ParseStage.HEADER, "job id is not a number: '" + id + "'", e);
        }
    }
}
