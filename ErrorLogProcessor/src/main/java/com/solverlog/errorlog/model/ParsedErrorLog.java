package com.solverlog.errorlog.model;

/**
 * Output of the log parser: job metadata plus the CSV rows for bulk load,
 * one {@code timestamp,load,iter,error_u,error_phi,job_id} line per metric line.
 */
public record ParsedErrorLog(JobInfo jobInfo, String rows, int rowCount) {
}
