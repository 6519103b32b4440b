package com.solverlog.errorlog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Job metadata read from the header and parameter lines of a log file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobInfo {

    /** Numeric id as written in the header. */
    private String id;
    private String name;
    private String queue;
    private int numCpu;
    private List<String> nodes;
    /** Verbatim {...} span of the parameter line, null when absent. */
    private String parameters;
}
