package com.solverlog.errorlog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Stored job as listed by the job endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSummary {

    private long id;
    private String name;
    private String queue;
    private int numCpu;
    private List<String> nodes;
    private String parameters;
}
