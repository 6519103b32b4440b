package com.solverlog.errorlog.parser;

import com.solverlog.errorlog.config.ErrorLogProperties;
import com.solverlog.errorlog.exception.LogFormatException;
import com.solverlog.errorlog.exception.ParseStage;
import com.solverlog.errorlog.model.JobInfo;
import com.solverlog.errorlog.model.ParsedErrorLog;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Parses solver error logs into job metadata and CSV rows.
 *
 * Expected layout:
 *
 *    JobInfo(id='666666', name='test_job', queue='default', n=4, nodes=['node1', 'node2'])
 *    {param1: value1, param2: value2}
 *    2023-01-01 10:00:00.000 ... l=1.5 ... iter=1 ... err={ u=0.1 phi=0.2 }
 *    2023-01-01 10:01:00.000 ... l=1.2 ... iter=2 ... err={ u=0.05 phi=0.15 }
 *
 * The first metric line found in the body fixes a {@link SliceTemplate}: the
 * offsets of its five captures. Every other line is validated against the full
 * metric pattern and then sliced with the template. Lines not matching the
 * pattern are dropped.
 */
@Slf4j
@Component
public class ErrorLogParser {

    // JobInfo(... id='..' ... name='..' ... queue='..' ... n=.. ... nodes=[..] ...)
    private static final Pattern JOB_INFO_PATTERN = Pattern.compile(
        "JobInfo\\(.*?\\bid='([^']*)'" +      // id (group 1)
        ".*?\\bname='([^']*)'" +              // name (group 2)
        ".*?\\bqueue='([^']*)'" +             // queue (group 3)
        ".*?\\bn=(\\d+)" +                    // cpu count (group 4)
        ".*?\\bnodes=\\[(.*)\\].*\\)"         // node list (group 5)
    );

    private static final Pattern PARAMS_PATTERN = Pattern.compile("\\{.*\\}");

    // TIMESTAMP ... l=LOAD ... iter=N ... err={ u=U phi=PHI
    private static final Pattern METRIC_PATTERN = Pattern.compile(
        "(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3})" +   // timestamp (group 1)
        ".*?l=([\\d.e+-]+)" +                                       // load (group 2)
        ".*?iter=(\\d+)" +                                          // iteration (group 3)
        ".*?err=\\{ u=([\\d.e+-]+)" +                               // error u (group 4)
        " phi=([\\d.e+-]+)"                                         // error phi (group 5)
    );

    private static final int FIELD_COUNT = 5;

    private final int parallelism;
    private final ForkJoinPool workers;

    @Autowired
    public ErrorLogParser(ErrorLogProperties properties) {
        this(properties.getParser().getParallelism());
    }

    public ErrorLogParser(int parallelism) {
        this.parallelism = Math.max(1, parallelism);
        this.workers = this.parallelism > 1 ? new ForkJoinPool(this.parallelism) : null;
    }

    @PreDestroy
    public void shutdown() {
        if (workers != null) {
            workers.shutdown();
        }
    }

    /**
     * Capture offsets of the five metric fields within the first metric line.
     */
    public record SliceTemplate(int[] starts, int[] ends) {

        static SliceTemplate of(Matcher matcher) {
            int[] starts = new int[FIELD_COUNT];
            int[] ends = new int[FIELD_COUNT];
            for (int i = 0; i < FIELD_COUNT; i++) {
                starts[i] = matcher.start(i + 1);
                ends[i] = matcher.end(i + 1);
            }
            return new SliceTemplate(starts, ends);
        }

        /**
         * True when the line's own captures sit exactly at the template offsets.
         */
        boolean fits(Matcher matcher) {
            for (int i = 0; i < FIELD_COUNT; i++) {
                if (matcher.start(i + 1) != starts[i] || matcher.end(i + 1) != ends[i]) {
                    return false;
                }
            }
            return true;
        }

        String slice(String line, int field) {
            return line.substring(starts[field], ends[field]);
        }

        @Override
        public String toString() {
            return "SliceTemplate" + Arrays.toString(starts) + Arrays.toString(ends);
        }
    }

    /**
     * Parses a complete log file content.
     *
     * @param logs The whole file as text
     * @return Job metadata and the CSV rows, in source line order
     * @throws LogFormatException if the header, the parameter line or any metric line is missing
     */
    public ParsedErrorLog parse(String logs) {
        int headerEnd = logs.indexOf('\n');
        if (headerEnd < 0) {
            throw new LogFormatException(ParseStage.HEADER, "no line break after the job header");
        }
        int paramsEnd = logs.indexOf('\n', headerEnd + 1);
        if (paramsEnd < 0) {
            throw new LogFormatException(ParseStage.PARAMS, "no line break after the parameter line");
        }

        String headerLine = logs.substring(0, headerEnd);
        String paramsLine = logs.substring(headerEnd + 1, paramsEnd);
        String body = logs.substring(paramsEnd + 1);

        String parameters = parseParameters(paramsLine).orElse(null);
        JobInfo jobInfo = parseJobInfo(headerLine, parameters);

        List<String> lines = body.lines().toList();
        SliceTemplate template = buildTemplate(lines);
        log.debug("Job {}: template {} built from {} body lines", jobInfo.getId(), template, lines.size());

        AtomicInteger misaligned = new AtomicInteger();
        List<String> rows = transcode(lines, template, jobInfo.getId(), misaligned);
        if (misaligned.get() > 0) {
            log.debug("Job {}: {} of {} rows did not fit the template layout and were read from their own captures",
                jobInfo.getId(), misaligned.get(), rows.size());
        }

        return new ParsedErrorLog(jobInfo, String.join("", rows), rows.size());
    }

    Optional<String> parseParameters(String paramsLine) {
        Matcher matcher = PARAMS_PATTERN.matcher(paramsLine);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    JobInfo parseJobInfo(String headerLine, String parameters) {
        Matcher matcher = JOB_INFO_PATTERN.matcher(headerLine);
        if (!matcher.find()) {
            throw new LogFormatException(ParseStage.HEADER, "cannot parse job info from '" + abbreviate(headerLine) + "'");
        }

        int numCpu;
        try {
            numCpu = Integer.parseInt(matcher.group(4));
        } catch (NumberFormatException e) {
            throw new LogFormatException(ParseStage.HEADER, "cpu count out of range: " + matcher.group(4), e);
        }

        List<String> nodes = Arrays.stream(matcher.group(5).split(","))
            .map(ErrorLogParser::trimNode)
            .filter(node -> !node.isEmpty())
            .toList();

        return JobInfo.builder()
            .id(matcher.group(1))
            .name(matcher.group(2))
            .queue(matcher.group(3))
            .numCpu(numCpu)
            .nodes(nodes)
            .parameters(parameters)
            .build();
    }

    SliceTemplate buildTemplate(List<String> lines) {
        for (String line : lines) {
            Matcher matcher = METRIC_PATTERN.matcher(line);
            if (matcher.find()) {
                return SliceTemplate.of(matcher);
            }
        }
        throw new LogFormatException(ParseStage.TEMPLATE, "no metric line found");
    }

    private List<String> transcode(List<String> lines, SliceTemplate template, String jobId, AtomicInteger misaligned) {
        if (workers == null) {
            return render(lines.stream(), template, jobId, misaligned);
        }
        // parallel streams started from inside a pool run on that pool
        return workers.submit(() -> render(lines.parallelStream(), template, jobId, misaligned)).join();
    }

    private List<String> render(Stream<String> lines, SliceTemplate template, String jobId, AtomicInteger misaligned) {
        return lines
            .map(line -> toRow(line, template, jobId, misaligned))
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    /**
     * Converts one body line into a CSV row, or null if it is not a metric line.
     */
    String toRow(String line, SliceTemplate template, String jobId, AtomicInteger misaligned) {
        Matcher matcher = METRIC_PATTERN.matcher(line);
        if (!matcher.find()) {
            log.trace("Not a metric line: {}", line);
            return null;
        }

        boolean fits = template.fits(matcher);
        if (!fits) {
            misaligned.incrementAndGet();
        }

        StringBuilder row = new StringBuilder(line.length() / 2 + jobId.length() + 8);
        for (int field = 0; field < FIELD_COUNT; field++) {
            if (field > 0) {
                row.append(',');
            }
            row.append(fits ? template.slice(line, field) : matcher.group(field + 1));
        }
        return row.append(',').append(jobId).append('\n').toString();
    }

    public int getParallelism() {
        return parallelism;
    }

    private static String trimNode(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && isNodeQuote(raw.charAt(start))) {
            start++;
        }
        while (end > start && isNodeQuote(raw.charAt(end - 1))) {
            end--;
        }
        return raw.substring(start, end);
    }

    private static boolean isNodeQuote(char c) {
        return c == ' ' || c == '\'';
    }

    private static String abbreviate(String text) {
        return text.length() <= 120 ? text : text.substring(0, 117) + "...";
    }
}
