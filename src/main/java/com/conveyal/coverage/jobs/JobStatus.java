package com.conveyal.coverage.jobs;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * A snapshot of a job's status, as reported to whoever submitted it. Serialized to JSON as is, so fields are public
 * and absent values are left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatus {

    public enum Status {
        ACCEPTED, RUNNING, SUCCESSFUL, FAILED;

        public boolean isFinished () {
            return this == SUCCESSFUL || this == FAILED;
        }
    }

    public String jobId;

    public String processId;

    public Status status;

    /** Percent complete of the current stage. */
    public int progress;

    public String message;

    public Instant created;

    public Instant started;

    public Instant finished;

    /** Time spent waiting for a worker thread, up to now if the job has not started. */
    public long queuedMillis;

    /** Time spent running, up to now if the job has not finished. */
    public long executingMillis;

    /** URL of the output artifact once the job has succeeded. */
    public String location;

    public String mediaType;

    /** The kind of error that failed the job. */
    public String errorType;

    /** Whether resubmitting the same job unchanged might succeed. */
    public Boolean retryable;

    public List<String> log;

}
