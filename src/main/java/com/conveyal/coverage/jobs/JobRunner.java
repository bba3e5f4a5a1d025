package com.conveyal.coverage.jobs;

import com.conveyal.coverage.components.Component;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Runs pipeline invocations asynchronously and reports on them by job id. Each job is one whole invocation; a runner
 * may choose to retry failed jobs whose error is retryable, but never resumes part of a pipeline.
 */
public interface JobRunner extends Component {

    /** Accept a job for execution and return its id immediately. */
    String submit (JobDefinition jobDefinition);

    /** The current status of the job, or null if no job with that id is known. */
    @Nullable
    JobStatus status (String jobId);

    /**
     * Block until the job has finished or the timeout has elapsed, and return its status at that point. Returns null if
     * no job with that id is known.
     */
    @Nullable
    JobStatus awaitCompletion (String jobId, Duration timeout) throws InterruptedException;

}
