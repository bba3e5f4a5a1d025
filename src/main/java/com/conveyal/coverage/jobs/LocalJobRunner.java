package com.conveyal.coverage.jobs;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.components.TaskScheduler;
import com.conveyal.coverage.pipeline.CoveragePipeline;
import com.conveyal.coverage.pipeline.Invocation;
import com.conveyal.coverage.pipeline.OutputArtifact;
import com.conveyal.coverage.progress.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs jobs in this process on the TaskScheduler's pipeline threads. Job records are kept in memory and purged a
 * configurable time after the job finishes. Failed jobs are reported and never retried.
 */
public class LocalJobRunner implements JobRunner {

    private static final Logger LOG = LoggerFactory.getLogger(LocalJobRunner.class);

    private static final long POLL_MILLIS = 25;

    public interface Config {
        int jobRetentionSeconds ();
    }

    private final CoveragePipeline pipeline;

    private final TaskScheduler taskScheduler;

    private final Duration retention;

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    private static class Job {
        final JobDefinition definition;
        final Invocation invocation;
        final Task task;
        volatile OutputArtifact artifact;

        Job (JobDefinition definition, Invocation invocation, Task task) {
            this.definition = definition;
            this.invocation = invocation;
            this.task = task;
        }
    }

    public LocalJobRunner (Config config, TaskScheduler taskScheduler, CoveragePipeline pipeline) {
        this.pipeline = pipeline;
        this.taskScheduler = taskScheduler;
        this.retention = Duration.ofSeconds(config.jobRetentionSeconds());
        taskScheduler.repeatRegularly(new PurgeFinishedJobs());
    }

    @Override
    public String submit (JobDefinition definition) {
        Invocation invocation = new Invocation(definition.processId);
        Task task = Task.create("Process " + definition.processId);
        Job job = new Job(definition, invocation, task);
        task.withAction(progressListener -> job.artifact = pipeline.run(
                invocation, definition.request, definition.rangeSubset, definition.format, progressListener));
        jobs.put(invocation.id, job);
        taskScheduler.enqueue(task);
        LOG.info("Accepted job {} for process {}.", invocation.id, definition.processId);
        return invocation.id;
    }

    @Override
    public JobStatus status (String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) return null;
        Task task = job.task;
        JobStatus status = new JobStatus();
        status.jobId = jobId;
        status.processId = job.definition.processId;
        status.created = task.getEnqueued();
        status.started = task.getBegan();
        status.finished = task.getCompleted();
        status.progress = task.getPercentComplete();
        status.message = task.getDescription();
        status.log = task.getLog();
        status.queuedMillis = task.durationInQueue().toMillis();
        status.executingMillis = task.durationExecuting().toMillis();
        switch (task.getState()) {
            case QUEUED:
                status.status = JobStatus.Status.ACCEPTED;
                break;
            case ACTIVE:
                status.status = JobStatus.Status.RUNNING;
                break;
            case DONE:
                status.status = JobStatus.Status.SUCCESSFUL;
                status.location = job.artifact.url;
                status.mediaType = job.artifact.mediaType;
                break;
            case ERROR:
                status.status = JobStatus.Status.FAILED;
                CoverageProcessException failure = CoverageProcessException.wrap(
                        task.getThrowable(), CoverageProcessException.Type.SERIALIZATION_ERROR);
                status.errorType = failure.type.name();
                status.retryable = failure.isRetryable();
                status.message = failure.message;
                break;
        }
        return status;
    }

    @Override
    public JobStatus awaitCompletion (String jobId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            JobStatus status = status(jobId);
            if (status == null || status.status.isFinished() || System.nanoTime() >= deadline) {
                return status;
            }
            Thread.sleep(POLL_MILLIS);
        }
    }

    /** The number of job records currently held. */
    public int size () {
        return jobs.size();
    }

    /** Forget jobs that finished longer ago than the retention period. */
    void purgeFinishedJobs () {
        jobs.entrySet().removeIf(entry -> {
            Task task = entry.getValue().task;
            boolean expired = task.isFinished() && task.durationComplete().compareTo(retention) > 0;
            if (expired) LOG.debug("Purging record of finished job {}.", entry.getKey());
            return expired;
        });
    }

    private class PurgeFinishedJobs implements TaskScheduler.PeriodicTask {

        @Override
        public int getPeriodSeconds () {
            return (int) Math.max(1, Math.min(60, retention.getSeconds()));
        }

        @Override
        public void run () {
            purgeFinishedJobs();
        }
    }

}
