package com.conveyal.coverage.components;

import com.conveyal.coverage.progress.Task;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Application-wide queues of one-off and repeating tasks. Pipeline invocations run as Tasks on a fixed pool whose size
 * is set in the configuration, which limits how many coverages are being fetched and assembled at once. Housekeeping
 * such as purging old job records runs on a separate single-threaded scheduled executor.
 *
 * Everything submitted here is wrapped so that no Throwable can kill a pool thread or silently halt a periodic task.
 */
public class TaskScheduler implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);

    // ThreadPoolExecutor uses locks internally, so submission from several threads needs no extra synchronization.
    private final ScheduledExecutorService scheduledExecutor;
    private final ExecutorService pipelineExecutor;

    // Futures of periodic tasks, giving access to their status and exceptions when debugging.
    private final List<ScheduledFuture<?>> periodicTaskFutures = new ArrayList<>();

    public interface Config {
        int pipelineThreads ();
    }

    /** An action repeated at regular intervals. */
    public interface PeriodicTask extends Runnable {
        int getPeriodSeconds ();
    }

    public TaskScheduler (Config config) {
        scheduledExecutor = Executors.newScheduledThreadPool(1,
                new ThreadFactoryBuilder().setNameFormat("periodic-%d").setDaemon(true).build());
        pipelineExecutor = Executors.newFixedThreadPool(config.pipelineThreads(),
                new ThreadFactoryBuilder().setNameFormat("pipeline-%d").setDaemon(true).build());
    }

    public void repeatRegularly (PeriodicTask periodicTask) {
        String className = periodicTask.getClass().getSimpleName();
        int periodSeconds = periodicTask.getPeriodSeconds();
        LOG.info("An instance of {} will run every {} seconds.", className, periodSeconds);
        ErrorTrap wrappedPeriodicTask = new ErrorTrap(periodicTask);
        synchronized (periodicTaskFutures) {
            periodicTaskFutures.add(
                scheduledExecutor.scheduleAtFixedRate(wrappedPeriodicTask, periodSeconds, periodSeconds, TimeUnit.SECONDS)
            );
        }
    }

    public void enqueue (Task task) {
        task.validate();
        pipelineExecutor.submit(new ErrorTrap(task));
    }

    /**
     * Wrap a runnable, catching any Errors or Exceptions that occur. This prevents them from propagating up to the
     * executor, which would swallow them and silently halt the periodic execution of the runnable.
     */
    private static class ErrorTrap implements Runnable {

        private final Runnable runnable;

        public ErrorTrap (Runnable runnable) {
            this.runnable = runnable;
        }

        @Override
        public final void run () {
            try {
                runnable.run();
            } catch (Throwable t) {
                LOG.error("Background execution of {} caused exception.", runnable.getClass(), t);
            }
        }
    }

    /** The number of tasks queued for execution and not yet being processed. */
    public int getBacklog () {
        return ((ThreadPoolExecutor) pipelineExecutor).getQueue().size();
    }

    /** Stop accepting work. Running tasks are interrupted. */
    public void shutdown () {
        synchronized (periodicTaskFutures) {
            periodicTaskFutures.forEach(future -> future.cancel(false));
            periodicTaskFutures.clear();
        }
        scheduledExecutor.shutdownNow();
        pipelineExecutor.shutdownNow();
    }

}
