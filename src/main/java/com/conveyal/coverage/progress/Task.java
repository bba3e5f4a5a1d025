package com.conveyal.coverage.progress;

import com.conveyal.coverage.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkState;

/**
 * A background unit of work whose progress is visible to whoever submitted it. The task records when it was queued,
 * started and finished, the current stage description, how far along the stage is, and a log of timestamped lines
 * (one per stage, plus the outcome). Any Throwable escaping the action is caught and recorded, so a Task never kills
 * the thread running it.
 *
 * Fields are written by the executing thread and read by status polling threads, so they are volatile or guarded by
 * the task's monitor. A reader may see a slightly stale but never a torn view.
 */
public class Task implements Runnable, ProgressListener {

    private static final Logger LOG = LoggerFactory.getLogger(Task.class);

    public enum State {
        QUEUED, ACTIVE, DONE, ERROR
    }

    public final UUID id = UUID.randomUUID();

    /** An unchanging, human readable name for this task. */
    public final String title;

    private volatile Instant enqueued;
    private volatile Instant began;
    private volatile Instant completed;

    /** Text describing the current work, which changes over the course of the task. */
    private volatile String description;

    private volatile int totalWorkUnits;
    private volatile int currentWorkUnit;

    private volatile State state;

    private volatile Throwable throwable;

    private TaskAction action;

    private final List<String> logLines = new ArrayList<>();

    /** Private constructor to encourage use of fluent methods. */
    private Task (String title) {
        this.title = title;
        markEnqueued();
    }

    /** Call this static factory to begin building a task. */
    public static Task create (String title) {
        return new Task(title);
    }

    public Task withAction (TaskAction action) {
        this.action = action;
        return this;
    }

    /** Check that all necessary fields have been set before enqueueing for execution. */
    public void validate () {
        checkState(action != null, "Task %s has no action.", title);
        checkState(state == State.QUEUED, "Task %s has already been run.", title);
    }

    private void markEnqueued () {
        enqueued = Instant.now();
        description = "Waiting...";
        state = State.QUEUED;
        appendLog("Accepted.");
    }

    private void markActive () {
        began = Instant.now();
        state = State.ACTIVE;
    }

    private void markComplete () {
        completed = Instant.now();
        // Progress bars show 100% whenever an action completes successfully.
        currentWorkUnit = totalWorkUnits;
        description = "Completed.";
        state = State.DONE;
        appendLog(description);
    }

    private void markError (Throwable t) {
        completed = Instant.now();
        throwable = t;
        description = ExceptionUtils.shortCauseString(t);
        state = State.ERROR;
        appendLog("Failed: " + description);
    }

    @Override
    public void run () {
        markActive();
        try {
            action.action(this);
            markComplete();
        } catch (Throwable t) {
            LOG.warn("Task {} ({}) failed: {}", title, id, ExceptionUtils.shortCauseString(t));
            markError(t);
        }
    }

    @Override
    public void beginTask (String description, int totalElements) {
        this.description = description;
        if (totalElements > 0) {
            this.totalWorkUnits = totalElements;
        }
        this.currentWorkUnit = 0;
        appendLog(description);
    }

    @Override
    public void increment (int n) {
        int current = currentWorkUnit + n;
        if (current >= totalWorkUnits || current < 0) {
            current = Math.max(0, totalWorkUnits - 1);
        }
        currentWorkUnit = current;
    }

    private void appendLog (String line) {
        synchronized (logLines) {
            logLines.add(Instant.now() + " " + line);
        }
    }

    public List<String> getLog () {
        synchronized (logLines) {
            return new ArrayList<>(logLines);
        }
    }

    public State getState () {
        return state;
    }

    public String getDescription () {
        return description;
    }

    /** The Throwable that ended the task, or null if it has not failed. */
    public Throwable getThrowable () {
        return throwable;
    }

    public boolean isFinished () {
        State s = state;
        return s == State.DONE || s == State.ERROR;
    }

    public int getPercentComplete () {
        if (state == State.DONE) return 100;
        int total = totalWorkUnits;
        if (total <= 0) return 0;
        return (int) ((currentWorkUnit * 100L) / total);
    }

    public Instant getEnqueued () {
        return enqueued;
    }

    public Instant getBegan () {
        return began;
    }

    public Instant getCompleted () {
        return completed;
    }

    public Duration durationInQueue () {
        Instant endTime = (began == null) ? Instant.now() : began;
        return Duration.between(enqueued, endTime);
    }

    public Duration durationExecuting () {
        if (began == null) return Duration.ZERO;
        Instant endTime = (completed == null) ? Instant.now() : completed;
        return Duration.between(began, endTime);
    }

    /** How long ago the task finished, zero if it is still queued or running. */
    public Duration durationComplete () {
        if (completed == null) return Duration.ZERO;
        return Duration.between(completed, Instant.now());
    }

}
