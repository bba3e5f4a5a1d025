package com.conveyal.coverage.progress;

/**
 * Simple callbacks allowing long running operations to report their progress. Implementations must be fast, as the
 * increment methods may be called in tight loops.
 */
public interface ProgressListener {

    /**
     * Call at the start of each stage of work, giving a description and how many units of work it will take.
     * Calling it again starts a new stage, resetting progress to zero under the same overall task.
     */
    void beginTask (String description, int totalElements);

    /** Report that N units of work have been performed. */
    void increment (int n);

    default void increment () {
        increment(1);
    }

}
