package com.conveyal.coverage.progress;

/**
 * The work actually carried out by a Task. A single-method interface so it can be given as a lambda. The action only
 * sees a ProgressListener, not the Task itself, so it cannot change the state the task reports.
 */
public interface TaskAction {

    void action (ProgressListener progressListener) throws Exception;

}
