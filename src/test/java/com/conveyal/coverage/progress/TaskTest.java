package com.conveyal.coverage.progress;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskTest {

    @Test
    void reportsProgressWhileRunning () {
        int[] seen = new int[1];
        Task[] self = new Task[1];
        Task task = Task.create("count").withAction(progress -> {
            progress.beginTask("Evaluating 4 bands", 4);
            progress.increment();
            progress.increment();
            seen[0] = self[0].getPercentComplete();
        });
        self[0] = task;
        assertEquals(Task.State.QUEUED, task.getState());
        task.run();
        assertEquals(50, seen[0]);
        assertEquals(Task.State.DONE, task.getState());
        assertEquals(100, task.getPercentComplete());
        assertTrue(task.isFinished());
        assertNull(task.getThrowable());
        assertTrue(task.getLog().get(1).endsWith("Evaluating 4 bands"));
    }

    @Test
    void progressNeverReachesCompletionEarly () {
        Task task = Task.create("over").withAction(progress -> {
            progress.beginTask("Fetching", 2);
            progress.increment(5);
            throw new IllegalStateException("stop");
        });
        task.run();
        assertEquals(Task.State.ERROR, task.getState());
        assertEquals(50, task.getPercentComplete());
    }

    @Test
    void failureIsRecorded () {
        Task task = Task.create("fail").withAction(progress -> {
            throw new IllegalStateException("upstream gone");
        });
        task.run();
        assertEquals(Task.State.ERROR, task.getState());
        assertNotNull(task.getCompleted());
        assertTrue(task.getThrowable() instanceof IllegalStateException);
        assertTrue(task.getDescription().contains("upstream gone"));
        assertThrows(IllegalStateException.class, task::validate);
    }

}
