package com.conveyal.coverage.components;

import com.conveyal.coverage.progress.Task;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskSchedulerTest {

    private final TaskScheduler scheduler = new TaskScheduler(() -> 2);

    @AfterEach
    void tearDown () {
        scheduler.shutdown();
    }

    @Test
    void runsEnqueuedTasks () throws Exception {
        CountDownLatch done = new CountDownLatch(2);
        Task first = Task.create("first").withAction(progress -> done.countDown());
        Task second = Task.create("second").withAction(progress -> done.countDown());
        scheduler.enqueue(first);
        scheduler.enqueue(second);
        assertTrue(done.await(10, TimeUnit.SECONDS));
    }

    @Test
    void taskWithoutActionIsRejected () {
        assertThrows(IllegalStateException.class, () -> scheduler.enqueue(Task.create("empty")));
    }

    @Test
    void periodicTasksSurviveExceptions () throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch twice = new CountDownLatch(2);
        scheduler.repeatRegularly(new TaskScheduler.PeriodicTask() {
            @Override
            public int getPeriodSeconds () {
                return 1;
            }

            @Override
            public void run () {
                runs.incrementAndGet();
                twice.countDown();
                throw new IllegalStateException("every run fails");
            }
        });
        assertTrue(twice.await(10, TimeUnit.SECONDS));
        assertTrue(runs.get() >= 2);
    }

    @Test
    void backlogCountsWaitingTasks () throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);
        for (int i = 0; i < 3; i++) {
            scheduler.enqueue(Task.create("blocking " + i).withAction(progress -> {
                started.countDown();
                release.await();
            }));
        }
        assertTrue(started.await(10, TimeUnit.SECONDS));
        assertEquals(1, scheduler.getBacklog());
        release.countDown();
    }

}
