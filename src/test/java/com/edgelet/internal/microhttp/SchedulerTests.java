package com.edgelet.internal.microhttp;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

public class SchedulerTests {

    private final AtomicLong now = new AtomicLong();
    private final Scheduler scheduler = new Scheduler(now::get);
    private final List<String> ran = new ArrayList<>();

    @Test
    public void expiresInDeadlineOrder() {
        scheduler.schedule(() -> ran.add("late"), Duration.ofNanos(30));
        scheduler.schedule(() -> ran.add("early"), Duration.ofNanos(10));
        scheduler.schedule(() -> ran.add("tie"), Duration.ofNanos(10));

        Assertions.assertTrue(scheduler.expired().isEmpty());

        now.set(10);
        scheduler.expired().forEach(Runnable::run);
        Assertions.assertEquals(List.of("early", "tie"), ran);
        Assertions.assertEquals(1, scheduler.pending());

        now.set(100);
        scheduler.expired().forEach(Runnable::run);
        Assertions.assertEquals(List.of("early", "tie", "late"), ran);
        Assertions.assertEquals(0, scheduler.pending());
    }

    @Test
    public void cancelledTasksNeverRun() {
        Cancellable first = scheduler.schedule(() -> ran.add("first"), Duration.ofNanos(5));
        scheduler.schedule(() -> ran.add("second"), Duration.ofNanos(5));

        first.cancel();
        first.cancel();

        Assertions.assertEquals(1, scheduler.pending());

        now.set(5);
        scheduler.expired().forEach(Runnable::run);

        Assertions.assertEquals(List.of("second"), ran);
        Assertions.assertEquals(0, scheduler.pending());
    }

}
