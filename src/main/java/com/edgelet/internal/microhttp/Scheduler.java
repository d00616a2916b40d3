/**
 * MIT License
 *
 * Copyright (c) 2022 Elliot Barlas
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.edgelet.internal.microhttp;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.LongSupplier;

/**
 * Deadline queue owned by a single listener thread. Tasks are drained with {@link #expired()}
 * once per loop iteration.
 * <p>
 * Cancellation only flags a task; flagged tasks are discarded when they reach the head of the
 * queue, so cancelling is O(1) even with many idle connections.
 */
class Scheduler {

    private final LongSupplier nanoClock;
    private final PriorityQueue<Task> tasks;
    private long sequence;
    private int live;

    Scheduler() {
        this(System::nanoTime);
    }

    Scheduler(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        this.tasks = new PriorityQueue<>(Comparator.comparingLong((Task t) -> t.deadline).thenComparingLong(t -> t.sequence));
    }

    /**
     * Number of scheduled tasks that are neither cancelled nor expired.
     */
    int pending() {
        return live;
    }

    Cancellable schedule(Runnable action, Duration delay) {
        Task task = new Task(action, nanoClock.getAsLong() + delay.toNanos(), sequence++);
        tasks.add(task);
        live++;
        return task;
    }

    List<Runnable> expired() {
        long now = nanoClock.getAsLong();
        List<Runnable> due = new ArrayList<>();
        Task head;
        while ((head = tasks.peek()) != null && (head.cancelled || head.deadline <= now)) {
            tasks.poll();
            if (!head.cancelled) {
                head.cancelled = true;
                live--;
                due.add(head.action);
            }
        }
        return due;
    }

    private final class Task implements Cancellable {
        final Runnable action;
        final long deadline;
        final long sequence;
        boolean cancelled;

        Task(Runnable action, long deadline, long sequence) {
            this.action = action;
            this.deadline = deadline;
            this.sequence = sequence;
        }

        @Override
        public void cancel() {
            if (!cancelled) {
                cancelled = true;
                live--;
            }
        }
    }

}
