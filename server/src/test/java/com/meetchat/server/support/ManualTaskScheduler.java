package com.meetchat.server.support;

import com.meetchat.server.scheduling.Cancellable;
import com.meetchat.server.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Virtual-time scheduler: nothing runs until {@link #advance} moves the clock past a due time.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private long nowMs;
    private long seq;
    private final List<Job> jobs = new ArrayList<>();

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        Job job = new Job(nowMs + delay.toMillis(), seq++, task);
        jobs.add(job);
        return job;
    }

    public void advance(Duration by) {
        long target = nowMs + by.toMillis();
        while (true) {
            Job next = null;
            for (Job j : jobs) {
                if (j.isDone() || j.due > target) continue;
                if (next == null || j.due < next.due || (j.due == next.due && j.seq < next.seq)) next = j;
            }
            if (next == null) break;
            nowMs = next.due;
            next.ran = true;
            next.task.run();
        }
        nowMs = target;
        jobs.removeIf(Job::isDone);
    }

    public void advanceMillis(long ms) {
        advance(Duration.ofMillis(ms));
    }

    public long nowMillis() {
        return nowMs;
    }

    public int pendingCount() {
        return (int) jobs.stream().filter(j -> !j.isDone()).count();
    }

    private static final class Job implements Cancellable {
        final long due;
        final long seq;
        final Runnable task;
        boolean ran;
        boolean cancelled;

        Job(long due, long seq, Runnable task) {
            this.due = due;
            this.seq = seq;
            this.task = task;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isDone() {
            return ran || cancelled;
        }
    }
}
