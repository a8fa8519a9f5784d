package com.meetchat.server.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded loop that owns all room state. Inbound events and timer callbacks are both
 * executed here, so registry, typing and dedup maps are never mutated concurrently.
 */
public class ChatEventLoop implements TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(ChatEventLoop.class);

    private static final Cancellable DROPPED = new Cancellable() {
        @Override
        public void cancel() {
        }

        @Override
        public boolean isDone() {
            return true;
        }
    };

    private final ScheduledThreadPoolExecutor executor;
    private final long shutdownTimeoutMs;

    public ChatEventLoop(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "chat-loop");
            t.setDaemon(true);
            return t;
        });
        // pending timers are dropped on shutdown, submitted events still drain
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        log.info("[BOOT] chat event loop started");
    }

    public void execute(Runnable event) {
        try {
            executor.execute(() -> runGuarded(event));
        } catch (RejectedExecutionException e) {
            log.warn("[WARN] event dropped, loop is shut down");
        }
    }

    /**
     * Schedules a timer on the loop. Once the loop is shut down the timer is dropped and the
     * returned handle reports done.
     */
    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future;
        try {
            future = executor.schedule(() -> runGuarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[WARN] timer dropped, loop is shut down");
            return DROPPED;
        }
        return new Cancellable() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isDone() {
                return future.isDone();
            }
        };
    }

    /**
     * Drains already submitted events, drops pending timers and stops the thread.
     */
    public void shutdown() {
        log.info("Shutting down chat event loop...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Chat event loop stopped");
    }

    private static void runGuarded(Runnable r) {
        try {
            r.run();
        } catch (Exception e) {
            log.error("[ERROR] unhandled exception on chat loop", e);
        }
    }
}
