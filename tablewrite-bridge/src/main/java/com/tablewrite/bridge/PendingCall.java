package com.tablewrite.bridge;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-resolution slot for one in-flight call.
 * <p>
 * Whoever wins {@link #complete(CallOutcome)} first (the receive loop, the
 * deadline timer, a sweep or a shutdown) decides the outcome; every later
 * attempt returns false and changes nothing. The future is completed on the
 * supplied executor so dependent stages never run on a socket receive thread.
 */
@Getter
public class PendingCall {

    private final String requestId;
    private final String command;
    /** Connection the call was addressed to, null for fan-out. */
    private final String targetConnectionId;
    /** {@link System#nanoTime()} readings, so wall-clock changes do not move deadlines. */
    private final long createdAtNanos;
    private final long deadlineAtNanos;
    private final CompletableFuture<CallOutcome> future = new CompletableFuture<>();

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final Executor completionExecutor;
    @Getter(AccessLevel.NONE)
    private volatile ScheduledFuture<?> timeoutTask;

    public PendingCall(String requestId, String command, String targetConnectionId,
            long createdAtNanos, long deadlineAtNanos, Executor completionExecutor) {
        this.requestId = requestId;
        this.command = command;
        this.targetConnectionId = targetConnectionId;
        this.createdAtNanos = createdAtNanos;
        this.deadlineAtNanos = deadlineAtNanos;
        this.completionExecutor = completionExecutor;
    }

    /**
     * Claim the slot and resolve it.
     *
     * @return true if this attempt was the one that resolved the call
     */
    public boolean complete(CallOutcome outcome) {
        if (!claimed.compareAndSet(false, true)) {
            return false;
        }
        ScheduledFuture<?> timer = timeoutTask;
        if (timer != null) {
            timer.cancel(false);
        }
        completionExecutor.execute(() -> future.complete(outcome));
        return true;
    }

    public boolean isClaimed() {
        return claimed.get();
    }

    public boolean isPastDeadline(long nowNanos) {
        return nowNanos - deadlineAtNanos >= 0;
    }

    public long elapsedMillis(long nowNanos) {
        return TimeUnit.NANOSECONDS.toMillis(nowNanos - createdAtNanos);
    }

    void attachTimeout(ScheduledFuture<?> task) {
        this.timeoutTask = task;
        // Lost the race against an early reply: the timer is no longer needed.
        if (claimed.get()) {
            task.cancel(false);
        }
    }
}
