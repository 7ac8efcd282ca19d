package io.concforge.internal;

import io.concforge.RunMetricsSnapshot;
import io.concforge.Task;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Low-overhead counters shared by every evaluation of one runtime.
 */
public final class RunMetrics {

    private final LongAdder runs;
    private final LongAdder started;
    private final LongAdder succeeded;
    private final LongAdder failed;
    private final LongAdder cancelled;
    private final LongAdder hookFailures;
    private final LongAdder totalDurationNanos;
    private final AtomicLong maxDurationNanos;

    public RunMetrics() {
        this.runs = new LongAdder();
        this.started = new LongAdder();
        this.succeeded = new LongAdder();
        this.failed = new LongAdder();
        this.cancelled = new LongAdder();
        this.hookFailures = new LongAdder();
        this.totalDurationNanos = new LongAdder();
        this.maxDurationNanos = new AtomicLong(0L);
    }

    public void recordRun() {
        runs.increment();
    }

    public void recordStart() {
        started.increment();
    }

    public void recordHookFailure() {
        hookFailures.increment();
    }

    public void recordTerminal(Task.State state, long durationNanos) {
        long safeDuration = Math.max(0L, durationNanos);
        totalDurationNanos.add(safeDuration);
        updateMax(safeDuration);

        switch (state) {
            case SUCCESS:
                succeeded.increment();
                break;
            case FAILED:
                failed.increment();
                break;
            case CANCELLED:
                cancelled.increment();
                break;
            default:
                break;
        }
    }

    public RunMetricsSnapshot snapshot() {
        return new RunMetricsSnapshot(
            runs.sum(),
            started.sum(),
            succeeded.sum(),
            failed.sum(),
            cancelled.sum(),
            hookFailures.sum(),
            totalDurationNanos.sum(),
            maxDurationNanos.get()
        );
    }

    private void updateMax(long durationNanos) {
        long current = maxDurationNanos.get();
        while (durationNanos > current) {
            if (maxDurationNanos.compareAndSet(current, durationNanos)) {
                return;
            }
            current = maxDurationNanos.get();
        }
    }
}
