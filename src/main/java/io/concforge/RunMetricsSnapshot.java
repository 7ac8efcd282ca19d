package io.concforge;

import java.time.Duration;

/**
 * Immutable snapshot of the counters a {@link ConcRuntime} keeps across its evaluations.
 *
 * <p>Durations cover leaf tasks that actually started; a leaf cancelled before it ran counts
 * neither as started nor as cancelled.
 */
public final class RunMetricsSnapshot {

    private final long runs;
    private final long started;
    private final long succeeded;
    private final long failed;
    private final long cancelled;
    private final long hookFailures;
    private final long totalDurationNanos;
    private final long maxDurationNanos;

    public RunMetricsSnapshot(
        long runs,
        long started,
        long succeeded,
        long failed,
        long cancelled,
        long hookFailures,
        long totalDurationNanos,
        long maxDurationNanos
    ) {
        this.runs = runs;
        this.started = started;
        this.succeeded = succeeded;
        this.failed = failed;
        this.cancelled = cancelled;
        this.hookFailures = hookFailures;
        this.totalDurationNanos = totalDurationNanos;
        this.maxDurationNanos = maxDurationNanos;
    }

    /** Number of {@code runConc} evaluations. */
    public long runs() {
        return runs;
    }

    public long started() {
        return started;
    }

    public long succeeded() {
        return succeeded;
    }

    public long failed() {
        return failed;
    }

    public long cancelled() {
        return cancelled;
    }

    /** Exceptions thrown by {@link TaskHook} callbacks; they never reach the evaluation. */
    public long hookFailures() {
        return hookFailures;
    }

    public long completed() {
        return succeeded + failed + cancelled;
    }

    public Duration totalDuration() {
        return Duration.ofNanos(totalDurationNanos);
    }

    public Duration averageDuration() {
        long completed = completed();
        if (completed == 0L) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(totalDurationNanos / completed);
    }

    public Duration maxDuration() {
        return Duration.ofNanos(maxDurationNanos);
    }

    @Override
    public String toString() {
        return "RunMetricsSnapshot{"
            + "runs=" + runs
            + ", started=" + started
            + ", succeeded=" + succeeded
            + ", failed=" + failed
            + ", cancelled=" + cancelled
            + ", hookFailures=" + hookFailures
            + ", averageDuration=" + averageDuration().toMillis() + " ms"
            + ", maxDuration=" + maxDuration().toMillis() + " ms"
            + "}";
    }
}
