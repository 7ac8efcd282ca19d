package io.concforge;

import java.time.Duration;

/**
 * Lifecycle callbacks for leaf tasks, invoked on the leaf's own thread.
 *
 * <p>{@code onCancel} fires for a leaf that was cancelled after it started, once its cleanup has
 * run. Implementations should not block; exceptions they throw are counted in
 * {@link RunMetricsSnapshot#hookFailures()} and otherwise ignored.
 */
public interface TaskHook {

    default void onStart(TaskInfo info) {
    }

    default void onSuccess(TaskInfo info, Duration duration) {
    }

    default void onFailure(TaskInfo info, Throwable error, Duration duration) {
    }

    default void onCancel(TaskInfo info, Duration duration) {
    }
}
