package io.concforge;

import java.time.Instant;

/**
 * Immutable metadata for one spawned leaf, handed to {@link TaskHook} callbacks.
 */
public final class TaskInfo {

    private final long runId;
    private final long taskId;
    private final String name;
    private final Instant createdAt;
    private final String schedulerName;

    public TaskInfo(long runId, long taskId, String name, Instant createdAt, String schedulerName) {
        this.runId = runId;
        this.taskId = taskId;
        this.name = name;
        this.createdAt = createdAt;
        this.schedulerName = schedulerName;
    }

    /** Evaluation that spawned the task; increasing per runtime. */
    public long runId() {
        return runId;
    }

    /** Task id; unique per runtime. */
    public long taskId() {
        return taskId;
    }

    public String name() {
        return name;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String schedulerName() {
        return schedulerName;
    }

    @Override
    public String toString() {
        return "TaskInfo{run=" + runId + ", task=" + taskId + ", name='" + name + "'}";
    }
}
