package io.concforge;

/**
 * Handle for a job registered with a {@link DelayScheduler}.
 */
public interface ScheduledTask {

    /**
     * Prevents the job from running if it has not started yet.
     *
     * @return true if this call cancelled the job.
     */
    boolean cancel();

    boolean isCancelled();

    /**
     * @return true when the job has run or has been cancelled.
     */
    boolean isDone();
}
