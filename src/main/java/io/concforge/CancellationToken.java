package io.concforge;

/**
 * Read side of a task's cancellation signal.
 * Implementations must be thread-safe.
 */
public interface CancellationToken {

    /**
     * @return true once cancellation of the owning task has been requested.
     */
    boolean isCancelled();

    /**
     * Throws {@link CancelledException} if cancellation has been requested.
     */
    void throwIfCancelled();
}
