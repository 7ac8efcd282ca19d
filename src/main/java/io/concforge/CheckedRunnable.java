package io.concforge;

/**
 * A {@link Runnable} that may throw checked exceptions.
 */
@FunctionalInterface
public interface CheckedRunnable {

    void run() throws Exception;
}
