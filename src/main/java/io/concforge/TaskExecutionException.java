package io.concforge;

/**
 * Carries a checked exception thrown by a leaf action out of an unchecked API.
 */
public class TaskExecutionException extends RuntimeException {

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
