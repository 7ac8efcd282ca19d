package io.concforge;

/**
 * Raised when an evaluation exceeds the deadline configured on its {@link ConcRuntime}.
 */
public class ConcTimeoutException extends RuntimeException {

    public ConcTimeoutException(String message) {
        super(message);
    }
}
