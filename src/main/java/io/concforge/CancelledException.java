package io.concforge;

/**
 * Raised when a task or a whole evaluation is cancelled before producing a result.
 */
public class CancelledException extends RuntimeException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
