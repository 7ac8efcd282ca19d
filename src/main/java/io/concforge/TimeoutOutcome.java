package io.concforge;

import java.util.Optional;

/**
 * Result of {@link Timeout#timeout}: either the body's value (possibly {@code null}) or the fact
 * that the bound elapsed first.
 */
public final class TimeoutOutcome<T> {

    private static final TimeoutOutcome<Object> TIMED_OUT = new TimeoutOutcome<Object>(false, null);

    private final boolean completed;
    private final T value;

    private TimeoutOutcome(boolean completed, T value) {
        this.completed = completed;
        this.value = value;
    }

    static <T> TimeoutOutcome<T> completed(T value) {
        return new TimeoutOutcome<T>(true, value);
    }

    @SuppressWarnings("unchecked")
    static <T> TimeoutOutcome<T> timedOut() {
        return (TimeoutOutcome<T>) TIMED_OUT;
    }

    public boolean isCompleted() {
        return completed;
    }

    public boolean isTimedOut() {
        return !completed;
    }

    /**
     * @throws IllegalStateException if the bound elapsed first.
     */
    public T value() {
        if (!completed) {
            throw new IllegalStateException("Timed out, no value");
        }
        return value;
    }

    /**
     * The value as an {@link Optional}; empty when timed out or when the body returned {@code null}.
     */
    public Optional<T> toOptional() {
        return completed ? Optional.ofNullable(value) : Optional.<T>empty();
    }

    @Override
    public String toString() {
        return completed ? "TimeoutOutcome{completed, value=" + value + "}" : "TimeoutOutcome{timedOut}";
    }
}
