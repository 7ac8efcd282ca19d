package io.concforge;

/**
 * A {@link java.util.function.Function} that may throw checked exceptions.
 */
@FunctionalInterface
public interface CheckedFunction<A, B> {

    B apply(A input) throws Exception;
}
