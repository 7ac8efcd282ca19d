package io.concforge;

/**
 * Body of a leaf that wants to observe cancellation cooperatively.
 *
 * <p>The token is cancelled at the same moment the leaf's thread is interrupted, so code that
 * never blocks can still poll {@link CancellationToken#throwIfCancelled()}.
 */
@FunctionalInterface
public interface LeafAction<T> {

    T call(CancellationToken token) throws Exception;
}
