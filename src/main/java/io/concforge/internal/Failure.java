package io.concforge.internal;

/**
 * A failure together with the position at which the evaluator observed it.
 *
 * <p>Lower sequence numbers were observed earlier. Nodes compare failures by sequence only,
 * never by their position in the tree.
 */
public final class Failure {

    private final Throwable error;
    private final long sequence;

    public Failure(Throwable error, long sequence) {
        this.error = error;
        this.sequence = sequence;
    }

    public Throwable error() {
        return error;
    }

    public long sequence() {
        return sequence;
    }

    public boolean isEarlierThan(Failure other) {
        return other == null || sequence < other.sequence;
    }
}
