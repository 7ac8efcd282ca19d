package io.concforge;

/**
 * Raised when an OR-combination has no alternative left to try.
 *
 * <p>This is the failure of {@link Conc#empty()}. It is distinct from any failure raised by a
 * leaf, so callers can tell "no alternative was available" apart from "every alternative failed".
 */
public class EmptyAlternativeException extends RuntimeException {

    public EmptyAlternativeException() {
        super("Empty alternative: no branch available");
    }
}
