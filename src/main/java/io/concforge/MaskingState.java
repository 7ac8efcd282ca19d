package io.concforge;

/**
 * Interrupt masking state of a thread, as reported by {@link Masking#state()}.
 */
public enum MaskingState {
    /** Interrupts requested through the thread's gate are delivered immediately. */
    UNMASKED,
    /** Interrupts are held back until the outermost masked region is left. */
    MASKED
}
