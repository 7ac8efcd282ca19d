package io.concforge;

import io.concforge.internal.InterruptGate;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Interrupt masking for the current thread.
 *
 * <p>Every interrupt this library issues (task cancellation, {@link Timeout} expiry) goes through
 * the target thread's gate. Inside {@link #uninterruptible(Callable)} such interrupts are held
 * back and delivered when the outermost masked region is left; an interrupt status already set on
 * entry is held back too. {@link Bracket} runs acquisition and release masked.
 *
 * <p>Leaf tasks always start {@link MaskingState#UNMASKED}, whatever the state of the thread that
 * called {@code runConc}, so a cancellation can stop them even when the caller itself cannot be
 * interrupted.
 *
 * <p>Example:
 * <pre>{@code
 * Masking.uninterruptible(() -> runtime.runConc(tree));
 * }</pre>
 */
public final class Masking {

    private static final ThreadLocal<InterruptGate> GATE = new ThreadLocal<InterruptGate>();

    private Masking() {
    }

    public static MaskingState state() {
        InterruptGate gate = GATE.get();
        return gate != null && gate.isMasked() ? MaskingState.MASKED : MaskingState.UNMASKED;
    }

    public static <T> T uninterruptible(Callable<T> callable) throws Exception {
        Objects.requireNonNull(callable, "callable");
        boolean created = !hasGate();
        InterruptGate gate = gate();
        gate.mask();
        try {
            return callable.call();
        } finally {
            gate.unmask();
            if (created) {
                discard(gate);
            }
        }
    }

    public static void uninterruptible(CheckedRunnable runnable) throws Exception {
        Objects.requireNonNull(runnable, "runnable");
        boolean created = !hasGate();
        InterruptGate gate = gate();
        gate.mask();
        try {
            runnable.run();
        } finally {
            gate.unmask();
            if (created) {
                discard(gate);
            }
        }
    }

    /**
     * The current thread's gate, created on first use.
     */
    static InterruptGate gate() {
        InterruptGate gate = GATE.get();
        if (gate == null) {
            gate = new InterruptGate(Thread.currentThread());
            GATE.set(gate);
        }
        return gate;
    }

    static boolean hasGate() {
        return GATE.get() != null;
    }

    /**
     * Removes {@code gate} from the current thread once nothing is masked through it.
     * Callers discard only gates they created, so pooled threads do not keep one for good.
     */
    static void discard(InterruptGate gate) {
        if (GATE.get() == gate && !gate.isMasked()) {
            GATE.remove();
        }
    }

    /**
     * Installs a fresh gate for a task run and returns the one it replaces (possibly {@code null}).
     */
    static InterruptGate install(InterruptGate gate) {
        InterruptGate previous = GATE.get();
        GATE.set(gate);
        return previous;
    }

    static void restore(InterruptGate previous) {
        if (previous == null) {
            GATE.remove();
        } else {
            GATE.set(previous);
        }
    }
}
