package io.concforge;

import io.concforge.internal.InterruptGate;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Scoped-resource primitive: release runs on every exit path, including cancellation.
 *
 * <p>Acquisition and release run masked (see {@link Masking}), so a cancellation that arrives
 * while a resource is being acquired or released is delivered only afterwards; the body in between
 * runs with the caller's masking state. A failure of the release step is attached as suppressed
 * to the body's failure, or thrown if the body succeeded.
 *
 * <p>Example:
 * <pre>{@code
 * Conc<Void> worker = Conc.exec(() -> Bracket.around(
 *     () -> active.incrementAndGet(),
 *     () -> { Thread.sleep(10_000L); return null; },
 *     () -> active.decrementAndGet()));
 * }</pre>
 */
public final class Bracket {

    private static final CheckedRunnable NOTHING = new CheckedRunnable() {
        @Override
        public void run() {
        }
    };

    private Bracket() {
    }

    /**
     * Releases a resource obtained by {@link #bracket}.
     */
    @FunctionalInterface
    public interface Release<R> {
        void release(R resource) throws Exception;
    }

    public static <R, T> T bracket(
        Callable<? extends R> acquire,
        CheckedFunction<? super R, ? extends T> use,
        Release<? super R> release
    ) throws Exception {
        Objects.requireNonNull(acquire, "acquire");
        Objects.requireNonNull(use, "use");
        Objects.requireNonNull(release, "release");
        boolean created = !Masking.hasGate();
        InterruptGate gate = Masking.gate();
        try {
            final R resource;
            gate.mask();
            try {
                resource = acquire.call();
            } finally {
                gate.unmask();
            }

            final T result;
            try {
                result = use.apply(resource);
            } catch (Throwable failure) {
                releaseMasked(gate, release, resource, failure);
                throw failure;
            }
            releaseMasked(gate, release, resource, null);
            return result;
        } finally {
            if (created) {
                Masking.discard(gate);
            }
        }
    }

    /**
     * Runs {@code before}, then {@code body}, then {@code after} on every exit path of the body.
     */
    public static <T> T around(final CheckedRunnable before, final Callable<? extends T> body, final CheckedRunnable after)
        throws Exception {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(after, "after");
        return bracket(
            new Callable<Void>() {
                @Override
                public Void call() throws Exception {
                    before.run();
                    return null;
                }
            },
            new CheckedFunction<Void, T>() {
                @Override
                public T apply(Void ignored) throws Exception {
                    return body.call();
                }
            },
            new Release<Void>() {
                @Override
                public void release(Void ignored) throws Exception {
                    after.run();
                }
            }
        );
    }

    /**
     * Runs {@code finalizer}, masked, after {@code body} on every exit path.
     */
    public static <T> T ensure(Callable<? extends T> body, CheckedRunnable finalizer) throws Exception {
        return around(NOTHING, body, finalizer);
    }

    /**
     * Runs {@code handler}, masked, only if {@code body} fails; the failure is then rethrown.
     */
    public static <T> T onFailure(Callable<? extends T> body, CheckedRunnable handler) throws Exception {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(handler, "handler");
        try {
            return body.call();
        } catch (Throwable failure) {
            boolean created = !Masking.hasGate();
            InterruptGate gate = Masking.gate();
            try {
                runMasked(gate, handler, failure);
            } finally {
                if (created) {
                    Masking.discard(gate);
                }
            }
            throw failure;
        }
    }

    private static <R> void releaseMasked(final InterruptGate gate, final Release<? super R> release, final R resource,
                                          Throwable primary) throws Exception {
        runMasked(gate, new CheckedRunnable() {
            @Override
            public void run() throws Exception {
                release.release(resource);
            }
        }, primary);
    }

    private static void runMasked(InterruptGate gate, CheckedRunnable cleanup, Throwable primary) throws Exception {
        gate.mask();
        try {
            cleanup.run();
        } catch (Throwable cleanupFailure) {
            if (primary == null) {
                throw cleanupFailure;
            }
            primary.addSuppressed(cleanupFailure);
        } finally {
            gate.unmask();
        }
    }
}
