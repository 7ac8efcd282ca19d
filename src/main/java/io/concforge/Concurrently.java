package io.concforge;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;

/**
 * Static entry points backed by one shared {@link ConcRuntime} with default settings.
 *
 * <p>The shared runtime holds configuration and counters only; every call is an independent
 * evaluation. Code that needs its own scheduler, deadline or hook creates a {@link ConcRuntime}.
 */
public final class Concurrently {

    private static final ConcRuntime DEFAULT = ConcRuntime.create();

    private Concurrently() {
    }

    public static ConcRuntime runtime() {
        return DEFAULT;
    }

    public static <T> T runConc(Conc<T> tree) {
        return DEFAULT.runConc(tree);
    }

    public static void replicateConcurrentlyDiscard(int n, CheckedRunnable action) {
        DEFAULT.replicateConcurrentlyDiscard(n, action);
    }

    public static <T> List<T> replicateConcurrently(int n, Callable<? extends T> callable) {
        return DEFAULT.replicateConcurrently(n, callable);
    }

    public static <A, B> List<B> mapConcurrently(Collection<? extends A> items, CheckedFunction<? super A, ? extends B> function) {
        return DEFAULT.mapConcurrently(items, function);
    }

    public static <A> void mapConcurrentlyDiscard(Collection<? extends A> items, CheckedFunction<? super A, ?> function) {
        DEFAULT.mapConcurrentlyDiscard(items, function);
    }

    public static <A, B, C> C concurrently(
        Callable<? extends A> first,
        Callable<? extends B> second,
        BiFunction<? super A, ? super B, ? extends C> combine
    ) {
        return DEFAULT.concurrently(first, second, combine);
    }

    public static <T> T race(Callable<? extends T> first, Callable<? extends T> second) {
        return DEFAULT.race(first, second);
    }
}
