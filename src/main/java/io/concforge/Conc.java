package io.concforge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Immutable description of a tree of concurrent work.
 *
 * <p>A {@code Conc} is built from leaves (one unit of work each) with two combinators:
 * <ul>
 *     <li>{@link #zipWith(Conc, BiFunction)} (AND): both sides run concurrently and both must
 *     succeed. The first side to fail, in the order failures are observed, decides the error and
 *     the other side is cancelled.</li>
 *     <li>{@link #or(Conc)} (OR): both sides race. The first success wins and the losers are
 *     cancelled; if every side fails, the failure observed first is raised.</li>
 * </ul>
 *
 * <p>Building a tree runs nothing. A tree may be passed to {@link ConcRuntime#runConc(Conc)} any
 * number of times and every evaluation is independent.
 *
 * <p>Example:
 * <pre>{@code
 * Conc<String> profile = Conc.conc("user", () -> loadUser(id))
 *     .zipWith(Conc.conc("orders", () -> loadOrders(id)), (user, orders) -> render(user, orders));
 * Conc<String> fastest = Conc.conc(() -> primary.get(key)).or(Conc.conc(() -> replica.get(key)));
 * }</pre>
 *
 * @param <T> result type
 */
public abstract class Conc<T> {

    private static final Empty<Object> EMPTY = new Empty<Object>();
    private static final Pure<Void> UNIT = new Pure<Void>(null);

    Conc() {
    }

    /**
     * A leaf running {@code callable} in its own task.
     */
    public static <T> Conc<T> conc(Callable<? extends T> callable) {
        return conc(null, callable);
    }

    /**
     * A named leaf; the name shows up in {@link TaskInfo} and task thread diagnostics.
     */
    public static <T> Conc<T> conc(String name, final Callable<? extends T> callable) {
        Objects.requireNonNull(callable, "callable");
        return new Leaf<T>(name, new LeafAction<T>() {
            @Override
            public T call(CancellationToken token) throws Exception {
                return callable.call();
            }
        });
    }

    /**
     * A leaf with no result.
     */
    public static Conc<Void> exec(CheckedRunnable runnable) {
        return exec(null, runnable);
    }

    public static Conc<Void> exec(String name, final CheckedRunnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        return new Leaf<Void>(name, new LeafAction<Void>() {
            @Override
            public Void call(CancellationToken token) throws Exception {
                runnable.run();
                return null;
            }
        });
    }

    /**
     * A leaf that receives its task's {@link CancellationToken}.
     */
    public static <T> Conc<T> cancellable(LeafAction<? extends T> action) {
        return cancellable(null, action);
    }

    public static <T> Conc<T> cancellable(String name, final LeafAction<? extends T> action) {
        Objects.requireNonNull(action, "action");
        return new Leaf<T>(name, new LeafAction<T>() {
            @Override
            public T call(CancellationToken token) throws Exception {
                return action.call(token);
            }
        });
    }

    /**
     * A value known up front. Evaluating it spawns nothing.
     */
    public static <T> Conc<T> pure(T value) {
        return new Pure<T>(value);
    }

    public static Conc<Void> unit() {
        return UNIT;
    }

    /**
     * The alternative that never succeeds.
     *
     * <p>Evaluated alone it fails with {@link EmptyAlternativeException}; as an {@link #or} operand
     * it is ignored.
     */
    @SuppressWarnings("unchecked")
    public static <T> Conc<T> empty() {
        return (Conc<T>) EMPTY;
    }

    /**
     * Runs every element concurrently and collects the results in list order.
     */
    public static <T> Conc<List<T>> all(List<? extends Conc<? extends T>> items) {
        Objects.requireNonNull(items, "items");
        if (items.isEmpty()) {
            return pure(Collections.<T>emptyList());
        }
        List<Conc<?>> operands = new ArrayList<Conc<?>>(items.size());
        for (int i = 0; i < items.size(); i++) {
            operands.add(Objects.requireNonNull(items.get(i), "items[" + i + "]"));
        }
        return new All<T>(operands);
    }

    /**
     * Races every element; an empty list behaves as {@link #empty()}.
     */
    public static <T> Conc<T> any(List<? extends Conc<? extends T>> items) {
        Objects.requireNonNull(items, "items");
        if (items.isEmpty()) {
            return empty();
        }
        Conc<T> acc = widen(Objects.requireNonNull(items.get(0), "items[0]"));
        for (int i = 1; i < items.size(); i++) {
            acc = new Or<T>(acc, Objects.requireNonNull(items.get(i), "items[" + i + "]"));
        }
        return acc;
    }

    /**
     * {@code n} concurrent invocations of {@code callable}, results in spawn order.
     */
    public static <T> Conc<List<T>> replicate(int n, Callable<? extends T> callable) {
        Objects.requireNonNull(callable, "callable");
        List<Conc<T>> leaves = new ArrayList<Conc<T>>(Math.max(0, n));
        for (int i = 0; i < n; i++) {
            leaves.add(Conc.<T>conc(callable));
        }
        return all(leaves);
    }

    /**
     * {@code n} concurrent invocations of {@code action} as a right-folded AND chain, results
     * discarded. {@code n <= 0} yields {@link #unit()}.
     */
    public static Conc<Void> replicateDiscard(int n, CheckedRunnable action) {
        Objects.requireNonNull(action, "action");
        if (n <= 0) {
            return unit();
        }
        Conc<Void> acc = exec(action);
        for (int i = 1; i < n; i++) {
            acc = new And<Void, Void, Void>(exec(action), acc, discard());
        }
        return acc;
    }

    /**
     * AND: runs both trees concurrently and merges their results.
     *
     * <p>An exception thrown by {@code combine} fails this node.
     */
    public <B, C> Conc<C> zipWith(Conc<B> other, BiFunction<? super T, ? super B, ? extends C> combine) {
        Objects.requireNonNull(other, "other");
        Objects.requireNonNull(combine, "combine");
        return new And<T, B, C>(this, other, combine);
    }

    /**
     * AND keeping the right result.
     */
    public <B> Conc<B> zipRight(Conc<B> other) {
        return zipWith(other, new BiFunction<T, B, B>() {
            @Override
            public B apply(T left, B right) {
                return right;
            }
        });
    }

    /**
     * AND keeping the left result.
     */
    public <B> Conc<T> zipLeft(Conc<B> other) {
        return zipWith(other, new BiFunction<T, B, T>() {
            @Override
            public T apply(T left, B right) {
                return left;
            }
        });
    }

    public <B> Conc<B> map(final Function<? super T, ? extends B> function) {
        Objects.requireNonNull(function, "function");
        return zipWith(unit(), new BiFunction<T, Void, B>() {
            @Override
            public B apply(T value, Void ignored) {
                return function.apply(value);
            }
        });
    }

    /**
     * OR: races both trees; the first success wins.
     */
    public Conc<T> or(Conc<? extends T> other) {
        Objects.requireNonNull(other, "other");
        return new Or<T>(this, other);
    }

    // Trees only produce values, so reading a Conc<? extends T> as Conc<T> is safe.
    @SuppressWarnings("unchecked")
    private static <T> Conc<T> widen(Conc<? extends T> conc) {
        return (Conc<T>) conc;
    }

    private static BiFunction<Void, Void, Void> discard() {
        return new BiFunction<Void, Void, Void>() {
            @Override
            public Void apply(Void left, Void right) {
                return null;
            }
        };
    }

    static final class Pure<T> extends Conc<T> {

        final T value;

        Pure(T value) {
            this.value = value;
        }
    }

    static final class Leaf<T> extends Conc<T> {

        final String name;
        final LeafAction<T> action;

        Leaf(String name, LeafAction<T> action) {
            this.name = name;
            this.action = action;
        }
    }

    /**
     * AND over any number of operands: all run concurrently, {@link #merge} sees their results in
     * operand order.
     */
    abstract static class Join<T> extends Conc<T> {

        abstract List<Conc<?>> operands();

        abstract T merge(Object[] values);
    }

    static final class And<A, B, T> extends Join<T> {

        final Conc<? extends A> left;
        final Conc<? extends B> right;
        private final BiFunction<? super A, ? super B, ? extends T> combine;

        And(Conc<? extends A> left, Conc<? extends B> right, BiFunction<? super A, ? super B, ? extends T> combine) {
            this.left = left;
            this.right = right;
            this.combine = combine;
        }

        @Override
        List<Conc<?>> operands() {
            return Arrays.<Conc<?>>asList(left, right);
        }

        @Override
        @SuppressWarnings("unchecked")
        T merge(Object[] values) {
            return combine.apply((A) values[0], (B) values[1]);
        }
    }

    static final class All<T> extends Join<List<T>> {

        private final List<Conc<?>> items;

        All(List<Conc<?>> items) {
            this.items = items;
        }

        @Override
        List<Conc<?>> operands() {
            return items;
        }

        @Override
        @SuppressWarnings("unchecked")
        List<T> merge(Object[] values) {
            List<T> out = new ArrayList<T>(values.length);
            for (Object value : values) {
                out.add((T) value);
            }
            return Collections.unmodifiableList(out);
        }
    }

    static final class Or<T> extends Conc<T> {

        final Conc<? extends T> left;
        final Conc<? extends T> right;

        Or(Conc<? extends T> left, Conc<? extends T> right) {
            this.left = left;
            this.right = right;
        }
    }

    static final class Empty<T> extends Conc<T> {
    }
}
