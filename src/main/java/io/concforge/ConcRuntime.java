package io.concforge;

import io.concforge.internal.InterruptGate;
import io.concforge.internal.RunMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;

/**
 * {@link Conc} 树的求值环境。
 *
 * <p>{@code ConcRuntime} 持有调度器、截止时间、生命周期回调与内置指标，但不持有任何任务状态：
 * 每次 {@link #runConc(Conc)} 都创建独立的求值过程，返回前取消并等待该次求值派生的全部任务。
 *
 * <p>线程安全约束：
 * 配置方法（{@code with*}）只能在第一次求值前调用；
 * 之后可以在多个线程上并发调用 {@code runConc}。
 *
 * <p>上下文传播：
 * 求值开始时捕获调用线程中的 {@link Context} 与 OpenTelemetry 上下文，并在每个叶子任务中恢复。
 *
 * <p>推荐用法示例：
 * <pre>{@code
 * try (ConcRuntime runtime = ConcRuntime.create()
 *     .withDeadline(Duration.ofSeconds(2))) {
 *     String page = runtime.runConc(Conc.conc("user", () -> loadUser(id))
 *         .zipWith(Conc.conc("orders", () -> loadOrders(id)), (u, o) -> render(u, o)));
 * }
 * }</pre>
 */
public final class ConcRuntime implements AutoCloseable {

    private static final TaskHook NOOP_HOOK = new TaskHook() {
    };

    private final AtomicLong runIdGen;
    private final AtomicLong taskIdGen;
    private final AtomicBoolean closed;
    private final AtomicBoolean configLocked;
    private final RunMetrics metrics;

    private volatile Scheduler scheduler;
    private volatile Duration deadline;
    private volatile TaskHook hook;

    /**
     * 默认值：
     * {@code scheduler=Scheduler.detect()}，
     * 无截止时间，无回调。
     */
    private ConcRuntime() {
        this.runIdGen = new AtomicLong(1L);
        this.taskIdGen = new AtomicLong(1L);
        this.closed = new AtomicBoolean(false);
        this.configLocked = new AtomicBoolean(false);
        this.metrics = new RunMetrics();
        this.scheduler = Scheduler.detect();
        this.deadline = null;
        this.hook = NOOP_HOOK;
    }

    /**
     * 创建新的 runtime 实例，互不共享配置与指标。
     */
    public static ConcRuntime create() {
        return new ConcRuntime();
    }

    /**
     * 指定叶子任务的调度器。
     *
     * <p>必须在首次求值前调用，否则会抛 {@link IllegalStateException}。
     */
    public ConcRuntime withScheduler(Scheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        ensureConfigurable();
        this.scheduler = scheduler;
        return this;
    }

    /**
     * 为每次求值设置截止时间。
     *
     * <p>超时后整棵树被取消并等待清理完成，随后抛出 {@link ConcTimeoutException}。
     *
     * <p>示例：
     * <pre>{@code
     * ConcRuntime runtime = ConcRuntime.create().withDeadline(Duration.ofMillis(300));
     * }</pre>
     */
    public ConcRuntime withDeadline(Duration deadline) {
        Objects.requireNonNull(deadline, "deadline");
        if (deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("deadline must be > 0");
        }
        ensureConfigurable();
        this.deadline = deadline;
        return this;
    }

    /**
     * 设置叶子任务生命周期回调。
     *
     * <p>内置指标始终可用；hook 适合桥接外部日志、指标、Tracing 系统。
     */
    public ConcRuntime withHook(TaskHook hook) {
        Objects.requireNonNull(hook, "hook");
        ensureConfigurable();
        this.hook = hook;
        return this;
    }

    /**
     * 为每个叶子创建一个 OpenTelemetry span，与已配置的 hook 组合使用。
     */
    public ConcRuntime withOpenTelemetry() {
        ensureConfigurable();
        OpenTelemetryHook otelHook = OpenTelemetryHook.create("io.concforge");
        this.hook = hook == NOOP_HOOK ? otelHook : TaskHooks.compose(hook, otelHook);
        return this;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * 每次求值的截止时间，未设置时为 {@code null}。
     */
    public Duration deadline() {
        return deadline;
    }

    public TaskHook hook() {
        return hook;
    }

    /**
     * 获取内置指标快照。
     *
     * <p>示例：
     * <pre>{@code
     * RunMetricsSnapshot snapshot = runtime.metrics();
     * long started = snapshot.started();
     * }</pre>
     */
    public RunMetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    /**
     * 对树求值并返回结果。
     *
     * <p>异常语义：
     * 叶子抛出的运行时异常/错误原样传播，checked exception 包装为 {@link TaskExecutionException}；
     * 空分支抛 {@link EmptyAlternativeException}；
     * 调用线程被中断时抛 {@link CancelledException} 并保留中断标记；
     * 超过截止时间抛 {@link ConcTimeoutException}。
     * 任何情况下，返回或抛出前该次求值派生的任务都已停止。
     */
    public <T> T runConc(Conc<T> tree) {
        Objects.requireNonNull(tree, "tree");
        lockConfiguration();
        ensureOpen();
        metrics.recordRun();
        return new ConcEvaluator(this, runIdGen.getAndIncrement(), deadline).evaluate(tree);
    }

    /**
     * 并发执行 {@code n} 次 {@code action}，丢弃结果；{@code n <= 0} 时不派生任何任务。
     */
    public void replicateConcurrentlyDiscard(int n, CheckedRunnable action) {
        runConc(Conc.replicateDiscard(n, action));
    }

    /**
     * 并发执行 {@code n} 次 {@code callable}，结果按派生顺序返回。
     */
    public <T> List<T> replicateConcurrently(int n, Callable<? extends T> callable) {
        return runConc(Conc.<T>replicate(n, callable));
    }

    /**
     * 对每个元素并发执行 {@code function}，结果与输入顺序一致。
     */
    public <A, B> List<B> mapConcurrently(Collection<? extends A> items, CheckedFunction<? super A, ? extends B> function) {
        return runConc(Conc.<B>all(this.<A, B>leaves(items, function)));
    }

    public <A> void mapConcurrentlyDiscard(Collection<? extends A> items, CheckedFunction<? super A, ?> function) {
        runConc(Conc.<Object>all(this.<A, Object>leaves(items, function)));
    }

    /**
     * 并发执行两个动作并合并结果；任一失败则取消另一个。
     */
    public <A, B, C> C concurrently(
        Callable<? extends A> first,
        Callable<? extends B> second,
        BiFunction<? super A, ? super B, ? extends C> combine
    ) {
        return runConc(Conc.<A>conc(first).zipWith(Conc.<B>conc(second), combine));
    }

    /**
     * 两个动作竞速，返回先成功者的结果并取消另一个。
     */
    public <T> T race(Callable<? extends T> first, Callable<? extends T> second) {
        return runConc(Conc.<T>conc(first).or(Conc.<T>conc(second)));
    }

    /**
     * 关闭 runtime；若调度器持有执行器所有权则一并关闭。重复调用无副作用。
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdownIfOwned();
    }

    /**
     * 派生一个叶子任务（包级方法，供求值过程调用）。
     */
    <T> Task<T> spawn(long runId, String name, final LeafAction<T> action, final ExecutionContextCarrier carrier) {
        long id = taskIdGen.getAndIncrement();
        String taskName = name == null ? "leaf-" + id : name;
        final Task<T> task = new Task<T>(id, taskName);
        final TaskInfo info = new TaskInfo(runId, id, taskName, Instant.now(), scheduler.name());
        try {
            scheduler.executor().execute(new Runnable() {
                @Override
                public void run() {
                    runLeaf(task, info, action, carrier);
                }
            });
        } catch (RejectedExecutionException rejectedExecutionException) {
            if (task.reject(rejectedExecutionException)) {
                safeHookFailure(info, rejectedExecutionException, 0L);
            }
        }
        return task;
    }

    private <A, B> List<Conc<B>> leaves(Collection<? extends A> items, final CheckedFunction<? super A, ? extends B> function) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(function, "function");
        List<Conc<B>> leaves = new ArrayList<Conc<B>>(items.size());
        for (final A item : items) {
            leaves.add(Conc.<B>conc(new Callable<B>() {
                @Override
                public B call() throws Exception {
                    return function.apply(item);
                }
            }));
        }
        return leaves;
    }

    /**
     * 在执行线程上运行叶子：安装新的未屏蔽中断闸门与调用方上下文，执行动作，记录终态并触发回调，
     * 最后撤下闸门并标记任务停止。
     */
    private <T> void runLeaf(
        final Task<T> task,
        final TaskInfo info,
        final LeafAction<T> action,
        ExecutionContextCarrier carrier
    ) {
        InterruptGate gate = new InterruptGate(Thread.currentThread());
        InterruptGate previous = Masking.install(gate);
        // Stale status from whatever the thread ran before.
        Thread.interrupted();
        try {
            if (!task.markRunning(gate)) {
                return;
            }
            carrier.run(new Runnable() {
                @Override
                public void run() {
                    executeLeaf(task, info, action);
                }
            });
        } finally {
            gate.detach();
            Thread.interrupted();
            Masking.restore(previous);
            task.markStopped();
        }
    }

    private <T> void executeLeaf(Task<T> task, TaskInfo info, LeafAction<T> action) {
        long started = System.nanoTime();
        safeHookStart(info);

        T value = null;
        Throwable failure = null;
        try {
            task.token().throwIfCancelled();
            value = action.call(task.token());
        } catch (Throwable throwable) {
            failure = throwable;
        }

        Task.State terminal = task.finish(value, failure);
        long elapsed = elapsedNanos(started);
        if (terminal == Task.State.SUCCESS) {
            safeHookSuccess(info, elapsed);
        } else if (terminal == Task.State.FAILED) {
            safeHookFailure(info, failure, elapsed);
        } else {
            safeHookCancel(info, elapsed);
        }
    }

    /**
     * 校验 runtime 未关闭。
     */
    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("ConcRuntime already closed");
        }
    }

    /**
     * 校验当前阶段允许修改配置。
     */
    private void ensureConfigurable() {
        ensureOpen();
        if (configLocked.get()) {
            throw new IllegalStateException("ConcRuntime configuration is locked after first evaluation");
        }
    }

    private void lockConfiguration() {
        configLocked.set(true);
    }

    private long elapsedNanos(long startedAtNanos) {
        return Math.max(0L, System.nanoTime() - startedAtNanos);
    }

    /**
     * 安全触发 onStart：记录内置指标，回调异常只计数不传播。
     */
    private void safeHookStart(TaskInfo info) {
        metrics.recordStart();
        if (hook == NOOP_HOOK) {
            return;
        }
        try {
            hook.onStart(info);
        } catch (Throwable hookFailure) {
            metrics.recordHookFailure();
        }
    }

    private void safeHookSuccess(TaskInfo info, long durationNanos) {
        metrics.recordTerminal(Task.State.SUCCESS, durationNanos);
        if (hook == NOOP_HOOK) {
            return;
        }
        try {
            hook.onSuccess(info, Duration.ofNanos(durationNanos));
        } catch (Throwable hookFailure) {
            metrics.recordHookFailure();
        }
    }

    private void safeHookFailure(TaskInfo info, Throwable throwable, long durationNanos) {
        metrics.recordTerminal(Task.State.FAILED, durationNanos);
        if (hook == NOOP_HOOK) {
            return;
        }
        try {
            hook.onFailure(info, throwable, Duration.ofNanos(durationNanos));
        } catch (Throwable hookFailure) {
            metrics.recordHookFailure();
        }
    }

    private void safeHookCancel(TaskInfo info, long durationNanos) {
        metrics.recordTerminal(Task.State.CANCELLED, durationNanos);
        if (hook == NOOP_HOOK) {
            return;
        }
        try {
            hook.onCancel(info, Duration.ofNanos(durationNanos));
        } catch (Throwable hookFailure) {
            metrics.recordHookFailure();
        }
    }
}
