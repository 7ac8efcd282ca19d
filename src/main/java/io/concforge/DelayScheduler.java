package io.concforge;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * 一次性延迟任务调度器，承载 {@link Timeout} 的到期触发。
 *
 * <p>到期回调只做“请求中断”这类轻量动作，因此共享一个守护线程即可；
 * 在多个调用方之间共享时是线程安全的。
 */
public final class DelayScheduler {

    private static final DelayScheduler SHARED = new DelayScheduler(createSharedExecutor());

    private final ScheduledExecutorService executor;

    private DelayScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    /**
     * 获取进程级共享调度器实例。
     */
    public static DelayScheduler shared() {
        return SHARED;
    }

    /**
     * 基于外部 {@link ScheduledExecutorService} 构造包装，生命周期由调用方负责。
     */
    public static DelayScheduler from(ScheduledExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        return new DelayScheduler(executor);
    }

    /**
     * 提交一次性延迟任务。
     *
     * <p>示例：
     * <pre>{@code
     * ScheduledTask expiry = DelayScheduler.shared().schedule(Duration.ofMillis(200), () -> gate.interrupt());
     * }</pre>
     */
    public ScheduledTask schedule(Duration delay, Runnable runnable) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(runnable, "runnable");
        ScheduledFuture<?> future = executor.schedule(runnable, Math.max(0L, delay.toNanos()), TimeUnit.NANOSECONDS);
        return new DefaultScheduledTask(future);
    }

    private static ScheduledExecutorService createSharedExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, new ThreadFactory() {
            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "concforge-delay");
                thread.setDaemon(true);
                return thread;
            }
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    private static final class DefaultScheduledTask implements ScheduledTask {

        private final ScheduledFuture<?> future;

        private DefaultScheduledTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
