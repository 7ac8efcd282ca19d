package io.concforge;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 叶子任务的执行载体。
 *
 * <p>{@code Scheduler} 决定每个叶子任务运行在哪个线程上。{@code runConc} 要求同一次求值中的所有叶子
 * 能够同时运行（OR 分支可能永远阻塞，直到被取消），因此默认调度器为“每任务一线程”，
 * 而不是容量有限的线程池。
 *
 * <p>该类型为线程安全且不可变对象。
 */
public final class Scheduler {

    private static final Scheduler THREAD_PER_TASK =
        new Scheduler(new ThreadPerTaskExecutor(new NamedThreadFactory("concforge-leaf")), null, "threadPerTask", false);
    private static volatile Scheduler SHARED_VIRTUAL_THREADS;

    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final String name;
    private final boolean virtualThreadMode;

    private Scheduler(Executor executor, ExecutorService ownedExecutor, String name, boolean virtualThreadMode) {
        this.executor = executor;
        this.ownedExecutor = ownedExecutor;
        this.name = name;
        this.virtualThreadMode = virtualThreadMode;
    }

    /**
     * 每个叶子任务启动一个新的守护平台线程。
     *
     * <p>同一次求值中的叶子从不共享线程。
     */
    public static Scheduler threadPerTask() {
        return THREAD_PER_TASK;
    }

    /**
     * 每任务一线程，线程名使用给定前缀，便于排查线程来源。
     */
    public static Scheduler threadPerTask(String threadNamePrefix) {
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
        return new Scheduler(
            new ThreadPerTaskExecutor(new NamedThreadFactory(threadNamePrefix)),
            null,
            "threadPerTask(" + threadNamePrefix + ")",
            false
        );
    }

    /**
     * 基于外部执行器创建调度器包装。
     *
     * <p>生命周期由调用方管理，runtime 不会关闭该执行器。执行器必须能同时运行一次求值中的全部叶子，
     * 否则排队的叶子可能永远得不到执行。
     */
    public static Scheduler from(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return new Scheduler(executor, null, "external", false);
    }

    /**
     * 与 {@link #from(Executor)} 相同，但 runtime 关闭时会一并关闭该执行器。
     */
    public static Scheduler owning(ExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        return new Scheduler(executor, executor, "owned", false);
    }

    /**
     * 获取共享虚拟线程调度器。
     *
     * <p>若当前 JDK 不支持虚拟线程，则回退到 {@link #threadPerTask()}。
     */
    public static Scheduler virtualThreads() {
        Scheduler scheduler = SHARED_VIRTUAL_THREADS;
        if (scheduler != null) {
            return scheduler;
        }

        synchronized (Scheduler.class) {
            scheduler = SHARED_VIRTUAL_THREADS;
            if (scheduler != null) {
                return scheduler;
            }

            ExecutorService executor = tryCreateVirtualThreadExecutor();
            if (executor == null) {
                return threadPerTask();
            }

            scheduler = new Scheduler(executor, null, "virtualThreads", true);
            SHARED_VIRTUAL_THREADS = scheduler;
            return scheduler;
        }
    }

    /**
     * 自动检测推荐调度器：优先虚拟线程，不支持时使用每任务一线程。
     */
    public static Scheduler detect() {
        if (isVirtualThreadSupported()) {
            return virtualThreads();
        }
        return threadPerTask();
    }

    /**
     * 通过反射探测 {@code Executors.newVirtualThreadPerTaskExecutor()}。
     */
    public static boolean isVirtualThreadSupported() {
        try {
            return Executors.class.getMethod("newVirtualThreadPerTaskExecutor") != null;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    /**
     * 调度器名称（用于 {@link TaskInfo} 与观测）。
     */
    public String name() {
        return name;
    }

    public boolean isVirtualThreadMode() {
        return virtualThreadMode;
    }

    Executor executor() {
        return executor;
    }

    /**
     * 当调度器拥有执行器所有权时，关闭执行器。
     */
    void shutdownIfOwned() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private static ExecutorService tryCreateVirtualThreadExecutor() {
        try {
            Method method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            Object result = method.invoke(null);
            if (result instanceof ExecutorService) {
                return (ExecutorService) result;
            }
        } catch (NoSuchMethodException e) {
            return null;
        } catch (IllegalAccessException e) {
            return null;
        } catch (InvocationTargetException e) {
            return null;
        }
        return null;
    }

    private static final class ThreadPerTaskExecutor implements Executor {

        private final ThreadFactory threadFactory;

        private ThreadPerTaskExecutor(ThreadFactory threadFactory) {
            this.threadFactory = threadFactory;
        }

        @Override
        public void execute(Runnable command) {
            threadFactory.newThread(command).start();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger id;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
            this.id = new AtomicInteger(1);
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + id.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
