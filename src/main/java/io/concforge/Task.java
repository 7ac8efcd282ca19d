package io.concforge;

import io.concforge.internal.DefaultCancellationToken;
import io.concforge.internal.InterruptGate;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单个叶子任务的句柄。
 *
 * <p>{@code Task} 在 {@link CompletableFuture} 之上补充了任务状态、可观察的取消完成点以及统一的异常转换。
 * 句柄只存在于一次 {@code runConc} 求值内部，求值返回前所有句柄都已停止。
 *
 * <p>取消分两步：{@link #requestCancel()} 通过线程的中断闸门发出中断并置位取消令牌，
 * {@link #awaitStopped()} 等待执行线程真正退出（包括 {@code finally} 与 {@link Bracket} 的释放动作）。
 * {@link #cancel()} 依次执行两者。
 */
public final class Task<T> {

    /**
     * 任务生命周期状态。
     */
    public enum State {
        /** 已创建但尚未运行。 */
        PENDING,
        /** 正在运行。 */
        RUNNING,
        /** 成功完成。 */
        SUCCESS,
        /** 失败完成。 */
        FAILED,
        /** 已取消。 */
        CANCELLED
    }

    private final long id;
    private final String name;
    private final CompletableFuture<T> future;
    private final AtomicReference<State> state;
    private final DefaultCancellationToken token;
    private final CountDownLatch stopped;
    private volatile InterruptGate gate;

    /**
     * 包级构造函数，仅供 {@link ConcRuntime} 创建任务句柄。
     */
    Task(long id, String name) {
        this.id = id;
        this.name = name;
        this.future = new CompletableFuture<T>();
        this.state = new AtomicReference<State>(State.PENDING);
        this.stopped = new CountDownLatch(1);
        this.token = new DefaultCancellationToken(new Runnable() {
            @Override
            public void run() {
                InterruptGate current = gate;
                if (current != null) {
                    current.interrupt();
                }
            }
        });
    }

    /**
     * 任务 ID（在同一个 runtime 内单调递增）。
     */
    public long id() {
        return id;
    }

    /**
     * 任务名称。
     */
    public String name() {
        return name;
    }

    /**
     * 获取当前任务状态快照。
     */
    public State state() {
        return state.get();
    }

    /**
     * 任务是否已经有结果（成功/失败/取消任一状态）。
     *
     * <p>有结果不代表执行线程已退出，见 {@link #isStopped()}。
     */
    public boolean isDone() {
        return future.isDone();
    }

    /**
     * 执行线程是否已经退出任务体（含清理动作与回调）。
     */
    public boolean isStopped() {
        return stopped.getCount() == 0L;
    }

    public boolean isCancelled() {
        return state.get() == State.CANCELLED;
    }

    public boolean isFailed() {
        return state.get() == State.FAILED;
    }

    /**
     * 任务的取消令牌。
     */
    public CancellationToken token() {
        return token;
    }

    /**
     * 请求取消并阻塞等待任务停止。
     *
     * <p>等待不可被中断；若等待期间当前线程收到中断，返回前会恢复中断标记。
     * 对已结束的任务调用无副作用。
     */
    public void cancel() {
        requestCancel();
        awaitStopped();
    }

    /**
     * 等待任务完成并返回结果。
     *
     * <p>异常语义：
     * 若被取消抛 {@link CancelledException}；
     * 若任务抛运行时异常/错误则原样传播；
     * 若任务抛 checked exception 则包装为 {@link TaskExecutionException}。
     */
    public T await() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Task await interrupted", e);
        } catch (CancellationException e) {
            throw new CancelledException("Task cancelled", e);
        } catch (ExecutionException e) {
            rethrow(e.getCause());
            return null;
        }
    }

    /**
     * 发出取消请求但不等待。
     *
     * <p>尚未开始的任务直接进入 {@link State#CANCELLED}，之后不会再运行；
     * 运行中的任务会收到中断（若处于屏蔽区则延后投递）。
     */
    void requestCancel() {
        if (state.compareAndSet(State.PENDING, State.CANCELLED)) {
            token.markCancelledWithoutCallback();
            future.completeExceptionally(new CancelledException("Task cancelled before start"));
            stopped.countDown();
            return;
        }
        if (state.get() == State.RUNNING) {
            token.cancel();
        }
    }

    /**
     * 不可中断地等待执行线程退出。
     */
    void awaitStopped() {
        boolean interrupted = false;
        while (true) {
            try {
                stopped.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    CompletableFuture<T> toCompletableFuture() {
        return future;
    }

    /**
     * 记录执行线程的中断闸门并标记为运行中。
     *
     * @return false 表示任务在开始前已被取消，不应再执行。
     */
    boolean markRunning(InterruptGate runnerGate) {
        this.gate = runnerGate;
        return state.compareAndSet(State.PENDING, State.RUNNING);
    }

    /**
     * 根据执行结果设置终态并完成 future；已请求取消的任务一律记为取消。
     */
    State finish(T value, Throwable failure) {
        State terminal;
        if (token.isCancelled()) {
            terminal = State.CANCELLED;
        } else if (failure != null) {
            terminal = State.FAILED;
        } else {
            terminal = State.SUCCESS;
        }
        state.set(terminal);

        if (terminal == State.SUCCESS) {
            future.complete(value);
        } else if (terminal == State.FAILED) {
            future.completeExceptionally(failure);
        } else if (failure instanceof CancelledException) {
            future.completeExceptionally(failure);
        } else {
            future.completeExceptionally(new CancelledException("Task cancelled", failure));
        }
        return terminal;
    }

    /**
     * 提交被执行器拒绝时，直接以失败结束。
     */
    boolean reject(Throwable failure) {
        if (!state.compareAndSet(State.PENDING, State.FAILED)) {
            return false;
        }
        future.completeExceptionally(failure);
        stopped.countDown();
        return true;
    }

    void markStopped() {
        stopped.countDown();
    }

    /**
     * 统一异常转换并重新抛出。
     */
    private void rethrow(Throwable cause) {
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new TaskExecutionException("Task execution failed", cause);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", name='" + name + "', state=" + state.get() + "}";
    }
}
