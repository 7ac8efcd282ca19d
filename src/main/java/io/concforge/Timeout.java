package io.concforge;

import io.concforge.internal.InterruptGate;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * 在当前线程上限时执行一段代码。
 *
 * <p>到期时通过当前线程的中断闸门发出中断（见 {@link Masking}），因此处于屏蔽区的代码不会被打断，
 * 中断会延后到离开屏蔽区时投递。对 {@code runConc} 使用时，求值会先取消并等待全部叶子清理完成，
 * 之后 {@code timeout} 才报告超时。
 *
 * <p>边界语义：
 * 负数时长表示不限时；
 * 零时长直接报告超时，不执行代码体。
 *
 * <p>示例：
 * <pre>{@code
 * TimeoutOutcome<String> outcome = Timeout.timeout(Duration.ofMillis(200), () -> runtime.runConc(tree));
 * if (outcome.isTimedOut()) {
 *     // fall back
 * }
 * }</pre>
 */
public final class Timeout {

    private Timeout() {
    }

    public static <T> TimeoutOutcome<T> timeout(Duration bound, Callable<? extends T> body) throws Exception {
        return timeout(bound, body, DelayScheduler.shared());
    }

    /**
     * 使用指定的延迟调度器触发到期。
     */
    public static <T> TimeoutOutcome<T> timeout(Duration bound, Callable<? extends T> body, DelayScheduler delayScheduler)
        throws Exception {
        Objects.requireNonNull(bound, "bound");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(delayScheduler, "delayScheduler");
        if (bound.isNegative()) {
            return TimeoutOutcome.<T>completed(body.call());
        }
        if (bound.isZero()) {
            return TimeoutOutcome.timedOut();
        }

        boolean created = !Masking.hasGate();
        InterruptGate gate = Masking.gate();
        try {
            return runBounded(bound, body, delayScheduler, gate);
        } finally {
            if (created) {
                Masking.discard(gate);
            }
        }
    }

    private static <T> TimeoutOutcome<T> runBounded(Duration bound, Callable<? extends T> body, DelayScheduler delayScheduler,
                                                    InterruptGate gate) throws Exception {
        final Expiry expiry = new Expiry(gate);
        ScheduledTask timer = delayScheduler.schedule(bound, new Runnable() {
            @Override
            public void run() {
                expiry.fire();
            }
        });

        final T value;
        try {
            value = body.call();
        } catch (Throwable failure) {
            timer.cancel();
            if (expiry.settle()) {
                gate.consumeInterrupt();
                return TimeoutOutcome.timedOut();
            }
            throw failure;
        }
        timer.cancel();
        if (expiry.settle()) {
            // The body finished before it noticed the interrupt.
            gate.consumeInterrupt();
        }
        return TimeoutOutcome.<T>completed(value);
    }

    /**
     * Decides, once, whether the timer or the body got there first.
     */
    private static final class Expiry {

        private static final int RUNNING = 0;
        private static final int EXPIRED = 1;
        private static final int SETTLED = 2;

        private final InterruptGate gate;
        private int state;

        private Expiry(InterruptGate gate) {
            this.gate = gate;
            this.state = RUNNING;
        }

        synchronized void fire() {
            if (state == RUNNING) {
                state = EXPIRED;
                gate.interrupt();
            }
        }

        /**
         * @return true if the timer fired before the body finished.
         */
        synchronized boolean settle() {
            if (state == RUNNING) {
                state = SETTLED;
                return false;
            }
            return state == EXPIRED;
        }
    }
}
