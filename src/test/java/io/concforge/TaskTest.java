package io.concforge;

import io.concforge.internal.InterruptGate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskTest {

    @Test
    void finishedTaskReportsValue() {
        Task<String> task = new Task<String>(7L, "ok");
        assertEquals(7L, task.id());
        assertEquals("ok", task.name());
        assertEquals(Task.State.PENDING, task.state());

        assertEquals(Task.State.SUCCESS, task.finish("done", null));
        task.markStopped();

        assertEquals("done", task.await());
        assertTrue(task.isDone());
        assertTrue(task.isStopped());
        assertFalse(task.isFailed());
        assertFalse(task.isCancelled());
    }

    @Test
    void awaitRethrowsFailures() {
        final Task<String> checked = new Task<String>(1L, "checked");
        checked.finish(null, new Exception("checked"));
        TaskExecutionException wrapped = assertThrows(TaskExecutionException.class, new Executable() {
            @Override
            public void execute() {
                checked.await();
            }
        });
        assertEquals("checked", wrapped.getCause().getMessage());
        assertTrue(checked.isFailed());

        final IllegalStateException runtimeFailure = new IllegalStateException("runtime");
        final Task<String> unchecked = new Task<String>(2L, "unchecked");
        unchecked.finish(null, runtimeFailure);
        IllegalStateException thrown = assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                unchecked.await();
            }
        });
        assertSame(runtimeFailure, thrown);
    }

    @Test
    void cancellingPendingTaskPreventsItFromRunning() {
        final Task<String> task = new Task<String>(3L, "pending");
        task.cancel();

        assertTrue(task.isCancelled());
        assertTrue(task.isStopped());
        assertTrue(task.token().isCancelled());
        assertFalse(task.markRunning(new InterruptGate(Thread.currentThread())));
        assertThrows(CancelledException.class, new Executable() {
            @Override
            public void execute() {
                task.await();
            }
        });
    }

    @Test
    void cancellingFinishedTaskIsNoOp() {
        Task<Integer> task = new Task<Integer>(4L, "finished");
        task.finish(1, null);
        task.markStopped();
        task.cancel();
        assertEquals(Task.State.SUCCESS, task.state());
        assertEquals(Integer.valueOf(1), task.await());
    }

    @Test
    void cancelWaitsForCleanupOfRunningTask() throws Exception {
        final CountDownLatch running = new CountDownLatch(1);
        final AtomicBoolean cleanedUp = new AtomicBoolean();
        try (ConcRuntime runtime = ConcRuntime.create().withScheduler(Scheduler.threadPerTask())) {
            Task<Void> task = runtime.spawn(1L, "sleeper", new LeafAction<Void>() {
                @Override
                public Void call(CancellationToken token) throws Exception {
                    running.countDown();
                    try {
                        Thread.sleep(Long.MAX_VALUE);
                    } finally {
                        Thread.sleep(50L);
                        cleanedUp.set(true);
                    }
                    return null;
                }
            }, ExecutionContextCarrier.capture());

            assertTrue(running.await(5, TimeUnit.SECONDS));
            assertEquals(Task.State.RUNNING, task.state());
            task.cancel();

            assertTrue(cleanedUp.get());
            assertTrue(task.isStopped());
            assertEquals(Task.State.CANCELLED, task.state());
            assertFalse(Thread.currentThread().isInterrupted());
        }
    }

    @Test
    void busyLeafStopsThroughItsToken() throws Exception {
        final CountDownLatch running = new CountDownLatch(1);
        try (ConcRuntime runtime = ConcRuntime.create().withScheduler(Scheduler.threadPerTask())) {
            final Task<Void> task = runtime.spawn(1L, "token", new LeafAction<Void>() {
                @Override
                public Void call(CancellationToken token) throws Exception {
                    running.countDown();
                    while (true) {
                        token.throwIfCancelled();
                        Thread.yield();
                    }
                }
            }, ExecutionContextCarrier.capture());

            assertTrue(running.await(5, TimeUnit.SECONDS));
            task.cancel();
            assertThrows(CancelledException.class, new Executable() {
                @Override
                public void execute() {
                    task.await();
                }
            });
        }
    }

    @Test
    void rejectedSubmissionFailsTheEvaluation() {
        Executor rejecting = new Executor() {
            @Override
            public void execute(Runnable command) {
                throw new RejectedExecutionException("full");
            }
        };
        try (ConcRuntime runtime = ConcRuntime.create().withScheduler(Scheduler.from(rejecting))) {
            RejectedExecutionException thrown = assertThrows(RejectedExecutionException.class, new Executable() {
                @Override
                public void execute() {
                    runtime.runConc(Conc.pure(1).zipRight(Conc.conc(new java.util.concurrent.Callable<Integer>() {
                        @Override
                        public Integer call() {
                            return 2;
                        }
                    })));
                }
            });
            assertEquals("full", thrown.getMessage());
            assertEquals(1L, runtime.metrics().failed());
            assertEquals(0L, runtime.metrics().started());
        }
    }
}
