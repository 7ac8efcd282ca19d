package io.concforge;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerTest {

    @Test
    void detectPrefersVirtualThreadsWhenAvailable() {
        Scheduler scheduler = Scheduler.detect();
        assertNotNull(scheduler);
        if (Scheduler.isVirtualThreadSupported()) {
            assertTrue(scheduler.isVirtualThreadMode());
            assertSame(scheduler, Scheduler.virtualThreads());
        } else {
            assertSame(Scheduler.threadPerTask(), scheduler);
            assertSame(Scheduler.threadPerTask(), Scheduler.virtualThreads());
        }
    }

    @Test
    void threadPerTaskNamesDaemonThreads() {
        try (ConcRuntime runtime = ConcRuntime.create().withScheduler(Scheduler.threadPerTask("probe"))) {
            Thread thread = runtime.runConc(Conc.conc(new Callable<Thread>() {
                @Override
                public Thread call() {
                    return Thread.currentThread();
                }
            }));
            assertTrue(thread.getName().startsWith("probe-"));
            assertTrue(thread.isDaemon());
            assertEquals("threadPerTask(probe)", runtime.scheduler().name());
        }
    }

    @Test
    void externalExecutorIsNotShutDownByRuntime() {
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            ConcRuntime runtime = ConcRuntime.create().withScheduler(Scheduler.from(executor));
            assertEquals(Integer.valueOf(3), runtime.runConc(Conc.conc(new Callable<Integer>() {
                @Override
                public Integer call() {
                    return 3;
                }
            })));
            runtime.close();
            assertFalse(executor.isShutdown());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void owningSchedulerShutsExecutorDownOnClose() {
        ExecutorService executor = Executors.newCachedThreadPool();
        ConcRuntime runtime = ConcRuntime.create().withScheduler(Scheduler.owning(executor));
        runtime.runConc(Conc.unit());
        runtime.close();
        assertTrue(executor.isShutdown());
    }

    @Test
    void delaySchedulerRunsAndCancels() throws Exception {
        final CountDownLatch ran = new CountDownLatch(1);
        DelayScheduler.shared().schedule(Duration.ofMillis(10), new Runnable() {
            @Override
            public void run() {
                ran.countDown();
            }
        });
        assertTrue(ran.await(5, TimeUnit.SECONDS));

        final CountDownLatch never = new CountDownLatch(1);
        ScheduledTask cancelled = DelayScheduler.shared().schedule(Duration.ofSeconds(30), new Runnable() {
            @Override
            public void run() {
                never.countDown();
            }
        });
        assertTrue(cancelled.cancel());
        assertTrue(cancelled.isCancelled());
        assertTrue(cancelled.isDone());
        assertEquals(1L, never.getCount());
    }
}
