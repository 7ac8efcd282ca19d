package io.concforge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConcurrentlyTest {

    @Test
    void sharedRuntimeIsStable() {
        assertSame(Concurrently.runtime(), Concurrently.runtime());
        assertEquals("x", Concurrently.runConc(Conc.pure("x")));
    }

    @Test
    void replicateConcurrentlyDiscardCountsInvocations() {
        final AtomicInteger runs = new AtomicInteger();
        Concurrently.replicateConcurrentlyDiscard(9, new CheckedRunnable() {
            @Override
            public void run() {
                runs.incrementAndGet();
            }
        });
        assertEquals(9, runs.get());
    }

    @Test
    void replicateConcurrentlyCollectsResults() {
        List<String> values = Concurrently.replicateConcurrently(3, new Callable<String>() {
            @Override
            public String call() {
                return Thread.currentThread().getName();
            }
        });
        assertEquals(3, values.size());
    }

    @Test
    void mapConcurrentlyKeepsInputOrder() {
        List<String> upper = Concurrently.mapConcurrently(Arrays.asList("a", "b", "c"), new CheckedFunction<String, String>() {
            @Override
            public String apply(String value) throws Exception {
                Thread.sleep(value.equals("a") ? 60L : 5L);
                return value.toUpperCase();
            }
        });
        assertEquals(Arrays.asList("A", "B", "C"), upper);

        final AtomicInteger total = new AtomicInteger();
        Concurrently.mapConcurrentlyDiscard(Arrays.asList(1, 2, 3), new CheckedFunction<Integer, Integer>() {
            @Override
            public Integer apply(Integer value) {
                return total.addAndGet(value);
            }
        });
        assertEquals(6, total.get());
    }

    @Test
    void concurrentlyCombinesBothResults() {
        String combined = Concurrently.concurrently(
            new Callable<String>() {
                @Override
                public String call() {
                    return "left";
                }
            },
            new Callable<Integer>() {
                @Override
                public Integer call() {
                    return 2;
                }
            },
            new BiFunction<String, Integer, String>() {
                @Override
                public String apply(String left, Integer right) {
                    return left + right;
                }
            }
        );
        assertEquals("left2", combined);
    }

    @Test
    void raceReturnsTheFirstSuccess() {
        final CountDownLatch neverReleased = new CountDownLatch(1);
        String winner = Concurrently.race(
            new Callable<String>() {
                @Override
                public String call() throws Exception {
                    neverReleased.await();
                    return "blocked";
                }
            },
            new Callable<String>() {
                @Override
                public String call() {
                    return "quick";
                }
            }
        );
        assertEquals("quick", winner);
    }

    @Test
    void raceFailsOnlyWhenBothSidesFail() {
        IllegalStateException thrown = assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                Concurrently.race(
                    new Callable<String>() {
                        @Override
                        public String call() {
                            throw new IllegalStateException("first");
                        }
                    },
                    new Callable<String>() {
                        @Override
                        public String call() throws Exception {
                            Thread.sleep(100L);
                            throw new IllegalStateException("second");
                        }
                    }
                );
            }
        });
        assertEquals("first", thrown.getMessage());
    }
}
