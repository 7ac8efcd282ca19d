package io.concforge;

import io.concforge.internal.InterruptGate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MaskingTest {

    @AfterEach
    void clearInterruptStatus() {
        Thread.interrupted();
        Masking.restore(null);
    }

    @Test
    void stateFollowsNestedRegions() throws Exception {
        assertEquals(MaskingState.UNMASKED, Masking.state());
        Masking.uninterruptible(new CheckedRunnable() {
            @Override
            public void run() throws Exception {
                assertEquals(MaskingState.MASKED, Masking.state());
                Masking.uninterruptible(new CheckedRunnable() {
                    @Override
                    public void run() {
                        assertEquals(MaskingState.MASKED, Masking.state());
                    }
                });
                assertEquals(MaskingState.MASKED, Masking.state());
            }
        });
        assertEquals(MaskingState.UNMASKED, Masking.state());
    }

    @Test
    void gateInterruptIsDeferredUntilRegionExits() throws Exception {
        String result = Masking.uninterruptible(new Callable<String>() {
            @Override
            public String call() throws Exception {
                Masking.gate().interrupt();
                assertFalse(Thread.currentThread().isInterrupted());
                Thread.sleep(20L);
                return "slept";
            }
        });
        assertEquals("slept", result);
        assertTrue(Thread.interrupted());
    }

    @Test
    void interruptStatusPresentOnEntryIsHeldBack() throws Exception {
        Thread.currentThread().interrupt();
        Masking.uninterruptible(new CheckedRunnable() {
            @Override
            public void run() throws Exception {
                assertFalse(Thread.currentThread().isInterrupted());
                Thread.sleep(10L);
            }
        });
        assertTrue(Thread.interrupted());
    }

    @Test
    void unmaskedGateInterruptsImmediately() {
        Masking.gate().interrupt();
        assertTrue(Thread.interrupted());
    }

    @Test
    void gatesCreatedForARegionAreRemovedWhenItEnds() throws Exception {
        final List<String> leftovers = Collections.synchronizedList(new ArrayList<String>());
        final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
        Thread caller = new Thread(new Runnable() {
            @Override
            public void run() {
                try {
                    Masking.uninterruptible(new CheckedRunnable() {
                        @Override
                        public void run() {
                        }
                    });
                    record(leftovers, "uninterruptible");

                    Bracket.ensure(new Callable<String>() {
                        @Override
                        public String call() {
                            return "used";
                        }
                    }, new CheckedRunnable() {
                        @Override
                        public void run() {
                        }
                    });
                    record(leftovers, "bracket");

                    Timeout.timeout(Duration.ofSeconds(5L), new Callable<String>() {
                        @Override
                        public String call() {
                            return "fast";
                        }
                    });
                    record(leftovers, "timeout");

                    Masking.uninterruptible(new CheckedRunnable() {
                        @Override
                        public void run() throws Exception {
                            Bracket.ensure(new Callable<String>() {
                                @Override
                                public String call() {
                                    return "nested";
                                }
                            }, new CheckedRunnable() {
                                @Override
                                public void run() {
                                }
                            });
                            if (!Masking.hasGate() || Masking.state() != MaskingState.MASKED) {
                                leftovers.add("outer region lost its gate");
                            }
                        }
                    });
                    record(leftovers, "nested");
                } catch (Throwable e) {
                    failure.set(e);
                }
            }
        }, "masking-caller");
        caller.start();
        caller.join(5_000L);

        assertFalse(caller.isAlive());
        assertNull(failure.get());
        assertEquals(Collections.<String>emptyList(), leftovers);
    }

    @Test
    void existingGateSurvivesRegionExit() throws Exception {
        InterruptGate gate = Masking.gate();
        try {
            Masking.uninterruptible(new CheckedRunnable() {
                @Override
                public void run() {
                }
            });
            assertSame(gate, Masking.gate());
        } finally {
            Masking.discard(gate);
        }
        assertFalse(Masking.hasGate());
    }

    @Test
    void regionIsLeftWhenBodyFails() {
        IllegalStateException thrown = assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Masking.uninterruptible(new CheckedRunnable() {
                    @Override
                    public void run() {
                        throw new IllegalStateException("inside");
                    }
                });
            }
        });
        assertEquals("inside", thrown.getMessage());
        assertEquals(MaskingState.UNMASKED, Masking.state());
    }

    private static void record(List<String> leftovers, String step) {
        if (Masking.hasGate()) {
            leftovers.add(step);
        }
    }
}
