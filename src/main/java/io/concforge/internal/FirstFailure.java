package io.concforge.internal;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-assignment failure slot: the first offered failure wins, later offers are discarded.
 */
public final class FirstFailure {

    private final AtomicReference<Failure> slot;

    public FirstFailure() {
        this.slot = new AtomicReference<Failure>();
    }

    /**
     * @return true if {@code failure} became the recorded failure.
     */
    public boolean offer(Failure failure) {
        return slot.compareAndSet(null, failure);
    }

    public boolean isSet() {
        return slot.get() != null;
    }

    public Failure get() {
        return slot.get();
    }
}
