package io.concforge.internal;

/**
 * The only route through which this library interrupts a thread.
 *
 * <p>While the owning thread is inside a masked region, interrupt requests are recorded as
 * pending and delivered when the outermost region is left. An interrupt status already set on
 * entry is held back the same way, so masked code (resource acquisition and release) never
 * observes cancellation.
 *
 * <p>{@link #mask()}, {@link #unmask()} and {@link #consumeInterrupt()} must be called by the
 * owning thread; {@link #interrupt()} may be called from anywhere.
 */
public final class InterruptGate {

    private final Thread thread;
    private int maskDepth;
    private boolean pending;
    private boolean detached;

    public InterruptGate(Thread thread) {
        this.thread = thread;
    }

    public Thread thread() {
        return thread;
    }

    /**
     * Requests an interrupt of the owning thread.
     *
     * @return false if the gate was already detached and the request was dropped.
     */
    public synchronized boolean interrupt() {
        if (detached) {
            return false;
        }
        if (maskDepth > 0) {
            pending = true;
        } else {
            thread.interrupt();
        }
        return true;
    }

    public synchronized void mask() {
        if (maskDepth++ == 0 && Thread.interrupted()) {
            pending = true;
        }
    }

    public synchronized void unmask() {
        if (maskDepth == 0) {
            throw new IllegalStateException("InterruptGate is not masked");
        }
        maskDepth--;
        if (maskDepth == 0 && pending) {
            pending = false;
            thread.interrupt();
        }
    }

    public synchronized boolean isMasked() {
        return maskDepth > 0;
    }

    /**
     * Stops delivering interrupts. Called when the task that owned the thread has finished,
     * so a late cancel request cannot hit whatever the thread runs next.
     */
    public synchronized void detach() {
        detached = true;
        pending = false;
    }

    /**
     * Drops a pending or delivered interrupt.
     *
     * @return true if there was one.
     */
    public synchronized boolean consumeInterrupt() {
        boolean hadPending = pending;
        pending = false;
        return Thread.interrupted() || hadPending;
    }
}
