package eu.virtualparadox.docclassifier.classify;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Bounds how many documents use the shared model handle at once. With one slot, which is the
 * default, documents are classified strictly one after the other.
 */
@Slf4j
public class InferenceGate {

    private final Semaphore slots;
    private final int capacity;

    public InferenceGate(final int slots) {
        this.capacity = Math.max(1, slots);
        this.slots = new Semaphore(capacity, true);
    }

    public int capacity() {
        return capacity;
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    /**
     * Runs {@code task} while holding a slot, waiting as long as needed for one.
     *
     * @param task        work to run
     * @param onInterrupt result to return if the wait is interrupted
     */
    public <T> T withSlot(final Supplier<T> task, final Supplier<T> onInterrupt) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for an inference slot");
            return onInterrupt.get();
        }
        try {
            return task.get();
        } finally {
            slots.release();
        }
    }
}
