package warden.core.service.admission;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import warden.core.config.AdmissionConfig;

/**
 * Caps the number of backend calls in flight across the whole process.
 *
 * <p>A non-blocking counting semaphore: callers beyond the cap are parked in a FIFO
 * queue and resumed when a slot frees up. No thread is blocked while waiting, and the
 * queue has no bound; the backend request timeout only starts once a slot is held.
 *
 * <p>Each granted {@link Slot} is released exactly once, when the guarded call
 * terminates with an item, a failure or a cancellation. A waiter cancelled before it
 * is granted leaves the queue without consuming a slot.
 *
 * <p>A released slot is handed to the next waiter on the Mutiny default executor, never
 * on the releasing caller's stack, so a long queue drains without nesting.
 */
@ApplicationScoped
public class AdmissionController {

    private static final Logger LOG = Logger.getLogger(AdmissionController.class);

    private final int capacity;
    private final Object lock = new Object();
    private final Deque<CompletableFuture<Slot>> waiters = new ArrayDeque<>();
    private int inFlight;

    @Inject
    public AdmissionController(AdmissionConfig config) {
        this(config.maxConcurrentRequests());
    }

    public AdmissionController(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("warden.admission.max-concurrent-requests must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Run {@code call} while holding a slot.
     *
     * <p>The supplier is invoked only after a slot is granted.
     *
     * @param call produces the guarded operation
     * @param <T> the result type
     * @return the result of the guarded operation
     */
    public <T> Uni<T> withSlot(Supplier<Uni<T>> call) {
        return acquire().onItem().transformToUni(slot -> Uni.createFrom()
                .deferred(call::get)
                .onTermination()
                .invoke(slot::release));
    }

    /**
     * Acquire a slot. The caller owns the returned slot and must release it.
     */
    Uni<Slot> acquire() {
        return Uni.createFrom().deferred(() -> {
            final CompletableFuture<Slot> pending;
            synchronized (lock) {
                if (inFlight < capacity) {
                    inFlight++;
                    return Uni.createFrom().item(new Slot());
                }
                pending = new CompletableFuture<>();
                waiters.addLast(pending);
            }
            LOG.debugv("Concurrency cap of {0} reached, queueing request", capacity);
            return Uni.createFrom().completionStage(pending).onCancellation().invoke(() -> abandon(pending));
        });
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        synchronized (lock) {
            return inFlight;
        }
    }

    public int waiting() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    private void abandon(CompletableFuture<Slot> pending) {
        synchronized (lock) {
            if (waiters.remove(pending)) {
                return;
            }
        }
        // Already dequeued for a grant: cancel the pending grant, or return a slot granted meanwhile
        if (!pending.cancel(false)) {
            pending.join().release();
        }
    }

    private void releasePermit() {
        final CompletableFuture<Slot> next;
        synchronized (lock) {
            next = waiters.pollFirst();
            if (next == null) {
                inFlight--;
                return;
            }
        }
        // The slot passes to the next waiter; inFlight is unchanged
        Infrastructure.getDefaultExecutor().execute(() -> {
            if (!next.complete(new Slot())) {
                // Waiter was cancelled after leaving the queue
                releasePermit();
            }
        });
    }

    /**
     * A concurrency permit. Releasing twice has no effect.
     */
    public final class Slot {

        private final AtomicBoolean released = new AtomicBoolean();

        private Slot() {}

        public void release() {
            if (released.compareAndSet(false, true)) {
                releasePermit();
            }
        }
    }
}
