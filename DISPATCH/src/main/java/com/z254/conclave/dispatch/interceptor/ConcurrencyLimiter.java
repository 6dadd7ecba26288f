package com.z254.conclave.dispatch.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-blocking counting limiter. Callers that find no free slot wait in FIFO order.
 */
@Slf4j
public class ConcurrencyLimiter {

    private final int maxPermits;
    private final Queue<Waiter> waiters = new ArrayDeque<>();
    private final AtomicInteger drainers = new AtomicInteger();
    private int available;
    private int freed;

    public ConcurrencyLimiter(int maxPermits) {
        if (maxPermits < 1) {
            throw new IllegalArgumentException("Concurrency limit must be positive: " + maxPermits);
        }
        this.maxPermits = maxPermits;
        this.available = maxPermits;
    }

    /**
     * Acquire a slot. The returned permit must be released exactly once; extra releases are ignored.
     * Cancelling a pending acquisition removes the caller from the queue.
     */
    public Mono<Permit> acquire() {
        return Mono.create(sink -> {
            Waiter waiter = new Waiter(sink);
            sink.onCancel(() -> cancel(waiter));

            boolean granted;
            synchronized (this) {
                granted = available > 0 && waiters.isEmpty();
                if (granted) {
                    available--;
                } else {
                    waiters.add(waiter);
                }
            }
            if (granted && !grant(waiter)) {
                releaseSlot();
            }
        });
    }

    public synchronized int availablePermits() {
        return available;
    }

    public synchronized int queueLength() {
        return waiters.size();
    }

    public int maxPermits() {
        return maxPermits;
    }

    private boolean grant(Waiter waiter) {
        Permit permit = new Permit();
        waiter.permit = permit;
        if (waiter.settled.compareAndSet(false, true)) {
            waiter.sink.success(permit);
            return true;
        }
        return false;
    }

    private void cancel(Waiter waiter) {
        if (waiter.settled.compareAndSet(false, true)) {
            synchronized (this) {
                waiters.remove(waiter);
            }
            return;
        }
        // Granted, but the value raced with the cancellation
        Permit permit = waiter.permit;
        if (permit != null) {
            permit.release();
        }
    }

    /**
     * Return a slot. Only the outermost caller hands slots to waiters; a release made while a grant is
     * being delivered on the same stack is recorded and picked up by the running drain loop.
     */
    private void releaseSlot() {
        synchronized (this) {
            freed++;
        }
        if (drainers.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            drainFreedSlots();
            missed = drainers.addAndGet(-missed);
        } while (missed != 0);
    }

    private void drainFreedSlots() {
        while (true) {
            Waiter next;
            synchronized (this) {
                if (freed == 0) {
                    return;
                }
                next = waiters.poll();
                if (next == null) {
                    available = Math.min(maxPermits, available + freed);
                    freed = 0;
                    return;
                }
                freed--;
            }
            if (!grant(next)) {
                synchronized (this) {
                    freed++;
                }
            }
        }
    }

    private static final class Waiter {
        private final MonoSink<Permit> sink;
        private final AtomicBoolean settled = new AtomicBoolean();
        private volatile Permit permit;

        private Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }
    }

    /**
     * A held slot.
     */
    public final class Permit {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                releaseSlot();
            }
        }

        public boolean isReleased() {
            return released.get();
        }
    }
}
