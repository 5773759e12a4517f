/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.codeact.domain.system.subagent;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-blocking counting semaphore for reactive pipelines.
 *
 * <p>
 * {@link #acquire()} completes with a {@link Permit} as soon as one is free;
 * otherwise the subscriber waits in FIFO order without holding a thread.
 * Cancelling a waiting subscription removes it from the queue. Release is
 * idempotent per permit.
 *
 * <p>
 * Used with {@code Flux.usingWhen} so the permit is returned on completion,
 * error and cancellation alike.
 */
@Slf4j
public class AdmissionLimiter {

    private final String name;
    private final int capacity;
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int available;

    public AdmissionLimiter(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException(name + " capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.available = capacity;
    }

    public Mono<Permit> acquire() {
        return Mono.create(sink -> {
            Waiter waiter = new Waiter(sink);
            boolean granted;
            synchronized (this) {
                if (available > 0) {
                    available--;
                    granted = true;
                } else {
                    waiters.addLast(waiter);
                    granted = false;
                }
            }
            if (granted) {
                sink.success(new Permit());
                return;
            }
            log.debug("[Admission] {} full ({}), queued waiter #{}", name, capacity, queueLength());
            sink.onCancel(() -> cancel(waiter));
        });
    }

    public synchronized int availablePermits() {
        return available;
    }

    public synchronized int queueLength() {
        return waiters.size();
    }

    public int capacity() {
        return capacity;
    }

    private void cancel(Waiter waiter) {
        synchronized (this) {
            if (waiters.remove(waiter)) {
                return;
            }
        }
        // Granted concurrently with the cancellation: give the permit back.
        if (waiter.permit != null) {
            waiter.permit.release();
        }
    }

    private void releaseOne() {
        Waiter next;
        synchronized (this) {
            next = waiters.pollFirst();
            if (next == null) {
                available++;
                return;
            }
            next.permit = new Permit();
        }
        next.sink.success(next.permit);
    }

    private static final class Waiter {
        private final MonoSink<Permit> sink;
        private volatile Permit permit;

        private Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }
    }

    /**
     * A held slot. Must be released exactly once; further calls are ignored.
     */
    public final class Permit {

        private final AtomicBoolean released = new AtomicBoolean();

        public void release() {
            if (released.compareAndSet(false, true)) {
                releaseOne();
            }
        }
    }
}
