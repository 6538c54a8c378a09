package com.csd.codeagent.service.backend;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * FIFO work queue for one backend with a concurrency limit and an optional rate window.
 *
 * <p>No thread ever waits for a slot: a submitted task sits in the deque until a running
 * task finishes (or the rate window reopens) and is then subscribed. Cancelling the
 * returned {@link Mono}, for example through {@code timeout}, drops a pending task or
 * disposes a running one and frees its slot; other tasks are unaffected.
 */
@Slf4j
public class BackendQueue {

    private final String name;
    private final int concurrency;
    private final Duration interval;
    private final int intervalCap;
    private final Scheduler scheduler;

    private final Deque<Task<?>> pending = new ArrayDeque<>();
    private int active;
    private long windowStartMillis = Long.MIN_VALUE;
    private int startedInWindow;
    private boolean drainScheduled;

    public BackendQueue(String name, int concurrency, Duration interval, int intervalCap, Scheduler scheduler) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Queue concurrency must be at least 1 for " + name);
        }
        this.name = name;
        this.concurrency = concurrency;
        boolean windowed = interval != null && !interval.isZero() && !interval.isNegative();
        this.interval = windowed ? interval : null;
        // an unset cap means "concurrency starts per window"
        this.intervalCap = windowed ? (intervalCap > 0 ? intervalCap : concurrency) : Integer.MAX_VALUE;
        this.scheduler = scheduler;
    }

    public String getName() {
        return name;
    }

    /**
     * Queues {@code work}. Nothing is invoked until the returned {@link Mono} is
     * subscribed and a slot is free.
     */
    public <T> Mono<T> submit(Supplier<Mono<T>> work) {
        return Mono.create(sink -> {
            Task<T> task = new Task<>(work, sink);
            sink.onCancel(task::cancel);
            synchronized (this) {
                pending.addLast(task);
            }
            drain();
        });
    }

    public synchronized int pending() {
        return pending.size();
    }

    public synchronized int active() {
        return active;
    }

    public synchronized int size() {
        return pending.size() + active;
    }

    private void drain() {
        List<Task<?>> toStart = new ArrayList<>();
        synchronized (this) {
            while (active < concurrency && !pending.isEmpty()) {
                if (!windowAllowsStart()) {
                    scheduleWindowDrain();
                    break;
                }
                Task<?> task = pending.pollFirst();
                active++;
                startedInWindow++;
                toStart.add(task);
            }
        }
        // subscribe outside the monitor, work may complete synchronously
        for (Task<?> task : toStart) {
            task.start();
        }
    }

    private void release() {
        synchronized (this) {
            active--;
        }
        drain();
    }

    private synchronized boolean removePending(Task<?> task) {
        return pending.remove(task);
    }

    // caller holds the monitor
    private boolean windowAllowsStart() {
        if (interval == null) return true;
        long now = scheduler.now(TimeUnit.MILLISECONDS);
        if (windowStartMillis == Long.MIN_VALUE || now - windowStartMillis >= interval.toMillis()) {
            windowStartMillis = now;
            startedInWindow = 0;
        }
        return startedInWindow < intervalCap;
    }

    // caller holds the monitor
    private void scheduleWindowDrain() {
        if (drainScheduled) return;
        drainScheduled = true;
        long delay = Math.max(0, windowStartMillis + interval.toMillis() - scheduler.now(TimeUnit.MILLISECONDS));
        log.debug("Queue {} rate window full, next start in {}ms", name, delay);
        scheduler.schedule(() -> {
            synchronized (this) {
                drainScheduled = false;
            }
            drain();
        }, delay, TimeUnit.MILLISECONDS);
    }

    private final class Task<T> {
        private final Supplier<Mono<T>> work;
        private final MonoSink<T> sink;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final Disposable.Swap running = Disposables.swap();

        Task(Supplier<Mono<T>> work, MonoSink<T> sink) {
            this.work = work;
            this.sink = sink;
        }

        void start() {
            if (cancelled.get()) {
                release();
                return;
            }
            Mono<T> mono;
            try {
                mono = work.get();
            } catch (RuntimeException e) {
                mono = Mono.error(e);
            }
            running.update(mono
                    .doFinally(signal -> release())
                    .subscribe(sink::success, sink::error, sink::success));
        }

        void cancel() {
            if (!cancelled.compareAndSet(false, true)) return;
            if (removePending(this)) {
                log.debug("Queue {}: pending task cancelled", name);
                return;
            }
            running.dispose();
        }
    }
}
