package com.csd.codeagent.service.backend;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class BackendQueueTest {

    private static BackendQueue queue(int concurrency) {
        return new BackendQueue("codex", concurrency, null, 0, Schedulers.immediate());
    }

    @Test
    void runsAtMostConcurrencyTasksInSubmissionOrder() {
        BackendQueue queue = queue(2);
        List<Sinks.One<String>> gates = new ArrayList<>();
        List<Integer> started = Collections.synchronizedList(new ArrayList<>());
        List<String> results = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < 4; i++) {
            int n = i;
            gates.add(Sinks.one());
            queue.submit(() -> {
                started.add(n);
                return gates.get(n).asMono();
            }).subscribe(results::add);
        }

        assertEquals(List.of(0, 1), started);
        assertEquals(2, queue.active());
        assertEquals(2, queue.pending());

        gates.get(1).tryEmitValue("one");
        assertEquals(List.of(0, 1, 2), started);
        assertEquals(List.of("one"), results);

        gates.get(0).tryEmitValue("zero");
        assertEquals(List.of(0, 1, 2, 3), started);
        assertEquals(0, queue.pending());

        gates.get(2).tryEmitValue("two");
        gates.get(3).tryEmitValue("three");
        assertEquals(0, queue.size());
        assertEquals(List.of("one", "zero", "two", "three"), results);
    }

    @Test
    void nothingRunsUntilSubscribed() {
        BackendQueue queue = queue(1);
        AtomicBoolean invoked = new AtomicBoolean();
        Mono<String> submitted = queue.submit(() -> {
            invoked.set(true);
            return Mono.just("done");
        });
        assertFalse(invoked.get());
        assertEquals("done", submitted.block(Duration.ofSeconds(5)));
        assertTrue(invoked.get());
    }

    @Test
    void cancelledPendingTaskNeverStarts() {
        BackendQueue queue = queue(1);
        Sinks.One<String> gate = Sinks.one();
        AtomicBoolean secondInvoked = new AtomicBoolean();

        queue.submit(gate::asMono).subscribe();
        Disposable second = queue.submit(() -> {
            secondInvoked.set(true);
            return Mono.just("late");
        }).subscribe();

        assertEquals(1, queue.pending());
        second.dispose();
        assertEquals(0, queue.pending());

        gate.tryEmitValue("first");
        assertFalse(secondInvoked.get());
        assertEquals(0, queue.size());
    }

    @Test
    void timeoutCancelsRunningTaskAndFreesSlot() {
        BackendQueue queue = queue(1);

        StepVerifier.create(queue.submit(Mono::<String>never).timeout(Duration.ofMillis(50)))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(0, queue.active());
        assertEquals("next", queue.submit(() -> Mono.just("next")).block(Duration.ofSeconds(5)));
    }

    @Test
    void failingTaskReleasesSlot() {
        BackendQueue queue = queue(1);

        StepVerifier.create(queue.submit(() -> {
                    throw new IllegalStateException("backend exploded");
                }))
                .expectErrorMessage("backend exploded")
                .verify(Duration.ofSeconds(5));
        StepVerifier.create(queue.submit(() -> Mono.error(new IllegalArgumentException("bad"))))
                .expectError(IllegalArgumentException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(0, queue.size());
    }

    @Test
    void rateWindowCapsStartsPerInterval() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        BackendQueue queue = new BackendQueue("gemini", 10, Duration.ofSeconds(1), 2, scheduler);
        AtomicInteger completed = new AtomicInteger();

        for (int i = 0; i < 5; i++) {
            queue.submit(() -> Mono.just("ok")).subscribe(value -> completed.incrementAndGet());
        }
        assertEquals(2, completed.get());
        assertEquals(3, queue.pending());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(4, completed.get());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(5, completed.get());
        assertEquals(0, queue.size());
        scheduler.dispose();
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> queue(0));
    }

    @Test
    void registryResolvesQueuesById() {
        BackendQueueRegistry registry = new BackendQueueRegistry()
                .register(queue(1))
                .register(new BackendQueue("gemini", 2, null, 0, Schedulers.immediate()));

        assertEquals("gemini", registry.forBackend("gemini").getName());
        assertEquals(2, registry.all().size());
        assertThrows(IllegalStateException.class, () -> registry.forBackend("claude"));
    }
}
