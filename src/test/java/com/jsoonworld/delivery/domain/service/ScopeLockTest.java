package com.jsoonworld.delivery.domain.service;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeLockTest {

    private final ScopeLock scopeLock = new ScopeLock(Schedulers.immediate());

    @Test
    void withLock_sameScope_runsOneAtATimeInArrivalOrder() {
        Sinks.One<String> gate = Sinks.one();
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicReference<String> secondResult = new AtomicReference<>();

        scopeLock.withLock("guild-1", () -> {
            order.add("first-start");
            return gate.asMono().doOnNext(value -> order.add("first-end"));
        }).subscribe();
        scopeLock.withLock("guild-1", () -> {
            order.add("second-start");
            return Mono.just("second");
        }).subscribe(secondResult::set);

        assertThat(order).containsExactly("first-start");
        assertThat(scopeLock.isLocked("guild-1")).isTrue();

        gate.tryEmitValue("done");

        assertThat(order).containsExactly("first-start", "first-end", "second-start");
        assertThat(secondResult.get()).isEqualTo("second");
        assertThat(scopeLock.isLocked("guild-1")).isFalse();
    }

    @Test
    void withLock_differentScopes_doNotWaitForEachOther() {
        Sinks.One<String> gate = Sinks.one();
        scopeLock.withLock("guild-1", gate::asMono).subscribe();

        StepVerifier.create(scopeLock.withLock("guild-2", () -> Mono.just("other")))
            .expectNext("other")
            .verifyComplete();

        assertThat(scopeLock.isLocked("guild-1")).isTrue();
        gate.tryEmitValue("done");
        assertThat(scopeLock.isLocked("guild-1")).isFalse();
    }

    @Test
    void withLock_error_releasesLock() {
        StepVerifier.create(scopeLock.withLock("guild-1", () -> Mono.error(new IllegalStateException("boom"))))
            .expectErrorMessage("boom")
            .verify();

        assertThat(scopeLock.isLocked("guild-1")).isFalse();
        StepVerifier.create(scopeLock.withLock("guild-1", () -> Mono.just(1)))
            .expectNext(1)
            .verifyComplete();
    }

    @Test
    void withLock_cancelledWaiter_neverRunsAndDoesNotBlockOthers() {
        Sinks.One<String> gate = Sinks.one();
        List<String> ran = new CopyOnWriteArrayList<>();

        scopeLock.withLock("guild-1", gate::asMono).subscribe();
        Disposable waiter = scopeLock.withLock("guild-1", () -> {
            ran.add("cancelled");
            return Mono.just("cancelled");
        }).subscribe();
        AtomicReference<String> third = new AtomicReference<>();
        scopeLock.withLock("guild-1", () -> {
            ran.add("third");
            return Mono.just("third");
        }).subscribe(third::set);

        waiter.dispose();
        gate.tryEmitValue("done");

        assertThat(ran).containsExactly("third");
        assertThat(third.get()).isEqualTo("third");
        assertThat(scopeLock.isLocked("guild-1")).isFalse();
    }

    @Test
    void withLock_defaultScheduler_longLineOfWaitersCompletes() {
        ScopeLock parallelLock = new ScopeLock();
        Sinks.One<String> gate = Sinks.one();
        parallelLock.withLock("guild-1", gate::asMono).subscribe();

        Mono<Long> waiters = Flux.range(0, 5000)
            .flatMap(i -> parallelLock.withLock("guild-1", () -> Mono.just(i)), 5000)
            .count();

        StepVerifier.create(waiters)
            .then(() -> gate.tryEmitValue("done"))
            .expectNext(5000L)
            .verifyComplete();
        assertThat(parallelLock.isLocked("guild-1")).isFalse();
    }

    @Test
    void withLock_cancelledHolder_releasesLock() {
        Disposable holder = scopeLock.withLock("guild-1", () -> Mono.never()).subscribe();
        assertThat(scopeLock.isLocked("guild-1")).isTrue();

        holder.dispose();

        assertThat(scopeLock.isLocked("guild-1")).isFalse();
    }
}
