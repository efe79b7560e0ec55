package com.jsoonworld.delivery.domain.service;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Asynchronous mutex keyed by scope. At most one action per scope runs at a
 * time; waiters are resumed in arrival order. Nothing blocks a thread while
 * waiting. A waiter resumes on the hand-over scheduler, so a long line of
 * waiters does not grow the releasing thread's stack.
 */
public class ScopeLock {

    private final Map<String, LockState> states = new HashMap<>();
    private final Scheduler handOverScheduler;

    public ScopeLock() {
        this(Schedulers.parallel());
    }

    public ScopeLock(Scheduler handOverScheduler) {
        this.handOverScheduler = handOverScheduler;
    }

    public <T> Mono<T> withLock(String scopeId, Supplier<? extends Mono<T>> action) {
        return Mono.usingWhen(
            acquire(scopeId),
            held -> Mono.defer(action),
            held -> release(scopeId),
            (held, error) -> release(scopeId),
            held -> release(scopeId)
        );
    }

    public boolean isLocked(String scopeId) {
        synchronized (states) {
            return states.containsKey(scopeId);
        }
    }

    private Mono<String> acquire(String scopeId) {
        return Mono.defer(() -> {
            Sinks.One<String> ticket;
            synchronized (states) {
                LockState state = states.get(scopeId);
                if (state == null) {
                    states.put(scopeId, new LockState());
                    return Mono.just(scopeId);
                }
                ticket = Sinks.one();
                state.waiters.addLast(ticket);
            }
            return ticket.asMono()
                .doOnCancel(() -> abandon(scopeId, ticket))
                .publishOn(handOverScheduler);
        });
    }

    private Mono<Void> release(String scopeId) {
        return Mono.fromRunnable(() -> handOver(scopeId));
    }

    private void handOver(String scopeId) {
        Sinks.One<String> next;
        synchronized (states) {
            LockState state = states.get(scopeId);
            if (state == null) {
                return;
            }
            next = state.waiters.pollFirst();
            if (next == null) {
                states.remove(scopeId);
                return;
            }
        }
        next.tryEmitValue(scopeId);
    }

    private void abandon(String scopeId, Sinks.One<String> ticket) {
        boolean stillWaiting;
        synchronized (states) {
            LockState state = states.get(scopeId);
            stillWaiting = state != null && state.waiters.remove(ticket);
        }
        if (!stillWaiting) {
            // ownership was handed to this ticket just before it was cancelled
            handOver(scopeId);
        }
    }

    private static final class LockState {
        private final Deque<Sinks.One<String>> waiters = new ArrayDeque<>();
    }
}
