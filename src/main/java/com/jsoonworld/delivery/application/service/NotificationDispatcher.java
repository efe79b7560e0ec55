package com.jsoonworld.delivery.application.service;

import com.jsoonworld.delivery.application.port.out.NotificationSender;
import com.jsoonworld.delivery.domain.exception.NotificationStateException;
import com.jsoonworld.delivery.domain.model.DeliveryErrorKind;
import com.jsoonworld.delivery.domain.model.DispatchOutcome;
import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationEvent;
import com.jsoonworld.delivery.domain.model.QueueLocation;
import com.jsoonworld.delivery.domain.service.DeliveryErrorClassifier;
import com.jsoonworld.delivery.domain.service.NotificationEventBus;
import com.jsoonworld.delivery.domain.service.NotificationValidator;
import com.jsoonworld.delivery.domain.service.RateLimiter;
import com.jsoonworld.delivery.domain.service.RetryQueue;
import com.jsoonworld.delivery.domain.service.ScopeLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Makes single delivery attempts and decides what happens after each one.
 *
 * <p>Every attempt for a scope runs under that scope's {@link ScopeLock}, so the
 * admission check, the delivery and the quota update happen as one step and
 * at most one retry-queue head per scope is in flight.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationSender sender;
    private final RateLimiter rateLimiter;
    private final RetryQueue retryQueue;
    private final ScopeLock scopeLock;
    private final DeliveryErrorClassifier errorClassifier;
    private final NotificationValidator validator;
    private final NotificationEventBus eventBus;
    private final Clock clock;
    private final Duration deliveryTimeout;

    public NotificationDispatcher(NotificationSender sender,
                                  RateLimiter rateLimiter,
                                  RetryQueue retryQueue,
                                  ScopeLock scopeLock,
                                  DeliveryErrorClassifier errorClassifier,
                                  NotificationValidator validator,
                                  NotificationEventBus eventBus,
                                  Clock clock,
                                  Duration deliveryTimeout) {
        if (deliveryTimeout == null || deliveryTimeout.isNegative() || deliveryTimeout.isZero()) {
            throw new IllegalArgumentException("deliveryTimeout must be positive, was " + deliveryTimeout);
        }
        this.sender = sender;
        this.rateLimiter = rateLimiter;
        this.retryQueue = retryQueue;
        this.scopeLock = scopeLock;
        this.errorClassifier = errorClassifier;
        this.validator = validator;
        this.eventBus = eventBus;
        this.clock = clock;
        this.deliveryTimeout = deliveryTimeout;
    }

    // delivery failures come back as an outcome, validation and state errors are thrown
    public Mono<DispatchOutcome> send(Notification notification) {
        validator.validate(notification);
        requireDeliverable(notification);
        if (notification.getLocation() != QueueLocation.NONE) {
            throw new NotificationStateException(
                "Notification is waiting in a queue and cannot be sent directly: notificationId="
                    + notification.getId() + ", location=" + notification.getLocation());
        }
        return scopeLock.withLock(notification.getScopeId(), () -> dispatch(notification));
    }

    // empty when the queue is empty or the scope is still rate limited
    public Mono<DispatchOutcome> processRetryQueue(String scopeId) {
        return scopeLock.withLock(scopeId, () -> {
            Optional<Notification> head = retryQueue.peekHead(scopeId);
            if (head.isEmpty()) {
                return Mono.empty();
            }
            Notification notification = head.get();
            if (notification.isTerminal()) {
                retryQueue.removeHead(scopeId);
                return Mono.empty();
            }
            if (!rateLimiter.admit(scopeId)) {
                log.debug("Scope still rate limited, retry postponed: scopeId={}, retryAfter={}ms",
                    scopeId, rateLimiter.retryAfter(scopeId).toMillis());
                return Mono.empty();
            }

            log.info("Retrying notification: notificationId={}, scopeId={}, retryCount={}/{}",
                notification.getId(), scopeId, notification.getRetryCount(), notification.getMaxRetries());

            return attemptDelivery(notification)
                .map(failure -> failure
                    .map(error -> onFailed(notification, error, true))
                    .orElseGet(() -> {
                        retryQueue.removeHead(scopeId);
                        return onDelivered(notification);
                    }));
        });
    }

    public Flux<DispatchOutcome> processAllRetryQueues() {
        return Flux.fromIterable(retryQueue.scopes())
            .flatMap(this::processRetryQueue);
    }

    private Mono<DispatchOutcome> dispatch(Notification notification) {
        if (notification.isSent()) {
            log.debug("Notification already sent, skipping delivery: notificationId={}", notification.getId());
            return Mono.just(DispatchOutcome.SENT);
        }
        if (notification.isTerminal()) {
            return Mono.error(terminalState(notification));
        }

        String scopeId = notification.getScopeId();
        if (!rateLimiter.admit(scopeId)) {
            Duration retryAfter = rateLimiter.retryAfter(scopeId);
            notification.markRetry();
            retryQueue.defer(scopeId, notification);
            log.warn("Rate limited, notification deferred: notificationId={}, scopeId={}, retryAfter={}ms",
                notification.getId(), scopeId, retryAfter.toMillis());
            eventBus.publish(NotificationEvent.rateLimited(notification, retryAfter));
            return Mono.just(DispatchOutcome.RATE_LIMITED);
        }

        return attemptDelivery(notification)
            .map(failure -> failure
                .map(error -> onFailed(notification, error, false))
                .orElseGet(() -> onDelivered(notification)));
    }

    private Mono<Optional<Throwable>> attemptDelivery(Notification notification) {
        return Mono.defer(() -> sender.deliver(notification.getRecipientId(), notification.getContent()))
            .timeout(deliveryTimeout)
            .then(Mono.just(Optional.<Throwable>empty()))
            .onErrorResume(error -> Mono.just(Optional.of(error)));
    }

    private DispatchOutcome onDelivered(Notification notification) {
        notification.markSent(clock.instant());
        rateLimiter.recordSuccess(notification.getScopeId());
        log.info("Notification sent: notificationId={}, scopeId={}, recipientId={}, channel={}",
            notification.getId(), notification.getScopeId(), notification.getRecipientId(), sender.channel());
        eventBus.publish(NotificationEvent.sent(notification));
        return DispatchOutcome.SENT;
    }

    private DispatchOutcome onFailed(Notification notification, Throwable error, boolean fromRetryQueue) {
        String scopeId = notification.getScopeId();
        String errorMessage = describe(error);
        DeliveryErrorKind kind = errorClassifier.classify(error);

        if (kind == DeliveryErrorKind.RETRYABLE && notification.getRetryCount() < notification.getMaxRetries()) {
            notification.markFailed(errorMessage);
            if (fromRetryQueue) {
                retryQueue.recordFailedAttempt(scopeId, notification);
            } else {
                retryQueue.enqueue(scopeId, notification);
            }
            log.warn("Delivery failed, will retry: notificationId={}, scopeId={}, retryCount={}/{}, error={}",
                notification.getId(), scopeId, notification.getRetryCount(), notification.getMaxRetries(),
                errorMessage);
            eventBus.publish(NotificationEvent.error(notification, errorMessage));
            return DispatchOutcome.FAILED_RETRYABLE;
        }

        if (fromRetryQueue) {
            retryQueue.removeHead(scopeId);
        }
        notification.markFailedPermanently(errorMessage);
        log.error("Delivery failed permanently: notificationId={}, scopeId={}, kind={}, retryCount={}/{}, error={}",
            notification.getId(), scopeId, kind, notification.getRetryCount(), notification.getMaxRetries(),
            errorMessage);
        eventBus.publish(NotificationEvent.error(notification, errorMessage));
        return DispatchOutcome.FAILED_FATAL;
    }

    private void requireDeliverable(Notification notification) {
        if (notification.isTerminal() && !notification.isSent()) {
            throw terminalState(notification);
        }
    }

    private NotificationStateException terminalState(Notification notification) {
        return new NotificationStateException(
            "Notification is " + notification.getStatus() + " and cannot be delivered again: notificationId="
                + notification.getId());
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Delivery timeout after " + deliveryTimeout.toMillis() + "ms";
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
