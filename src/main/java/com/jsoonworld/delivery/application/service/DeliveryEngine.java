package com.jsoonworld.delivery.application.service;

import com.jsoonworld.delivery.application.port.in.QueryDeliveryStatsUseCase;
import com.jsoonworld.delivery.application.port.in.ScheduleNotificationUseCase;
import com.jsoonworld.delivery.application.port.in.SendNotificationUseCase;
import com.jsoonworld.delivery.domain.model.DeliveryResult;
import com.jsoonworld.delivery.domain.model.EngineStats;
import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationEvent;
import com.jsoonworld.delivery.domain.model.NotificationRequest;
import com.jsoonworld.delivery.domain.service.NotificationEventBus;
import com.jsoonworld.delivery.domain.service.NotificationValidator;
import com.jsoonworld.delivery.domain.service.RetryQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

@Service
public class DeliveryEngine implements SendNotificationUseCase, ScheduleNotificationUseCase, QueryDeliveryStatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(DeliveryEngine.class);

    private final NotificationDispatcher dispatcher;
    private final PriorityScheduler scheduler;
    private final RetryQueue retryQueue;
    private final NotificationEventBus eventBus;
    private final NotificationValidator validator;
    private final Clock clock;
    private final Duration retryInterval;
    private final int defaultMaxRetries;

    private volatile Disposable retryProcessor;

    public DeliveryEngine(NotificationDispatcher dispatcher,
                          PriorityScheduler scheduler,
                          RetryQueue retryQueue,
                          NotificationEventBus eventBus,
                          NotificationValidator validator,
                          Clock clock,
                          @Value("${delivery.retry.processing-interval-ms:1000}") long retryIntervalMs,
                          @Value("${delivery.max-retries:3}") int defaultMaxRetries) {
        if (retryIntervalMs < 10) {
            throw new IllegalArgumentException("retry processing interval must be at least 10ms, was " + retryIntervalMs);
        }
        if (defaultMaxRetries < 0) {
            throw new IllegalArgumentException("max retries must not be negative, was " + defaultMaxRetries);
        }
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.retryQueue = retryQueue;
        this.eventBus = eventBus;
        this.validator = validator;
        this.clock = clock;
        this.retryInterval = Duration.ofMillis(retryIntervalMs);
        this.defaultMaxRetries = defaultMaxRetries;
    }

    @PostConstruct
    public synchronized void start() {
        scheduler.start();
        if (retryProcessor == null || retryProcessor.isDisposed()) {
            retryProcessor = Flux.interval(retryInterval, retryInterval)
                .onBackpressureDrop(tick -> log.debug("Retry drain still running, tick skipped: tick={}", tick))
                .concatMap(tick -> dispatcher.processAllRetryQueues()
                    .then()
                    .onErrorResume(error -> {
                        log.error("Retry drain failed: error={}", error.getMessage(), error);
                        return Mono.empty();
                    }), 0)
                .subscribe();
        }
        log.info("Delivery engine started: retryInterval={}ms, defaultMaxRetries={}",
            retryInterval.toMillis(), defaultMaxRetries);
    }

    @PreDestroy
    public synchronized void stop() {
        scheduler.stop();
        if (retryProcessor != null) {
            retryProcessor.dispose();
            retryProcessor = null;
        }
        log.info("Delivery engine stopped: pendingRetries={}", retryQueue.totalSize());
    }

    @Override
    public Mono<DeliveryResult> sendNow(NotificationRequest request) {
        return sendNow(create(request));
    }

    @Override
    public Mono<DeliveryResult> sendNow(Notification notification) {
        return dispatcher.send(notification)
            .map(outcome -> DeliveryResult.of(notification, outcome));
    }

    @Override
    public Notification queue(NotificationRequest request) {
        return queue(create(request));
    }

    @Override
    public Notification queue(Notification notification) {
        scheduler.queueNotification(notification);
        return notification;
    }

    @Override
    public Notification scheduleRecurring(NotificationRequest request, String cronExpression) {
        Notification notification = create(request);
        scheduler.scheduleNotification(notification, cronExpression);
        return notification;
    }

    @Override
    public boolean cancel(String notificationId) {
        return scheduler.cancelScheduledNotification(notificationId);
    }

    @Override
    public EngineStats stats() {
        return new EngineStats(
            scheduler.getQueueStats(),
            retryQueue.sizes(),
            scheduler.scheduledJobCount()
        );
    }

    @Override
    public Flux<NotificationEvent> events() {
        return eventBus.events();
    }

    @Override
    public boolean isRunning() {
        Disposable processor = retryProcessor;
        return scheduler.isRunning() && processor != null && !processor.isDisposed();
    }

    private Notification create(NotificationRequest request) {
        Notification notification = request.toNotification(
            UUID.randomUUID().toString(), clock.instant(), defaultMaxRetries);
        return validator.validate(notification);
    }
}
