package com.jsoonworld.delivery.application.service;

import com.jsoonworld.delivery.domain.exception.NotificationException;
import com.jsoonworld.delivery.domain.exception.NotificationStateException;
import com.jsoonworld.delivery.domain.model.BatchConfig;
import com.jsoonworld.delivery.domain.model.DispatchOutcome;
import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationEvent;
import com.jsoonworld.delivery.domain.model.NotificationPriority;
import com.jsoonworld.delivery.domain.model.QueueLocation;
import com.jsoonworld.delivery.domain.model.ScheduledJob;
import com.jsoonworld.delivery.domain.service.NotificationEventBus;
import com.jsoonworld.delivery.domain.service.NotificationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

// batch ticks never overlap, a tick that comes due mid-batch is skipped
public class PriorityScheduler {

    private static final Logger log = LoggerFactory.getLogger(PriorityScheduler.class);

    private final NotificationDispatcher dispatcher;
    private final NotificationValidator validator;
    private final NotificationEventBus eventBus;
    private final TaskScheduler taskScheduler;
    private final BatchConfig batchConfig;
    private final Clock clock;

    private final Map<NotificationPriority, Deque<Notification>> buckets = new EnumMap<>(NotificationPriority.class);
    private final Map<String, Notification> templates = new ConcurrentHashMap<>();
    private final Map<String, ScheduledJob> scheduledJobs = new ConcurrentHashMap<>();
    private volatile Disposable batchProcessor;

    public PriorityScheduler(NotificationDispatcher dispatcher,
                             NotificationValidator validator,
                             NotificationEventBus eventBus,
                             TaskScheduler taskScheduler,
                             BatchConfig batchConfig,
                             Clock clock) {
        if (batchConfig == null) {
            throw new IllegalArgumentException("BatchConfig must not be null");
        }
        this.dispatcher = dispatcher;
        this.validator = validator;
        this.eventBus = eventBus;
        this.taskScheduler = taskScheduler;
        this.batchConfig = batchConfig;
        this.clock = clock;
        for (NotificationPriority priority : NotificationPriority.values()) {
            buckets.put(priority, new ArrayDeque<>());
        }
    }

    public void queueNotification(Notification notification) {
        validator.validate(notification);
        if (notification.isTerminal()) {
            throw new NotificationStateException(
                "Terminal notification cannot be queued: notificationId=" + notification.getId()
                    + ", status=" + notification.getStatus());
        }
        synchronized (buckets) {
            if (!notification.moveTo(QueueLocation.NONE, QueueLocation.BATCH)) {
                throw new NotificationStateException(
                    "Notification already queued: notificationId=" + notification.getId()
                        + ", location=" + notification.getLocation());
            }
            buckets.get(notification.getPriority()).addLast(notification);
        }
        log.debug("Notification queued: notificationId={}, priority={}, scopeId={}",
            notification.getId(), notification.getPriority(), notification.getScopeId());
        eventBus.publish(NotificationEvent.queued(notification));
    }

    // every firing queues a fresh occurrence, the template itself is never dispatched
    public ScheduledJob scheduleNotification(Notification notification, String cronExpression) {
        validator.validate(notification);
        String normalized = CronExpressions.normalize(cronExpression);
        String id = notification.getId();
        if (notification.isTerminal()) {
            throw new NotificationStateException(
                "Terminal notification cannot be scheduled: notificationId=" + id
                    + ", status=" + notification.getStatus());
        }
        if (templates.putIfAbsent(id, notification) != null) {
            throw new NotificationStateException("Notification already scheduled: notificationId=" + id);
        }

        ScheduledFuture<?> future;
        try {
            future = taskScheduler.schedule(() -> fire(id), new CronTrigger(normalized, clock.getZone()));
        } catch (RuntimeException e) {
            templates.remove(id, notification);
            throw e;
        }
        if (future == null) {
            templates.remove(id, notification);
            throw new NotificationException(
                "Cron expression never fires: notificationId=" + id + ", cron=" + normalized);
        }
        ScheduledJob job = new ScheduledJob(id, normalized, notification, future, clock.instant());
        synchronized (scheduledJobs) {
            if (templates.get(id) == notification) {
                scheduledJobs.put(id, job);
            } else {
                // cancelled while the trigger was being registered
                job.stop();
                log.info("Recurring notification cancelled during scheduling: notificationId={}", id);
                return job;
            }
        }

        log.info("Recurring notification scheduled: notificationId={}, cron={}, scopeId={}",
            notification.getId(), normalized, notification.getScopeId());
        eventBus.publish(NotificationEvent.scheduled(notification));
        return job;
    }

    // occurrences already queued or mid-dispatch are not affected
    public boolean cancelScheduledNotification(String notificationId) {
        Notification template;
        ScheduledJob job;
        synchronized (scheduledJobs) {
            template = templates.remove(notificationId);
            if (template == null) {
                return false;
            }
            job = scheduledJobs.remove(notificationId);
        }
        if (job != null) {
            job.stop();
        }
        template.markCancelled();
        log.info("Recurring notification cancelled: notificationId={}", notificationId);
        eventBus.publish(NotificationEvent.cancelled(template));
        return true;
    }

    public synchronized void start() {
        if (batchProcessor != null && !batchProcessor.isDisposed()) {
            return;
        }
        batchProcessor = Flux.interval(batchConfig.processingInterval(), batchConfig.processingInterval())
            .onBackpressureDrop(tick -> log.debug("Batch still running, tick skipped: tick={}", tick))
            .concatMap(tick -> processBatch()
                .onErrorResume(error -> {
                    log.error("Batch processing failed: error={}", error.getMessage(), error);
                    return Mono.just(0);
                }), 0)
            .subscribe();
        log.info("Batch processor started: maxBatchSize={}, interval={}ms",
            batchConfig.maxBatchSize(), batchConfig.processingIntervalMs());
    }

    public synchronized void stop() {
        if (batchProcessor != null) {
            batchProcessor.dispose();
            batchProcessor = null;
        }
        synchronized (scheduledJobs) {
            templates.clear();
            scheduledJobs.values().forEach(ScheduledJob::stop);
            scheduledJobs.clear();
        }
        log.info("Batch processor stopped");
    }

    public boolean isRunning() {
        Disposable processor = batchProcessor;
        return processor != null && !processor.isDisposed();
    }

    // emits the number of notifications dispatched
    public Mono<Integer> processBatch() {
        return Mono.defer(() -> {
            List<Notification> batch = drainBatch();
            if (batch.isEmpty()) {
                return Mono.just(0);
            }
            eventBus.publish(NotificationEvent.batchProcessing(batch.size()));
            log.debug("Processing batch: size={}", batch.size());

            return Flux.fromIterable(batch)
                .concatMap(this::dispatchQueued)
                .then(Mono.fromCallable(() -> {
                    eventBus.publish(NotificationEvent.batchCompleted(batch.size()));
                    log.debug("Batch completed: size={}", batch.size());
                    return batch.size();
                }));
        });
    }

    public Map<NotificationPriority, Integer> getQueueStats() {
        Map<NotificationPriority, Integer> stats = new EnumMap<>(NotificationPriority.class);
        synchronized (buckets) {
            buckets.forEach((priority, bucket) -> stats.put(priority, bucket.size()));
        }
        return Collections.unmodifiableMap(stats);
    }

    public int scheduledJobCount() {
        return scheduledJobs.size();
    }

    public boolean isScheduled(String notificationId) {
        return templates.containsKey(notificationId);
    }

    private List<Notification> drainBatch() {
        List<Notification> batch = new ArrayList<>();
        int remaining = batchConfig.maxBatchSize();
        synchronized (buckets) {
            for (NotificationPriority priority : NotificationPriority.values()) {
                Deque<Notification> bucket = buckets.get(priority);
                while (remaining > 0 && !bucket.isEmpty()) {
                    Notification notification = bucket.pollFirst();
                    notification.moveTo(QueueLocation.BATCH, QueueLocation.NONE);
                    batch.add(notification);
                    remaining--;
                }
                if (remaining == 0) {
                    break;
                }
            }
        }
        return batch;
    }

    private Mono<DispatchOutcome> dispatchQueued(Notification notification) {
        return Mono.defer(() -> dispatcher.send(notification))
            .onErrorResume(error -> {
                log.error("Unexpected error dispatching queued notification: notificationId={}, error={}",
                    notification.getId(), error.getMessage(), error);
                if (!notification.isTerminal() && notification.getLocation() == QueueLocation.NONE) {
                    notification.markFailedPermanently(error.getMessage());
                }
                eventBus.publish(NotificationEvent.error(notification, error.getMessage()));
                return Mono.just(DispatchOutcome.FAILED_FATAL);
            });
    }

    private void fire(String notificationId) {
        Notification template = templates.get(notificationId);
        if (template == null) {
            return;
        }
        Notification occurrence = template
            .nextOccurrence(UUID.randomUUID().toString(), clock.instant());
        try {
            queueNotification(occurrence);
            log.info("Recurring notification fired: notificationId={}, occurrenceId={}",
                notificationId, occurrence.getId());
        } catch (NotificationException e) {
            log.error("Failed to queue recurring occurrence: notificationId={}, error={}",
                notificationId, e.getMessage());
        }
    }
}
