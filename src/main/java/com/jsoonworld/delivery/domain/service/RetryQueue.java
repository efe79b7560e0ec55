package com.jsoonworld.delivery.domain.service;

import com.jsoonworld.delivery.domain.exception.NotificationStateException;
import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationEvent;
import com.jsoonworld.delivery.domain.model.QueueLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class RetryQueue {

    private static final Logger log = LoggerFactory.getLogger(RetryQueue.class);

    private final Map<String, Deque<Notification>> queues = new HashMap<>();
    private final NotificationEventBus eventBus;

    public RetryQueue(NotificationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void enqueue(String scopeId, Notification notification) {
        append(scopeId, notification, true);
    }

    // waiting for quota does not spend the retry budget
    public void defer(String scopeId, Notification notification) {
        append(scopeId, notification, false);
    }

    // the head keeps its place
    public synchronized void recordFailedAttempt(String scopeId, Notification notification) {
        Deque<Notification> queue = queues.get(scopeId);
        if (queue == null || queue.peekFirst() != notification) {
            throw new NotificationStateException(
                "Notification is not at the head of the retry queue: notificationId="
                    + notification.getId() + ", scopeId=" + scopeId);
        }
        notification.incrementRetryCount();
        log.debug("Retry attempt recorded: notificationId={}, scopeId={}, retryCount={}",
            notification.getId(), scopeId, notification.getRetryCount());
        eventBus.publish(NotificationEvent.queued(notification));
    }

    public synchronized Optional<Notification> peekHead(String scopeId) {
        Deque<Notification> queue = queues.get(scopeId);
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.peekFirst());
    }

    public synchronized Optional<Notification> removeHead(String scopeId) {
        Deque<Notification> queue = queues.get(scopeId);
        if (queue == null) {
            return Optional.empty();
        }
        Notification head = queue.pollFirst();
        if (queue.isEmpty()) {
            queues.remove(scopeId);
        }
        if (head != null) {
            head.moveTo(QueueLocation.RETRY, QueueLocation.NONE);
        }
        return Optional.ofNullable(head);
    }

    public synchronized boolean isEmpty(String scopeId) {
        return !queues.containsKey(scopeId);
    }

    public synchronized int size(String scopeId) {
        Deque<Notification> queue = queues.get(scopeId);
        return queue == null ? 0 : queue.size();
    }

    public synchronized List<String> scopes() {
        return List.copyOf(queues.keySet());
    }

    public synchronized Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        queues.forEach((scopeId, queue) -> sizes.put(scopeId, queue.size()));
        return sizes;
    }

    public synchronized int totalSize() {
        return queues.values().stream().mapToInt(Deque::size).sum();
    }

    private void append(String scopeId, Notification notification, boolean countAttempt) {
        synchronized (this) {
            if (notification.isTerminal()) {
                throw new NotificationStateException(
                    "Terminal notification cannot be retried: notificationId=" + notification.getId()
                        + ", status=" + notification.getStatus());
            }
            if (countAttempt && notification.getRetryCount() >= notification.getMaxRetries()) {
                throw new NotificationStateException(
                    "Retry limit reached: notificationId=" + notification.getId()
                        + ", maxRetries=" + notification.getMaxRetries());
            }
            if (!notification.moveTo(QueueLocation.NONE, QueueLocation.RETRY)) {
                throw new NotificationStateException(
                    "Notification already queued: notificationId=" + notification.getId()
                        + ", location=" + notification.getLocation());
            }
            if (countAttempt) {
                notification.incrementRetryCount();
            }
            queues.computeIfAbsent(scopeId, key -> new ArrayDeque<>()).addLast(notification);
        }
        log.debug("Notification added to retry queue: notificationId={}, scopeId={}, retryCount={}",
            notification.getId(), scopeId, notification.getRetryCount());
        eventBus.publish(NotificationEvent.queued(notification));
    }
}
