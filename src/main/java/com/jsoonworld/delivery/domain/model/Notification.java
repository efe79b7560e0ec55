package com.jsoonworld.delivery.domain.model;

import com.jsoonworld.delivery.domain.exception.NotificationStateException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * A single notification moving through the delivery engine.
 *
 * <p>Identity, routing and payload are fixed at construction. Lifecycle state
 * ({@code status}, {@code retryCount}, {@code error}, {@code sentAt},
 * {@code location}) only changes through the guarded mutators below. Once the
 * notification is terminal (sent, cancelled or permanently failed) none of
 * them succeed.
 */
@Getter
public class Notification {

    public static final int DEFAULT_MAX_RETRIES = 3;

    @NotBlank
    private final String id;

    @NotBlank
    private final String templateId;

    @NotNull
    private final NotificationType type;

    @NotNull
    private final NotificationPriority priority;

    @NotBlank
    private final String recipientId;

    @NotBlank
    private final String scopeId;

    @NotNull
    @Valid
    private final NotificationContent content;

    @NotNull
    private final Map<String, String> variables;

    @NotNull
    private final Instant createdAt;

    @NotNull
    private final Instant scheduledFor;

    @PositiveOrZero
    private final int maxRetries;

    private volatile NotificationStatus status;

    @PositiveOrZero
    private volatile int retryCount;

    private volatile String error;

    private volatile Instant sentAt;

    private volatile QueueLocation location;

    private volatile boolean closed;

    @Builder
    private Notification(String id,
                         String templateId,
                         NotificationType type,
                         NotificationPriority priority,
                         String recipientId,
                         String scopeId,
                         NotificationContent content,
                         Map<String, String> variables,
                         Instant createdAt,
                         Instant scheduledFor,
                         Integer maxRetries) {
        this.id = id;
        this.templateId = templateId;
        this.type = type;
        this.priority = priority != null ? priority : NotificationPriority.MEDIUM;
        this.recipientId = recipientId;
        this.scopeId = scopeId;
        this.content = content;
        this.variables = variables != null ? Map.copyOf(variables) : Map.of();
        this.createdAt = createdAt;
        this.scheduledFor = scheduledFor != null ? scheduledFor : createdAt;
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        this.status = NotificationStatus.PENDING;
        this.retryCount = 0;
        this.location = QueueLocation.NONE;
    }

    @AssertTrue(message = "retryCount must not exceed maxRetries")
    public boolean isRetryCountWithinLimit() {
        return retryCount <= maxRetries;
    }

    public boolean isSent() {
        return status == NotificationStatus.SENT;
    }

    public boolean isTerminal() {
        return closed;
    }

    public synchronized void markSent(Instant at) {
        requireOpen("markSent");
        this.status = NotificationStatus.SENT;
        this.sentAt = at;
        this.error = null;
        this.closed = true;
    }

    // failed attempt that may still be retried
    public synchronized void markFailed(String errorMessage) {
        requireOpen("markFailed");
        this.status = NotificationStatus.FAILED;
        this.error = errorMessage;
    }

    public synchronized void markFailedPermanently(String errorMessage) {
        requireOpen("markFailedPermanently");
        this.status = NotificationStatus.FAILED;
        this.error = errorMessage;
        this.closed = true;
    }

    public synchronized void markRetry() {
        requireOpen("markRetry");
        this.status = NotificationStatus.RETRY;
    }

    public synchronized void markCancelled() {
        requireOpen("markCancelled");
        this.status = NotificationStatus.CANCELLED;
        this.closed = true;
    }

    public synchronized void incrementRetryCount() {
        requireOpen("incrementRetryCount");
        if (retryCount >= maxRetries) {
            throw new NotificationStateException(
                "Retry limit reached: notificationId=" + id + ", maxRetries=" + maxRetries);
        }
        this.retryCount++;
    }

    // false when the notification is somewhere other than expected
    public synchronized boolean moveTo(QueueLocation expected, QueueLocation target) {
        if (location != expected) {
            return false;
        }
        this.location = target;
        return true;
    }

    public Notification nextOccurrence(String newId, Instant now) {
        return Notification.builder()
            .id(newId)
            .templateId(templateId)
            .type(type)
            .priority(priority)
            .recipientId(recipientId)
            .scopeId(scopeId)
            .content(content)
            .variables(variables)
            .createdAt(now)
            .scheduledFor(now)
            .maxRetries(maxRetries)
            .build();
    }

    private void requireOpen(String operation) {
        if (closed) {
            throw new NotificationStateException(
                "Notification is terminal, " + operation + " rejected: notificationId=" + id
                    + ", status=" + status);
        }
    }

    @Override
    public String toString() {
        return "Notification{id=" + id + ", scopeId=" + scopeId + ", priority=" + priority
            + ", status=" + status + ", retryCount=" + retryCount + "/" + maxRetries
            + ", location=" + location + "}";
    }
}
