package com.jsoonworld.delivery.domain.model;

import com.jsoonworld.delivery.domain.exception.NotificationStateException;
import com.jsoonworld.delivery.support.TestNotifications;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationTest {

    @Test
    void builder_appliesDefaults() {
        Notification notification = Notification.builder()
            .id("n-1")
            .templateId("task-due")
            .type(NotificationType.TASK_DUE)
            .recipientId("channel-1")
            .scopeId("guild-1")
            .content(new NotificationContent("Due", "Report is due today"))
            .createdAt(TestNotifications.CREATED_AT)
            .build();

        assertThat(notification.getPriority()).isEqualTo(NotificationPriority.MEDIUM);
        assertThat(notification.getMaxRetries()).isEqualTo(Notification.DEFAULT_MAX_RETRIES);
        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.PENDING);
        assertThat(notification.getLocation()).isEqualTo(QueueLocation.NONE);
        assertThat(notification.getRetryCount()).isZero();
        assertThat(notification.getVariables()).isEmpty();
        assertThat(notification.getScheduledFor()).isEqualTo(TestNotifications.CREATED_AT);
    }

    @Test
    void markSent_afterwardsEveryMutationIsRejected() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");
        Instant sentAt = Instant.parse("2024-05-01T09:00:01Z");

        notification.markSent(sentAt);

        assertThat(notification.isSent()).isTrue();
        assertThat(notification.isTerminal()).isTrue();
        assertThat(notification.getSentAt()).isEqualTo(sentAt);
        assertThatThrownBy(() -> notification.markFailed("boom")).isInstanceOf(NotificationStateException.class);
        assertThatThrownBy(notification::markRetry).isInstanceOf(NotificationStateException.class);
        assertThatThrownBy(notification::markCancelled).isInstanceOf(NotificationStateException.class);
        assertThatThrownBy(notification::incrementRetryCount).isInstanceOf(NotificationStateException.class);
        assertThatThrownBy(() -> notification.markSent(sentAt)).isInstanceOf(NotificationStateException.class);
        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.SENT);
        assertThat(notification.getError()).isNull();
    }

    @Test
    void incrementRetryCount_stopsAtMaxRetries() {
        Notification notification = TestNotifications.notification("n-1", "guild-1", NotificationPriority.LOW, 2);

        notification.incrementRetryCount();
        notification.incrementRetryCount();

        assertThat(notification.getRetryCount()).isEqualTo(2);
        assertThatThrownBy(notification::incrementRetryCount)
            .isInstanceOf(NotificationStateException.class)
            .hasMessageContaining("Retry limit reached");
        assertThat(notification.isRetryCountWithinLimit()).isTrue();
    }

    @Test
    void markFailed_leavesNotificationRetryable() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");
        notification.markFailed("network down");
        notification.moveTo(QueueLocation.NONE, QueueLocation.RETRY);
        notification.moveTo(QueueLocation.RETRY, QueueLocation.NONE);

        assertThat(notification.isTerminal()).isFalse();
        assertThat(notification.getError()).isEqualTo("network down");

        notification.markRetry();

        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.RETRY);
    }

    @Test
    void markFailedPermanently_afterwardsEveryMutationIsRejected() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");

        notification.markFailedPermanently("Discord client error 404");

        assertThat(notification.isTerminal()).isTrue();
        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.FAILED);
        assertThatThrownBy(() -> notification.markSent(Instant.parse("2024-05-01T09:00:01Z")))
            .isInstanceOf(NotificationStateException.class)
            .hasMessageContaining("terminal");
        assertThatThrownBy(notification::markRetry).isInstanceOf(NotificationStateException.class);
        assertThatThrownBy(() -> notification.markFailed("again")).isInstanceOf(NotificationStateException.class);
        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.FAILED);
        assertThat(notification.getError()).isEqualTo("Discord client error 404");
    }

    @Test
    void markCancelled_cannotBeRevived() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");

        notification.markCancelled();

        assertThat(notification.isTerminal()).isTrue();
        assertThatThrownBy(() -> notification.markSent(Instant.parse("2024-05-01T09:00:01Z")))
            .isInstanceOf(NotificationStateException.class);
        assertThatThrownBy(notification::markRetry).isInstanceOf(NotificationStateException.class);
        assertThatThrownBy(() -> notification.markFailed("late")).isInstanceOf(NotificationStateException.class);
        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.CANCELLED);
    }

    @Test
    void moveTo_failsWhenNotAtExpectedLocation() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");

        assertThat(notification.moveTo(QueueLocation.NONE, QueueLocation.BATCH)).isTrue();
        assertThat(notification.moveTo(QueueLocation.NONE, QueueLocation.RETRY)).isFalse();
        assertThat(notification.getLocation()).isEqualTo(QueueLocation.BATCH);
    }

    @Test
    void nextOccurrence_startsCleanWithNewIdentity() {
        Notification original = TestNotifications.notification("n-1", "guild-1", NotificationPriority.HIGH, 3);
        original.markFailed("timeout");
        original.incrementRetryCount();
        Instant firedAt = Instant.parse("2024-05-02T09:00:00Z");

        Notification occurrence = original.nextOccurrence("n-2", firedAt);

        assertThat(occurrence.getId()).isEqualTo("n-2");
        assertThat(occurrence.getStatus()).isEqualTo(NotificationStatus.PENDING);
        assertThat(occurrence.getRetryCount()).isZero();
        assertThat(occurrence.getError()).isNull();
        assertThat(occurrence.getCreatedAt()).isEqualTo(firedAt);
        assertThat(occurrence.getPriority()).isEqualTo(NotificationPriority.HIGH);
        assertThat(occurrence.getContent()).isEqualTo(original.getContent());
        assertThat(occurrence.getVariables()).isEqualTo(Map.of("task", "standup"));
        assertThat(original.getRetryCount()).isEqualTo(1);
    }
}
