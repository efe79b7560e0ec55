package com.jsoonworld.delivery.domain.service;

import com.jsoonworld.delivery.domain.exception.NotificationStateException;
import com.jsoonworld.delivery.domain.model.Notification;
import com.jsoonworld.delivery.domain.model.NotificationEvent;
import com.jsoonworld.delivery.domain.model.NotificationEventType;
import com.jsoonworld.delivery.domain.model.NotificationPriority;
import com.jsoonworld.delivery.domain.model.QueueLocation;
import com.jsoonworld.delivery.support.TestNotifications;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryQueueTest {

    private NotificationEventBus eventBus;
    private RetryQueue retryQueue;
    private List<NotificationEvent> events;

    @BeforeEach
    void setUp() {
        eventBus = new NotificationEventBus();
        retryQueue = new RetryQueue(eventBus);
        events = new CopyOnWriteArrayList<>();
        eventBus.events().subscribe(events::add);
    }

    @Test
    void enqueue_countsRetryAndPublishesQueued() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");

        retryQueue.enqueue("guild-1", notification);

        assertThat(notification.getRetryCount()).isEqualTo(1);
        assertThat(notification.getLocation()).isEqualTo(QueueLocation.RETRY);
        assertThat(retryQueue.size("guild-1")).isEqualTo(1);
        assertThat(events).extracting(NotificationEvent::type).containsExactly(NotificationEventType.QUEUED);
    }

    @Test
    void defer_leavesRetryBudgetUntouched() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");

        retryQueue.defer("guild-1", notification);

        assertThat(notification.getRetryCount()).isZero();
        assertThat(retryQueue.peekHead("guild-1")).contains(notification);
    }

    @Test
    void removeHead_isFifoAndDropsEmptyScope() {
        Notification first = TestNotifications.notification("n-1", "guild-1");
        Notification second = TestNotifications.notification("n-2", "guild-1");
        retryQueue.enqueue("guild-1", first);
        retryQueue.defer("guild-1", second);

        assertThat(retryQueue.removeHead("guild-1")).contains(first);
        assertThat(first.getLocation()).isEqualTo(QueueLocation.NONE);
        assertThat(retryQueue.removeHead("guild-1")).contains(second);

        assertThat(retryQueue.isEmpty("guild-1")).isTrue();
        assertThat(retryQueue.scopes()).isEmpty();
        assertThat(retryQueue.removeHead("guild-1")).isEmpty();
    }

    @Test
    void enqueue_alreadyQueued_isRejected() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");
        retryQueue.enqueue("guild-1", notification);

        assertThatThrownBy(() -> retryQueue.enqueue("guild-1", notification))
            .isInstanceOf(NotificationStateException.class)
            .hasMessageContaining("already queued");
        assertThat(retryQueue.size("guild-1")).isEqualTo(1);
        assertThat(notification.getRetryCount()).isEqualTo(1);
    }

    @Test
    void enqueue_sentNotification_isRejected() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");
        notification.markSent(Instant.parse("2024-05-01T09:00:01Z"));

        assertThatThrownBy(() -> retryQueue.defer("guild-1", notification))
            .isInstanceOf(NotificationStateException.class);
        assertThat(retryQueue.isEmpty("guild-1")).isTrue();
    }

    @Test
    void enqueue_permanentlyFailedNotification_isRejected() {
        Notification notification = TestNotifications.notification("n-1", "guild-1");
        notification.markFailedPermanently("Discord client error 404");

        assertThatThrownBy(() -> retryQueue.enqueue("guild-1", notification))
            .isInstanceOf(NotificationStateException.class)
            .hasMessageContaining("Terminal");
        assertThat(notification.getRetryCount()).isZero();
        assertThat(notification.getLocation()).isEqualTo(QueueLocation.NONE);
        assertThat(retryQueue.isEmpty("guild-1")).isTrue();
    }

    @Test
    void enqueue_atRetryLimit_isRejectedWithoutMovingNotification() {
        Notification notification = TestNotifications.notification("n-1", "guild-1", NotificationPriority.MEDIUM, 0);

        assertThatThrownBy(() -> retryQueue.enqueue("guild-1", notification))
            .isInstanceOf(NotificationStateException.class)
            .hasMessageContaining("Retry limit reached");
        assertThat(notification.getLocation()).isEqualTo(QueueLocation.NONE);
        assertThat(retryQueue.isEmpty("guild-1")).isTrue();
    }

    @Test
    void recordFailedAttempt_keepsHeadInPlace() {
        Notification first = TestNotifications.notification("n-1", "guild-1");
        Notification second = TestNotifications.notification("n-2", "guild-1");
        retryQueue.enqueue("guild-1", first);
        retryQueue.enqueue("guild-1", second);

        retryQueue.recordFailedAttempt("guild-1", first);

        assertThat(first.getRetryCount()).isEqualTo(2);
        assertThat(retryQueue.peekHead("guild-1")).contains(first);
        assertThatThrownBy(() -> retryQueue.recordFailedAttempt("guild-1", second))
            .isInstanceOf(NotificationStateException.class);
    }

    @Test
    void sizes_reportPerScopeCounts() {
        retryQueue.enqueue("guild-1", TestNotifications.notification("n-1", "guild-1"));
        retryQueue.enqueue("guild-1", TestNotifications.notification("n-2", "guild-1"));
        retryQueue.defer("guild-2", TestNotifications.notification("n-3", "guild-2"));

        assertThat(retryQueue.sizes()).containsEntry("guild-1", 2).containsEntry("guild-2", 1);
        assertThat(retryQueue.totalSize()).isEqualTo(3);
        assertThat(retryQueue.scopes()).containsExactlyInAnyOrder("guild-1", "guild-2");
    }
}
