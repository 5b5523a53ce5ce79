package com.anthem.pubsub.gateway.registry;

import com.anthem.pubsub.gateway.session.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InMemorySubscriptionRegistry.
 */
@ExtendWith(MockitoExtension.class)
class InMemorySubscriptionRegistryTest {

    private static final String NAME = "chat.room1";

    @Mock
    private Session first;

    @Mock
    private Session second;

    private InMemorySubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemorySubscriptionRegistry();
    }

    @Test
    void testPublish_ConfirmedSessionsReceiveMessage() {
        // Arrange
        registry.addProvisionalSubscription(first, NAME);
        registry.confirmSubscription(first, NAME);
        registry.addProvisionalSubscription(second, NAME);
        registry.confirmSubscription(second, NAME);
        Map<String, Object> message = Map.of("subscription", NAME, "data", "hello");

        // Act
        int reached = registry.publish(NAME, message);

        // Assert
        assertThat(reached).isEqualTo(2);
        verify(first).deliverServiceMessage(NAME, message);
        verify(second).deliverServiceMessage(NAME, message);
    }

    @Test
    void testPublish_ProvisionalBuffersUntilConfirmed() {
        // Arrange
        Map<String, Object> m1 = Map.of("data", 1);
        Map<String, Object> m2 = Map.of("data", 2);
        registry.addProvisionalSubscription(first, NAME);

        // Act
        registry.publish(NAME, m1);
        registry.publish(NAME, m2);

        // Assert
        verify(first, never()).deliverServiceMessage(anyString(), anyMap());
        assertThat(registry.isProvisional(first, NAME)).isTrue();

        registry.confirmSubscription(first, NAME);

        InOrder inOrder = inOrder(first);
        inOrder.verify(first).deliverServiceMessage(NAME, m1);
        inOrder.verify(first).deliverServiceMessage(NAME, m2);
        assertThat(registry.isProvisional(first, NAME)).isFalse();
        assertThat(registry.isConfirmed(first, NAME)).isTrue();
    }

    @Test
    void testDelete_ProvisionalDropsBufferedMessages() {
        // Arrange
        registry.addProvisionalSubscription(first, NAME);
        registry.publish(NAME, Map.of("data", 1));

        // Act
        registry.deleteSubscription(first, NAME);

        // Assert
        assertThat(registry.getSubscriberCount(NAME)).isZero();
        assertThat(registry.publish(NAME, Map.of("data", 2))).isZero();
        verify(first, never()).deliverServiceMessage(anyString(), anyMap());
    }

    @Test
    void testDelete_ConfirmedStopsDelivery() {
        // Arrange
        registry.addProvisionalSubscription(first, NAME);
        registry.confirmSubscription(first, NAME);
        registry.addProvisionalSubscription(second, NAME);
        registry.confirmSubscription(second, NAME);

        // Act
        registry.deleteSubscription(first, NAME);
        registry.publish(NAME, Map.of("data", "after"));

        // Assert
        verify(first, never()).deliverServiceMessage(anyString(), anyMap());
        verify(second).deliverServiceMessage(eq(NAME), anyMap());
        assertThat(registry.getSubscriberCount(NAME)).isEqualTo(1);
    }

    @Test
    void testDelete_UnknownEntryIsIgnored() {
        registry.deleteSubscription(first, "chat.nothing");

        assertThat(registry.getSubscriberCount("chat.nothing")).isZero();
    }

    @Test
    void testPublish_OtherSubscriptionNotReached() {
        registry.addProvisionalSubscription(first, NAME);
        registry.confirmSubscription(first, NAME);

        assertThat(registry.publish("chat.room2", Map.of("data", 1))).isZero();
        verify(first, never()).deliverServiceMessage(anyString(), anyMap());
    }

    @Test
    void testPublish_SlowSessionDoesNotBlockOtherRegistryCalls() throws Exception {
        // Arrange
        CountDownLatch delivering = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            delivering.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(first).deliverServiceMessage(eq(NAME), anyMap());
        registry.addProvisionalSubscription(first, NAME);
        registry.confirmSubscription(first, NAME);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            // Act
            Future<Integer> publishing = executor.submit(() -> registry.publish(NAME, Map.of("data", 1)));
            assertThat(delivering.await(5, TimeUnit.SECONDS)).isTrue();

            // Assert
            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                registry.addProvisionalSubscription(second, "chat.room2");
                registry.confirmSubscription(second, "chat.room2");
                registry.deleteSubscription(second, "chat.room2");
            });
            release.countDown();
            assertThat(publishing.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void testConfirm_MessagePublishedDuringFlushDeliveredBeforeConfirmation() {
        // Arrange
        Map<String, Object> m1 = Map.of("data", 1);
        Map<String, Object> m2 = Map.of("data", 2);
        AtomicBoolean confirmedDuringFlush = new AtomicBoolean(true);
        lenient().doAnswer(invocation -> {
            confirmedDuringFlush.set(registry.isConfirmed(first, NAME));
            registry.publish(NAME, m2);
            return null;
        }).when(first).deliverServiceMessage(NAME, m1);
        registry.addProvisionalSubscription(first, NAME);
        registry.publish(NAME, m1);

        // Act
        registry.confirmSubscription(first, NAME);

        // Assert
        InOrder inOrder = inOrder(first);
        inOrder.verify(first).deliverServiceMessage(NAME, m1);
        inOrder.verify(first).deliverServiceMessage(NAME, m2);
        assertThat(confirmedDuringFlush).isFalse();
        assertThat(registry.isConfirmed(first, NAME)).isTrue();
    }

    @Test
    void testConfirm_DeletedDuringFlushIsNotConfirmed() {
        // Arrange
        Map<String, Object> m1 = Map.of("data", 1);
        doAnswer(invocation -> {
            registry.deleteSubscription(first, NAME);
            return null;
        }).when(first).deliverServiceMessage(NAME, m1);
        registry.addProvisionalSubscription(first, NAME);
        registry.publish(NAME, m1);

        // Act
        registry.confirmSubscription(first, NAME);

        // Assert
        assertThat(registry.isConfirmed(first, NAME)).isFalse();
        assertThat(registry.getSubscriberCount(NAME)).isZero();
    }
}
