package io.fullerstack.hub;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link SubscriptionHub}.
 * <p>
 * Most tests use a synchronous hub so that delivery has completed when
 * {@code publish} returns; the asynchronous worker is covered separately.
 */
class SubscriptionHubTest {

    private final List<SubscriptionHub<?>> hubs = new ArrayList<>();

    @AfterEach
    void closeHubs() {
        hubs.forEach(SubscriptionHub::close);
    }

    private <T> SubscriptionHub<T> syncHub() {
        return hub(HubOptions.builder().asyncPublish(false).build());
    }

    private <T> SubscriptionHub<T> hub(HubOptions options) {
        SubscriptionHub<T> hub = new SubscriptionHub<>(options);
        hubs.add(hub);
        return hub;
    }

    private static <T> List<T> drain(Subscription<T> subscription) throws InterruptedException {
        List<T> values = new ArrayList<>();
        while (subscription.pending() > 0) {
            values.add(subscription.take());
        }
        return values;
    }

    @Nested
    @DisplayName("Topic filtering")
    class TopicFiltering {

        @Test
        @DisplayName("Subscriber to A never sees B; empty topic set sees everything")
        void topicSetRestrictsDelivery() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> onlyA = hub.subscribe("a-only", Set.of("A"));
            Subscription<String> everything = hub.subscribe("all", Set.of());

            hub.publish("x", "B");
            hub.publish("y", "A");
            hub.publish("z");

            assertThat(drain(onlyA)).containsExactly("y");
            assertThat(drain(everything)).containsExactly("x", "y", "z");
        }

        @Test
        void wildcardSubscriptionsReceiveMatchingTopics() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> temps = hub.subscribe("temps", Set.of("plant/+/temp"));
            Subscription<String> line1 = hub.subscribe("line1", Set.of("plant/line1/#"));

            hub.publish("t1", "plant/line1/temp");
            hub.publish("p1", "plant/line1/pressure");
            hub.publish("t2", "plant/line2/temp");

            assertThat(drain(temps)).containsExactly("t1", "t2");
            assertThat(drain(line1)).containsExactly("t1", "p1");
        }

        @Test
        void updateTopicsChangesOnlyThatSubscription() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> moving = hub.subscribe("moving", Set.of("A"));
            Subscription<String> fixed = hub.subscribe("fixed", Set.of("A"));

            hub.updateTopics(moving, Set.of("B"), Set.of("A"));
            hub.publish("a", "A");
            hub.publish("b", "B");

            assertThat(moving.getTopics()).containsExactly("B");
            assertThat(drain(moving)).containsExactly("b");
            assertThat(drain(fixed)).containsExactly("a");
        }

        @Test
        void removingAllTopicsReceivesEverything() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s", Set.of("A"));

            hub.updateTopics(subscription, null, Set.of("A"));
            hub.publish("b", "B");

            assertThat(drain(subscription)).containsExactly("b");
        }

        @Test
        void updateTopicsIsNoOpAfterCancel() {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s", Set.of("A"));
            subscription.close();

            assertThatCode(() -> hub.updateTopics(subscription, Set.of("B"), Set.of()))
                .doesNotThrowAnyException();
            assertThat(subscription.getTopics()).containsExactly("A");
        }

        @Test
        void updateTopicsRejectsForeignSubscription() {
            SubscriptionHub<String> hub = syncHub();
            SubscriptionHub<String> other = syncHub();
            Subscription<String> foreign = other.subscribe("s");

            assertThatThrownBy(() -> hub.updateTopics(foreign, Set.of("A"), Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void malformedWildcardRejectedAtSubscribe() {
            SubscriptionHub<String> hub = syncHub();

            assertThatThrownBy(() -> hub.subscribe("s", Set.of("a/#/b")))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(hub.getSubscriptionCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Staleness guard")
    class StalenessGuard {

        @Test
        @DisplayName("A value with an older sequence arriving after a newer one is discarded")
        void olderSequenceDiscarded() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s");

            long s1 = hub.nextSequence();
            long s2 = hub.nextSequence();
            hub.publish(s2, "P2", null);
            hub.publish(s1, "P1", null);

            assertThat(drain(subscription)).containsExactly("P2");
            assertThat(subscription.lastAcceptedSequence()).hasValue(s2);
        }

        @Test
        void inOrderSequencesAreAllAccepted() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s");

            long s1 = hub.nextSequence();
            long s2 = hub.nextSequence();
            hub.publish(s1, "P1", null);
            hub.publish(s2, "P2", null);

            assertThat(drain(subscription)).containsExactly("P1", "P2");
        }

        @Test
        void repeatedSequenceDiscarded() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s");

            long s1 = hub.nextSequence();
            hub.publish(s1, "first", null);
            hub.publish(s1, "again", null);

            assertThat(drain(subscription)).containsExactly("first");
        }

        @Test
        @DisplayName("Sequences wrapping from MAX_VALUE to MIN_VALUE keep flowing")
        void wraparoundKeepsDelivering() throws Exception {
            SubscriptionHub<String> hub = hub(HubOptions.builder()
                .asyncPublish(false)
                .initialSequence(Long.MAX_VALUE - 1)
                .build());
            Subscription<String> subscription = hub.subscribe("s");

            long first = hub.publish("a");
            long second = hub.publish("b");
            long third = hub.publish("c");

            assertThat(first).isEqualTo(Long.MAX_VALUE - 1);
            assertThat(second).isEqualTo(Long.MAX_VALUE);
            assertThat(third).isEqualTo(Long.MIN_VALUE);
            assertThat(drain(subscription)).containsExactly("a", "b", "c");
        }

        @Test
        void staleValueIsNotCountedAsDropped() {
            SubscriptionHub<String> hub = syncHub();
            hub.subscribe("s");

            long s1 = hub.nextSequence();
            long s2 = hub.nextSequence();
            hub.publish(s2, "P2", null);
            hub.publish(s1, "P1", null);

            assertThat(hub.health().droppedCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Isolation")
    class Isolation {

        @Test
        @DisplayName("A full subscriber does not stop delivery to a healthy one")
        void fullSubscriberDoesNotAffectOthers() throws Exception {
            SubscriptionHub<Integer> hub = hub(HubOptions.builder()
                .asyncPublish(false)
                .channelCapacity(1)
                .build());
            Subscription<Integer> stuck = hub.subscribe("stuck");
            Subscription<Integer> healthy = hub.subscribe("healthy");

            List<Integer> received = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                hub.publish(i);
                received.add(healthy.take());
            }

            assertThat(received).containsExactly(0, 1, 2, 3, 4);
            assertThat(drain(stuck)).containsExactly(0);
            assertThat(hub.health().droppedCount()).isEqualTo(4);
        }

        @Test
        void dropOldestKeepsMostRecentValues() throws Exception {
            SubscriptionHub<Integer> hub = hub(HubOptions.builder()
                .asyncPublish(false)
                .channelCapacity(2)
                .overflowPolicy(OverflowPolicy.DROP_OLDEST)
                .build());
            Subscription<Integer> slow = hub.subscribe("slow");

            for (int i = 0; i < 5; i++) {
                hub.publish(i);
            }

            assertThat(drain(slow)).containsExactly(3, 4);
            assertThat(hub.health().droppedCount()).isEqualTo(3);
        }

        @Test
        @SuppressWarnings("unchecked")
        void deliveryFailuresReportedToListener() {
            SubscriptionHub<Integer> hub = hub(HubOptions.builder()
                .asyncPublish(false)
                .channelCapacity(1)
                .build());
            HubListener<Integer> listener = mock(HubListener.class);
            hub.addListener(listener);
            Subscription<Integer> stuck = hub.subscribe("stuck");

            hub.publish(1);
            hub.publish(2);
            hub.publish(3);

            verify(listener, times(2)).onDeliveryFailed(eq(stuck), any(), eq(DeliveryResult.DROPPED));
            verify(listener, times(3)).onPublished(any(), anyInt());
        }

        @Test
        void throwingListenerDoesNotBreakDelivery() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            hub.addListener(new HubListener<>() {
                @Override
                public void onPublished(PublishedValue<String> value, int delivered) {
                    throw new IllegalStateException("listener bug");
                }
            });
            Subscription<String> subscription = hub.subscribe("s");

            assertThatCode(() -> hub.publish("v")).doesNotThrowAnyException();
            assertThat(drain(subscription)).containsExactly("v");
        }
    }

    @Nested
    @DisplayName("Unsubscribe")
    class Unsubscribe {

        @Test
        @DisplayName("Cancelling twice neither throws nor corrupts the registry")
        void cancelTwiceIsSafe() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> first = hub.subscribe("first");
            Subscription<String> second = hub.subscribe("second");

            first.close();
            assertThatCode(first::close).doesNotThrowAnyException();
            assertThatCode(() -> hub.unsubscribe(first)).doesNotThrowAnyException();

            assertThat(hub.getSubscriptionCount()).isEqualTo(1);

            Subscription<String> third = hub.subscribe("third");
            hub.publish("after");

            assertThat(drain(third)).containsExactly("after");
            assertThat(drain(second)).containsExactly("after");
            assertThat(hub.getSubscriptionCount()).isEqualTo(2);
        }

        @Test
        void concurrentCancelsRemoveEntryOnce() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            @SuppressWarnings("unchecked")
            HubListener<String> listener = mock(HubListener.class);
            hub.addListener(listener);
            Subscription<String> subscription = hub.subscribe("s");

            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                CountDownLatch start = new CountDownLatch(1);
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        subscription.close();
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(hub.getSubscriptionCount()).isZero();
            verify(listener, times(1)).onSubscriptionCancelled(subscription);
        }

        @Test
        void cancelledSubscriptionStopsReceivingAndDropsPending() {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s");
            hub.publish("queued");

            subscription.close();
            hub.publish("later");

            assertThat(subscription.isClosed()).isTrue();
            assertThat(subscription.pending()).isZero();
            assertThatThrownBy(subscription::take).isInstanceOf(CancellationException.class);
            assertThatThrownBy(() -> subscription.poll(Duration.ofMillis(10))).isInstanceOf(CancellationException.class);
        }

        @Test
        void cancelWakesBlockedConsumer() {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s");
            CompletableFuture<String> consumer = CompletableFuture.supplyAsync(() -> {
                try {
                    return subscription.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            });

            subscription.close();

            await().atMost(5, TimeUnit.SECONDS).until(consumer::isDone);
            assertThat(consumer).isCompletedExceptionally();
            assertThatThrownBy(consumer::join).hasCauseInstanceOf(CancellationException.class);
        }
    }

    @Nested
    @DisplayName("Pull interfaces")
    class PullInterfaces {

        @Test
        void streamYieldsValuesAndEndsOnCancel() {
            SubscriptionHub<Integer> hub = hub(HubOptions.defaults());
            Subscription<Integer> subscription = hub.subscribe("stream");

            CompletableFuture<List<Integer>> collected = CompletableFuture.supplyAsync(() -> {
                try (Stream<Integer> values = subscription.stream()) {
                    return values.collect(Collectors.toList());
                }
            });

            hub.publish(1);
            hub.publish(2);
            hub.publish(3);
            await().atMost(5, TimeUnit.SECONDS).until(() -> subscription.pending() == 0
                && subscription.lastAcceptedSequence().isPresent()
                && subscription.lastAcceptedSequence().getAsLong() == 2L);

            subscription.close();

            await().atMost(5, TimeUnit.SECONDS).until(collected::isDone);
            assertThat(collected.join()).containsExactly(1, 2, 3);
        }

        @Test
        void closingStreamCancelsSubscription() {
            SubscriptionHub<Integer> hub = syncHub();
            Subscription<Integer> subscription = hub.subscribe("stream");
            hub.publish(7);

            try (Stream<Integer> values = subscription.stream()) {
                assertThat(values.findFirst()).contains(7);
            }

            assertThat(subscription.isClosed()).isTrue();
            assertThat(hub.getSubscriptionCount()).isZero();
        }

        @Test
        void iteratorReturnsValuesInOrder() {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("iterator");
            hub.publish("a");
            hub.publish("b");

            Iterator<String> iterator = subscription.iterator();

            assertThat(iterator.next()).isEqualTo("a");
            assertThat(iterator.next()).isEqualTo("b");
            subscription.close();
            assertThat(iterator.hasNext()).isFalse();
        }

        @Test
        void pollReturnsEmptyOnTimeout() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("poll");

            assertThat(subscription.poll(Duration.ofMillis(20))).isEmpty();
            hub.publish("v");
            assertThat(subscription.poll(Duration.ofMillis(20))).contains("v");
        }
    }

    @Nested
    @DisplayName("Asynchronous fan-out")
    class AsyncFanOut {

        @Test
        void awaitIdleWaitsForEveryPublishedValue() {
            SubscriptionHub<Integer> hub = hub(HubOptions.defaults());
            Subscription<Integer> subscription = hub.subscribe("s");

            for (int i = 0; i < 500; i++) {
                hub.publish(i);
            }
            hub.awaitIdle();

            assertThat(subscription.pending()).isEqualTo(500);
            assertThat(hub.health().publishedCount()).isEqualTo(500);
            assertThat(hub.health().pendingPublishes()).isZero();
        }

        @Test
        void concurrentPublishersDeliverEveryValue() throws Exception {
            SubscriptionHub<Long> hub = hub(HubOptions.builder().channelCapacity(0).build());
            Subscription<Long> subscription = hub.subscribe("s");
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < 4; t++) {
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 250; i++) {
                            hub.publish(System.nanoTime());
                        }
                    }));
                }
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
            hub.awaitIdle();

            assertThat(subscription.pending()).isEqualTo(1000);
            assertThat(hub.health().droppedCount()).isZero();
        }

        @Test
        void subscriberReceivesAsynchronously() {
            SubscriptionHub<String> hub = hub(HubOptions.defaults());
            Subscription<String> subscription = hub.subscribe("s", Set.of("A"));

            hub.publish("hello", "A");

            await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(subscription.pending()).isEqualTo(1)
            );
        }
    }

    @Nested
    @DisplayName("Publishing to one subscription")
    class PublishTo {

        @Test
        void onlyTheTargetReceivesTheValue() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> target = hub.subscribe("target", Set.of("A"));
            Subscription<String> other = hub.subscribe("other", Set.of("A"));

            hub.publishTo(target, "current", "A");

            assertThat(drain(target)).containsExactly("current");
            assertThat(other.pending()).isZero();
        }

        @Test
        void topicFilterStillApplies() {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s", Set.of("A"));

            hub.publishTo(subscription, "b", "B");

            assertThat(subscription.pending()).isZero();
        }

        @Test
        void valueIsNotRetained() {
            SubscriptionHub<String> hub = hub(HubOptions.builder().asyncPublish(false).retainLastValue(true).build());
            Subscription<String> subscription = hub.subscribe("s", Set.of("A"));

            hub.publishTo(subscription, "private", "A");

            assertThat(hub.retainedValue("A")).isEmpty();
        }

        @Test
        @DisplayName("Queued publishes for other topics are not discarded as stale")
        void staysOrderedWithAsyncPublishes() {
            SubscriptionHub<String> hub = hub(HubOptions.defaults());
            Subscription<String> subscription = hub.subscribe("s", Set.of("A", "B"));

            long first = hub.publish("a1", "A");
            long targeted = hub.publishTo(subscription, "b0", "B");
            long last = hub.publish("a2", "A");
            hub.awaitIdle();

            assertThat(targeted).isGreaterThan(first).isLessThan(last);
            assertThat(subscription.stream().limit(3)).containsExactly("a1", "b0", "a2");
        }

        @Test
        void rejectsForeignSubscription() {
            SubscriptionHub<String> hub = syncHub();
            SubscriptionHub<String> other = syncHub();
            Subscription<String> foreign = other.subscribe("s");

            assertThatThrownBy(() -> hub.publishTo(foreign, "x", "A"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejectedAfterClose() {
            SubscriptionHub<String> hub = syncHub();
            Subscription<String> subscription = hub.subscribe("s", Set.of("A"));
            hub.close();

            assertThatThrownBy(() -> hub.publishTo(subscription, "x", "A"))
                .isInstanceOf(HubClosedException.class);
        }
    }

    @Nested
    @DisplayName("Retained values")
    class RetainedValues {

        @Test
        void newSubscriberReceivesLastValuePerMatchingTopicInSequenceOrder() throws Exception {
            SubscriptionHub<String> hub = hub(HubOptions.builder()
                .asyncPublish(false)
                .retainLastValue(true)
                .build());

            hub.publish("a1", "A");
            hub.publish("b1", "B");
            hub.publish("n1");
            hub.publish("a2", "A");

            Subscription<String> onlyA = hub.subscribe("a", Set.of("A"));
            Subscription<String> all = hub.subscribe("all");

            assertThat(drain(onlyA)).containsExactly("a2");
            assertThat(drain(all)).containsExactly("b1", "n1", "a2");
            assertThat(hub.retainedValue("A")).contains("a2");
            assertThat(hub.retainedValue(null)).contains("n1");
        }

        @Test
        void retainedReplayThenLiveValues() throws Exception {
            SubscriptionHub<String> hub = hub(HubOptions.builder()
                .asyncPublish(false)
                .retainLastValue(true)
                .build());
            hub.publish("old", "A");

            Subscription<String> subscription = hub.subscribe("s", Set.of("A"));
            hub.publish("new", "A");

            assertThat(drain(subscription)).containsExactly("old", "new");
        }

        @Test
        void nothingRetainedWhenDisabled() throws Exception {
            SubscriptionHub<String> hub = syncHub();
            hub.publish("a1", "A");

            Subscription<String> subscription = hub.subscribe("s", Set.of("A"));

            assertThat(drain(subscription)).isEmpty();
            assertThat(hub.retainedValue("A")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Limits and lifecycle")
    class Lifecycle {

        @Test
        void subscriptionLimitEnforced() {
            SubscriptionHub<String> hub = hub(HubOptions.builder()
                .asyncPublish(false)
                .maxSubscriptionCount(2)
                .build());
            Subscription<String> first = hub.subscribe("1");
            hub.subscribe("2");

            assertThatThrownBy(() -> hub.subscribe("3"))
                .isInstanceOfSatisfying(SubscriptionLimitException.class, e -> assertThat(e.getLimit()).isEqualTo(2));

            first.close();
            assertThatCode(() -> hub.subscribe("3")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Closed hub is unavailable and cancels its subscriptions")
        void closedHubRejectsOperations() {
            SubscriptionHub<String> hub = hub(HubOptions.defaults());
            Subscription<String> subscription = hub.subscribe("s");

            hub.close();

            assertThat(subscription.isClosed()).isTrue();
            assertThat(hub.getSubscriptionCount()).isZero();
            assertThat(hub.health().closed()).isTrue();
            assertThatThrownBy(() -> hub.subscribe("late")).isInstanceOf(HubClosedException.class);
            assertThatThrownBy(() -> hub.publish("late")).isInstanceOf(HubClosedException.class);
            assertThatThrownBy(hub::nextSequence).isInstanceOf(HubClosedException.class);
            assertThatCode(hub::close).doesNotThrowAnyException();
            assertThatCode(hub::awaitIdle).doesNotThrowAnyException();
        }

        @Test
        @SuppressWarnings("unchecked")
        void listenerSeesSubscriptionLifecycle() {
            SubscriptionHub<String> hub = syncHub();
            HubListener<String> listener = mock(HubListener.class);
            hub.addListener(listener);

            Subscription<String> subscription = hub.subscribe("s");
            subscription.close();
            hub.removeListener(listener);
            hub.subscribe("ignored");

            verify(listener).onSubscriptionAdded(subscription);
            verify(listener).onSubscriptionCancelled(subscription);
            verifyNoMoreInteractions(listener);
        }

        @Test
        void healthReflectsActivity() {
            SubscriptionHub<String> hub = hub(HubOptions.builder().id("health-check").asyncPublish(false).build());
            hub.subscribe("s");
            hub.publish("v");

            HubHealth health = hub.health();

            assertThat(health.hubId()).isEqualTo("health-check");
            assertThat(health.subscriptionCount()).isEqualTo(1);
            assertThat(health.publishedCount()).isEqualTo(1);
            assertThat(health.isHealthy()).isTrue();
        }

        @Test
        void nullValueRejected() {
            SubscriptionHub<String> hub = syncHub();

            assertThatThrownBy(() -> hub.publish(null, "A")).isInstanceOf(NullPointerException.class);
        }
    }
}
