package io.gradeflow.core.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProgressBroadcasterTest {

    private ProgressBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new ProgressBroadcaster(8);
    }

    private ProgressEvent publish(String runId, String node) {
        return broadcaster.publish(runId, ProgressEventKind.NODE_STARTED, Map.of("node", node));
    }

    private static List<ProgressEvent> drain(ProgressSubscription subscription) {
        List<ProgressEvent> events = new ArrayList<>();
        subscription.forEachRemaining(events::add);
        return events;
    }

    @Nested
    class Publish {

        @Test
        void shouldAssignIncreasingSequenceNumbersPerRun() {
            assertThat(publish("run-1", "intake").sequence()).isEqualTo(1);
            assertThat(publish("run-1", "preprocess").sequence()).isEqualTo(2);
            assertThat(publish("run-2", "intake").sequence()).isEqualTo(1);
            assertThat(broadcaster.lastSequence("run-1")).isEqualTo(2);
        }

        @Test
        void shouldDeliverSameOrderToEverySubscriber() {
            ProgressSubscription first = broadcaster.subscribe("run-1");
            ProgressSubscription second = broadcaster.subscribe("run-1");

            publish("run-1", "intake");
            publish("run-1", "preprocess");
            broadcaster.publish("run-1", ProgressEventKind.COMPLETED, Map.of());
            broadcaster.complete("run-1");

            assertThat(drain(first)).extracting(ProgressEvent::sequence).containsExactly(1L, 2L, 3L);
            assertThat(drain(second)).extracting(ProgressEvent::sequence).containsExactly(1L, 2L, 3L);
        }

        @Test
        void shouldNotFailWithoutSubscribers() {
            ProgressEvent event = publish("run-1", "intake");

            assertThat(event.type()).isEqualTo("node_started");
            assertThat(broadcaster.hasSubscribers("run-1")).isFalse();
        }

        @Test
        void shouldContinueNumberingAfterReopen() {
            broadcaster.open("run-1", 41);

            assertThat(publish("run-1", "grade_dispatch").sequence()).isEqualTo(42);
        }

        @Test
        void shouldNeverLowerSequenceOnReopen() {
            publish("run-1", "intake");
            publish("run-1", "preprocess");

            broadcaster.open("run-1", 0);

            assertThat(publish("run-1", "rubric_parse").sequence()).isEqualTo(3);
        }
    }

    @Nested
    class LateJoin {

        @Test
        void shouldOnlySeeEventsPublishedAfterSubscribing() {
            publish("run-1", "intake");
            publish("run-1", "preprocess");

            ProgressSubscription late = broadcaster.subscribe("run-1");
            publish("run-1", "rubric_parse");
            broadcaster.complete("run-1");

            List<ProgressEvent> events = drain(late);
            assertThat(events).hasSize(1);
            assertThat(events.get(0).sequence()).isEqualTo(3);
            assertThat(events.get(0).payload()).containsEntry("node", "rubric_parse");
        }
    }

    @Nested
    class Overflow {

        @Test
        void shouldDropOldestEventsForSlowSubscriber() {
            ProgressSubscription slow = broadcaster.subscribe("run-1");

            for (int i = 0; i < 12; i++) {
                publish("run-1", "node-" + i);
            }
            broadcaster.complete("run-1");

            List<ProgressEvent> events = drain(slow);
            assertThat(events).extracting(ProgressEvent::sequence).containsExactly(5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L);
            assertThat(slow.droppedCount()).isEqualTo(4);
        }

        @Test
        void shouldNotAffectFastSubscriberWhenAnotherOverflows() throws Exception {
            ProgressSubscription slow = broadcaster.subscribe("run-1");
            ProgressSubscription fast = broadcaster.subscribe("run-1");
            List<Long> received = new ArrayList<>();

            for (int i = 0; i < 12; i++) {
                publish("run-1", "node-" + i);
                received.add(fast.poll(Duration.ofSeconds(1)).orElseThrow().sequence());
            }

            assertThat(received).hasSize(12).isSorted();
            assertThat(fast.droppedCount()).isZero();
            assertThat(slow.droppedCount()).isEqualTo(4);
        }
    }

    @Nested
    class Isolation {

        @Test
        void shouldNeverDeliverEventsOfAnotherRun() throws Exception {
            ProgressSubscription runA = broadcaster.subscribe("run-a");
            ProgressSubscription runB = broadcaster.subscribe("run-b");
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (String runId : List.of("run-a", "run-b")) {
                    pool.submit(
                            () -> {
                                start.await();
                                for (int i = 0; i < 5; i++) {
                                    publish(runId, "node-" + i);
                                }
                                broadcaster.complete(runId);
                                return null;
                            });
                }
                start.countDown();
                pool.shutdown();
                assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            } finally {
                pool.shutdownNow();
            }

            List<ProgressEvent> a = drain(runA);
            List<ProgressEvent> b = drain(runB);
            assertThat(a).hasSize(5).allMatch(e -> e.runId().equals("run-a"));
            assertThat(b).hasSize(5).allMatch(e -> e.runId().equals("run-b"));
            assertThat(a).extracting(ProgressEvent::sequence).containsExactly(1L, 2L, 3L, 4L, 5L);
        }
    }

    @Nested
    class Complete {

        @Test
        void shouldEndSubscriptionsAndRemoveChannel() {
            ProgressSubscription subscription = broadcaster.subscribe("run-1");

            broadcaster.complete("run-1");

            assertThat(subscription.isEnded()).isTrue();
            assertThat(subscription.hasNext()).isFalse();
            assertThat(broadcaster.activeChannelCount()).isZero();
            assertThatThrownBy(subscription::next).isInstanceOf(NoSuchElementException.class);
        }

        @Test
        void shouldLetSubscriberDrainBufferedEventsAfterCompletion() {
            ProgressSubscription subscription = broadcaster.subscribe("run-1");
            publish("run-1", "intake");

            broadcaster.complete("run-1");

            assertThat(subscription.hasNext()).isTrue();
            assertThat(subscription.next().sequence()).isEqualTo(1);
            assertThat(subscription.hasNext()).isFalse();
        }

        @Test
        void shouldDetachClosedSubscription() {
            ProgressSubscription subscription = broadcaster.subscribe("run-1");

            subscription.close();

            assertThat(broadcaster.hasSubscribers("run-1")).isFalse();
        }

        @Test
        void shouldTimeOutPollWhenNothingIsPublished() throws Exception {
            ProgressSubscription subscription = broadcaster.subscribe("run-1");

            assertThat(subscription.poll(Duration.ofMillis(20))).isEmpty();
        }
    }

    @Test
    void shouldRejectNonPositiveBufferSize() {
        assertThatThrownBy(() -> new ProgressBroadcaster(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("subscriberBufferSize");
    }
}
