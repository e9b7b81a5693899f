package io.gradeflow.core.progress;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/// Fan-out publish/subscribe channel per run id.
///
/// Each run gets its own channel holding a sequence counter and the live subscriptions.
/// Publishing assigns the next sequence number and hands the event to every subscription
/// under the channel lock, so all subscribers observe the same order and a subscriber that
/// joins late only ever sees events published after it joined.
///
/// ### Overflow policy
/// Subscriptions buffer at most `subscriberBufferSize` events. When a consumer falls behind,
/// its oldest buffered event is dropped (drop-oldest). Publishing never blocks on a
/// subscriber.
///
/// ### Memory management
/// A channel is removed by {@link #complete(String)} after the run's terminal event.
/// Events published while nobody is subscribed are counted but not retained.
///
/// ### Usage
/// {@snippet :
/// ProgressSubscription events = broadcaster.subscribe(runId);
/// broadcaster.publish(runId, ProgressEventKind.NODE_STARTED, Map.of("node", "rubric_parse"));
/// events.next(); // sequence 1
/// broadcaster.complete(runId);
/// }
///
/// @implNote Thread-safe. Runs are isolated: a subscription only ever receives events of
/// the run id it subscribed to.
public class ProgressBroadcaster {

    private static final Logger logger = Logger.getLogger(ProgressBroadcaster.class.getName());

    /// Default per-subscriber buffer size.
    public static final int DEFAULT_BUFFER_SIZE = 256;

    private final int subscriberBufferSize;
    private final Map<String, RunChannel> channels = new ConcurrentHashMap<>();

    public ProgressBroadcaster() {
        this(DEFAULT_BUFFER_SIZE);
    }

    public ProgressBroadcaster(int subscriberBufferSize) {
        if (subscriberBufferSize < 1) {
            throw new IllegalArgumentException(
                    "subscriberBufferSize must be >= 1, was " + subscriberBufferSize);
        }
        this.subscriberBufferSize = subscriberBufferSize;
    }

    /// Opens the channel for a run, continuing its numbering after `lastSequence`.
    ///
    /// Used when a run is submitted, resumed or recovered. If the channel already exists its
    /// counter is only ever raised, never lowered.
    ///
    /// @param runId the run identifier, not null
    /// @param lastSequence highest sequence number already issued for the run
    public void open(String runId, long lastSequence) {
        Objects.requireNonNull(runId, "runId must not be null");
        channel(runId).raiseSequence(lastSequence);
    }

    /// Publishes an event to all current subscribers of a run.
    ///
    /// @param runId the target run, not null
    /// @param kind event kind, not null
    /// @param payload event detail, not null
    /// @return the published event with its assigned sequence number, never null
    public ProgressEvent publish(String runId, ProgressEventKind kind, Map<String, Object> payload) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        return channel(runId).publish(kind, payload);
    }

    /// Subscribes to the events a run publishes from now on.
    ///
    /// @param runId the run to follow, not null
    /// @return a live subscription, never null
    public ProgressSubscription subscribe(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return channel(runId).subscribe();
    }

    /// Ends every subscription of a run and discards its channel.
    ///
    /// Subscribers can still drain what they have buffered.
    ///
    /// @param runId the run whose stream is finished, not null
    public void complete(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        RunChannel channel = channels.remove(runId);
        if (channel != null) {
            logger.fine("Completing progress channel for run: " + runId);
            channel.end();
        }
    }

    /// Returns the last sequence number issued for a run, 0 if none.
    public long lastSequence(String runId) {
        RunChannel channel = channels.get(runId);
        return channel != null ? channel.lastSequence() : 0;
    }

    public boolean hasSubscribers(String runId) {
        RunChannel channel = channels.get(runId);
        return channel != null && channel.subscriberCount() > 0;
    }

    /// Returns the number of open run channels.
    public int activeChannelCount() {
        return channels.size();
    }

    private RunChannel channel(String runId) {
        return channels.computeIfAbsent(runId, RunChannel::new);
    }

    private final class RunChannel {

        private final String runId;
        private final List<ProgressSubscription> subscriptions = new CopyOnWriteArrayList<>();
        private long sequence;

        RunChannel(String runId) {
            this.runId = runId;
        }

        synchronized void raiseSequence(long floor) {
            sequence = Math.max(sequence, floor);
        }

        synchronized long lastSequence() {
            return sequence;
        }

        synchronized ProgressEvent publish(ProgressEventKind kind, Map<String, Object> payload) {
            ProgressEvent event = new ProgressEvent(runId, kind, ++sequence, Instant.now(), payload);
            if (subscriptions.isEmpty()) {
                logger.finest(
                        "No subscribers for run " + runId + ", event " + event.type() + " dropped");
            }
            for (ProgressSubscription subscription : subscriptions) {
                subscription.offer(event);
            }
            return event;
        }

        synchronized ProgressSubscription subscribe() {
            ProgressSubscription[] holder = new ProgressSubscription[1];
            holder[0] =
                    new ProgressSubscription(
                            runId, subscriberBufferSize, () -> subscriptions.remove(holder[0]));
            subscriptions.add(holder[0]);
            return holder[0];
        }

        synchronized void end() {
            for (ProgressSubscription subscription : subscriptions) {
                subscription.end();
            }
            subscriptions.clear();
        }

        int subscriberCount() {
            return subscriptions.size();
        }
    }
}
