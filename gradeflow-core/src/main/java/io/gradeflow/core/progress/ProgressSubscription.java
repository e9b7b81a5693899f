package io.gradeflow.core.progress;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// One subscriber's view of a run's event channel.
///
/// Events are buffered in a bounded queue. When the queue is full the oldest buffered event
/// is dropped to make room, so a slow consumer never blocks the run; {@link #droppedCount()}
/// reports how many were lost. Events received are always in increasing sequence order.
///
/// Iteration blocks until an event arrives or the channel ends, and finishes once the
/// channel has ended and the buffer is drained.
///
/// @implNote Thread-safe. One producer (the channel) and any number of consumer threads.
public final class ProgressSubscription implements Iterator<ProgressEvent>, AutoCloseable {

    private static final Logger logger = Logger.getLogger(ProgressSubscription.class.getName());

    private final String runId;
    private final int capacity;
    private final Runnable onClose;
    private final ArrayDeque<ProgressEvent> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private boolean ended;
    private long dropped;

    ProgressSubscription(String runId, int capacity, Runnable onClose) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.runId = runId;
        this.capacity = capacity;
        this.onClose = onClose;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 64));
    }

    void offer(ProgressEvent event) {
        lock.lock();
        try {
            if (ended) {
                return;
            }
            if (buffer.size() == capacity) {
                ProgressEvent evicted = buffer.pollFirst();
                dropped++;
                logger.warning(
                        "Subscriber buffer full for run "
                                + runId
                                + ", dropped event #"
                                + evicted.sequence());
            }
            buffer.addLast(event);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void end() {
        lock.lock();
        try {
            ended = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /// Waits up to `timeout` for the next event.
    ///
    /// @param timeout maximum wait, not null
    /// @return the next event, or empty if none arrived in time or the channel ended
    /// @throws InterruptedException if interrupted while waiting
    public Optional<ProgressEvent> poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (buffer.isEmpty() && !ended) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = changed.awaitNanos(remaining);
            }
            return Optional.ofNullable(buffer.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /// Blocks until an event is buffered or the channel ends.
    ///
    /// If the waiting thread is interrupted the interrupt flag is restored and iteration
    /// stops.
    @Override
    public boolean hasNext() {
        lock.lock();
        try {
            while (buffer.isEmpty() && !ended) {
                changed.await();
            }
            return !buffer.isEmpty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ProgressEvent next() {
        lock.lock();
        try {
            while (buffer.isEmpty() && !ended) {
                changed.await();
            }
            if (buffer.isEmpty()) {
                throw new NoSuchElementException("Event stream for run " + runId + " has ended");
            }
            return buffer.pollFirst();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NoSuchElementException("Interrupted while waiting for run " + runId);
        } finally {
            lock.unlock();
        }
    }

    /// Returns whether the channel has ended. Buffered events may still be pending.
    public boolean isEnded() {
        lock.lock();
        try {
            return ended;
        } finally {
            lock.unlock();
        }
    }

    public long droppedCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public String runId() {
        return runId;
    }

    /// Detaches from the channel. Already buffered events stay readable.
    @Override
    public void close() {
        end();
        onClose.run();
    }
}
