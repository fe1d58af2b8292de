package de.bsommerfeld.upvision.core.event;

import com.google.inject.Singleton;

import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Unbounded FIFO between the background batch worker and the polling
 * observer.
 *
 * <p>
 * The producer appends with {@link #push} and never waits, even if the
 * observer polls slowly. The observer calls {@link #drain} on every tick,
 * which hands over everything that is currently queued in production order
 * and returns straight away when the queue is empty.
 */
@Singleton
public class BatchEventChannel implements BatchEventSink {

    private final Queue<BatchEvent> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void push(BatchEvent event) {
        queue.add(Objects.requireNonNull(event, "event"));
    }

    /** Removes and returns the oldest event, or empty if nothing is queued. */
    public Optional<BatchEvent> poll() {
        return Optional.ofNullable(queue.poll());
    }

    /**
     * Delivers all currently queued events to {@code consumer} in FIFO order.
     *
     * @return number of events delivered
     */
    public int drain(Consumer<? super BatchEvent> consumer) {
        int count = 0;
        BatchEvent event;
        while ((event = queue.poll()) != null) {
            consumer.accept(event);
            count++;
        }
        return count;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
