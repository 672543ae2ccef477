package org.swarmsim.server.engine;

import org.swarmsim.server.contracts.IStreamMessage;

import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The delivery channel of one subscriber.
 * <p>
 * The buffer is bounded. When it is full the oldest unread message is discarded to make room, so
 * the tick loop never blocks on a slow consumer; {@link #getDroppedCount()} reports how many
 * messages a lagging consumer lost. A terminal shutdown marker is always delivered.
 * <p>
 * Delivery is performed by a single producer at a time (the tick loop, or the lifecycle thread
 * after the loop has exited); consumption may happen on any thread.
 */
public final class Subscription {

    private final String id = UUID.randomUUID().toString();
    private final BlockingQueue<IStreamMessage> buffer;
    private final AtomicLong dropped = new AtomicLong();

    Subscription(final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Subscription capacity must be positive: " + capacity);
        }
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Waits for the next message.
     *
     * @return The next message.
     * @throws InterruptedException if interrupted while waiting.
     */
    public IStreamMessage take() throws InterruptedException {
        return buffer.take();
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return The next message, or {@code null} if none arrived in time.
     * @throws InterruptedException if interrupted while waiting.
     */
    public IStreamMessage poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        return buffer.poll(timeout, unit);
    }

    public String getId() {
        return id;
    }

    /**
     * @return The number of messages discarded because the consumer fell behind.
     */
    public long getDroppedCount() {
        return dropped.get();
    }

    /**
     * @return The number of buffered, unread messages.
     */
    public int pending() {
        return buffer.size();
    }

    void deliver(final IStreamMessage message) {
        while (!buffer.offer(message)) {
            if (buffer.poll() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    @Override
    public String toString() {
        return "Subscription{" + id + '}';
    }
}
