package courier.spi;

import java.time.Duration;

/**
 * Lazy, unbounded sequence of deliveries from one queue, owned by a single consumer.
 *
 * <p>Not thread-safe and not restartable: once closed, {@link #next(Duration)} fails. Closing
 * returns every delivery taken from this stream that was neither acknowledged nor rejected
 * to the queue, so an interrupted consumer never loses work.
 */
public interface DeliveryStream extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next delivery.
     *
     * @param timeout maximum wait
     * @return the next delivery, or {@code null} if none arrived in time
     * @throws InterruptedException  if the consuming thread is interrupted while waiting
     * @throws IllegalStateException if the stream is closed
     */
    Delivery next(Duration timeout) throws InterruptedException;

    /**
     * Releases the stream and requeues its unacknowledged deliveries.
     */
    @Override
    void close();
}
