package courier.spi;

import courier.TaskEnvelope;

/**
 * Queue abstraction that owns envelopes from enqueue until acknowledgement.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>A message is visible to at most one consumer at a time.</li>
 *   <li>Delivery is at-least-once: a message rejected with requeue, or held by a stream that
 *       closes (or a consumer that disappears) without acknowledging it, is delivered again.
 *       Handlers must tolerate duplicates or deduplicate on {@link TaskEnvelope#id()}.</li>
 *   <li>No ordering is guaranteed across envelopes.</li>
 * </ul>
 *
 * <p>Implementations must be thread-safe.
 *
 * @see courier.broker.InMemoryBroker
 */
public interface BrokerTransport {

    /**
     * Publishes an envelope to {@link TaskEnvelope#queue()}.
     *
     * @param envelope the envelope to publish
     * @throws BrokerUnavailableException if the transport cannot be reached
     * @throws EnqueueException           if the envelope cannot be published for another reason
     */
    void enqueue(TaskEnvelope envelope);

    /**
     * Opens a consumer on a queue.
     *
     * @param queue logical queue name
     * @return a new stream owned by the caller
     */
    DeliveryStream consume(String queue);

    /**
     * Permanently removes the delivered message.
     *
     * @param delivery a delivery that has not been acknowledged or rejected yet
     * @throws IllegalStateException if the delivery is unknown or already settled
     */
    void ack(Delivery delivery);

    /**
     * Gives a delivery back to the broker.
     *
     * @param delivery a delivery that has not been acknowledged or rejected yet
     * @param requeue  {@code true} to make the message visible again, {@code false} to discard it
     * @throws IllegalStateException if the delivery is unknown or already settled
     */
    void reject(Delivery delivery, boolean requeue);
}
