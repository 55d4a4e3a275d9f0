package courier.spi;

import courier.TaskEnvelope;

import java.util.Objects;

/**
 * One delivery of an envelope to a consumer, identified by a broker-assigned tag.
 *
 * <p>The tag is the acknowledgement handle: it is valid until passed to
 * {@link BrokerTransport#ack(Delivery)} or {@link BrokerTransport#reject(Delivery, boolean)},
 * or until the stream it came from is closed.
 *
 * @param envelope decoded envelope
 * @param queue    queue the delivery was consumed from
 * @param tag      broker-specific acknowledgement handle
 */
public record Delivery(TaskEnvelope envelope, String queue, String tag) {

    public Delivery {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(tag, "tag");
    }
}
