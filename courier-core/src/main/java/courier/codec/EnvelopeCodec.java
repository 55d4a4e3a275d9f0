package courier.codec;

import courier.TaskEnvelope;

/**
 * Serialization contract between dispatchers and workers.
 *
 * <p>Every broker message is a body plus the content type it was written with. Brokers store
 * both and hand both back on decode, so a consumer can refuse formats it does not understand.
 *
 * @see JsonEnvelopeCodec
 */
public interface EnvelopeCodec {

    /**
     * Returns the content type this codec writes, e.g.
     * {@code application/vnd.courier.task+json; version=1}.
     */
    String contentType();

    /**
     * Serializes an envelope.
     *
     * @param envelope the envelope
     * @return message body
     */
    byte[] encode(TaskEnvelope envelope);

    /**
     * Deserializes a message body.
     *
     * @param body        message body
     * @param contentType content type recorded with the message
     * @return the envelope
     * @throws EnvelopeCodecException if the content type is not supported or the body is malformed
     */
    TaskEnvelope decode(byte[] body, String contentType);
}
