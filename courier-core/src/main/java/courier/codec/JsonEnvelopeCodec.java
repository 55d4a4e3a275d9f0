package courier.codec;

import courier.TaskEnvelope;
import courier.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Writes envelopes as a flat UTF-8 JSON object:
 *
 * <pre>{@code
 * {"id":"0190f7c4-...","task":"send_booking_confirmation_email","queue":"emails",
 *  "attempt":"0","max_retries":"3","created_at":"2024-05-01T10:15:30Z",
 *  "schema_version":"1","payload":"{\"bookingId\":\"b1\"}"}
 * }</pre>
 *
 * <p>The payload is nested as JSON text so that argument order survives the round trip.
 */
public final class JsonEnvelopeCodec implements EnvelopeCodec {
    public static final String MEDIA_TYPE = "application/vnd.courier.task+json";
    public static final String CONTENT_TYPE = MEDIA_TYPE + "; version=" + TaskEnvelope.CURRENT_SCHEMA_VERSION;

    private static final JsonEnvelopeCodec DEFAULT = new JsonEnvelopeCodec(JsonCodec.getDefault());

    private final JsonCodec json;

    public JsonEnvelopeCodec(JsonCodec json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    public static JsonEnvelopeCodec getDefault() {
        return DEFAULT;
    }

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }

    @Override
    public byte[] encode(TaskEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("id", envelope.id().toString());
        fields.put("task", envelope.taskName());
        fields.put("queue", envelope.queue());
        fields.put("attempt", Integer.toString(envelope.attempt()));
        fields.put("max_retries", Integer.toString(envelope.maxRetries()));
        fields.put("created_at", envelope.createdAt().toString());
        fields.put("schema_version", Integer.toString(envelope.schemaVersion()));
        fields.put("payload", json.toJson(envelope.payload()));
        return json.toJson(fields).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public TaskEnvelope decode(byte[] body, String contentType) {
        if (body == null) {
            throw new EnvelopeCodecException("Message body is null");
        }
        if (!supports(contentType)) {
            throw new EnvelopeCodecException("Unsupported content type: " + contentType);
        }
        try {
            Map<String, String> fields = json.parseObject(new String(body, StandardCharsets.UTF_8));
            int schemaVersion = Integer.parseInt(fields.getOrDefault("schema_version", "1"));
            if (schemaVersion > TaskEnvelope.CURRENT_SCHEMA_VERSION) {
                throw new EnvelopeCodecException("Unsupported schema version: " + schemaVersion);
            }
            return TaskEnvelope.builder(required(fields, "task"))
                    .id(UUID.fromString(required(fields, "id")))
                    .queue(required(fields, "queue"))
                    .attempt(Integer.parseInt(required(fields, "attempt")))
                    .maxRetries(Integer.parseInt(required(fields, "max_retries")))
                    .createdAt(Instant.parse(required(fields, "created_at")))
                    .schemaVersion(schemaVersion)
                    .payload(json.parseObject(required(fields, "payload")))
                    .build();
        } catch (DateTimeParseException | IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            throw new EnvelopeCodecException("Malformed envelope: " + e.getMessage(), e);
        }
    }

    private static boolean supports(String contentType) {
        if (contentType == null) {
            return false;
        }
        int paramStart = contentType.indexOf(';');
        String mediaType = paramStart < 0 ? contentType : contentType.substring(0, paramStart);
        return MEDIA_TYPE.equals(mediaType.trim().toLowerCase(Locale.ROOT));
    }

    private static String required(Map<String, String> fields, String name) {
        String value = fields.get(name);
        if (value == null) {
            throw new EnvelopeCodecException("Missing envelope field: " + name);
        }
        return value;
    }
}
