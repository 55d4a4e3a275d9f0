package courier.travel.payment.chapa;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import courier.travel.payment.PaymentReconciler;
import courier.travel.payment.ReconciliationResult;
import courier.travel.payment.WebhookResult;
import courier.travel.payment.WebhookSignatureVerifier;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for Chapa webhook calls, independent of the web framework receiving them.
 *
 * <p>The body must be signed (header {@code Chapa-Signature} or {@code x-chapa-signature}).
 * The status field in the body is logged but never trusted: the reference it names is verified
 * with the provider through the {@link PaymentReconciler}, which also absorbs duplicates.
 */
public final class ChapaWebhookHandler {
    private static final Logger logger = Logger.getLogger(ChapaWebhookHandler.class.getName());

    static final List<String> SIGNATURE_HEADERS = List.of("Chapa-Signature", "x-chapa-signature");

    private final PaymentReconciler reconciler;
    private final WebhookSignatureVerifier verifier;
    private final ObjectMapper objectMapper;

    public ChapaWebhookHandler(PaymentReconciler reconciler, WebhookSignatureVerifier verifier) {
        this(reconciler, verifier, new ObjectMapper());
    }

    public ChapaWebhookHandler(PaymentReconciler reconciler, WebhookSignatureVerifier verifier,
            ObjectMapper objectMapper) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Handles one webhook call.
     *
     * @param body    raw request body
     * @param headers request headers; names are matched case-insensitively
     * @return what happened
     * @throws courier.travel.payment.GatewayException if verification could not reach Chapa;
     *                                                 answer 5xx so that Chapa retries
     */
    public WebhookResult handle(byte[] body, Map<String, String> headers) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(headers, "headers");
        if (!verifier.verify(body, signature(headers))) {
            logger.warning("Rejected webhook with missing or invalid signature");
            return WebhookResult.rejected("Invalid signature");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Ignoring signed webhook with malformed body", e);
            return WebhookResult.ignored("Malformed body");
        }
        String transactionRef = text(json, "tx_ref");
        if (transactionRef == null) {
            transactionRef = text(json, "trx_ref");
        }
        if (transactionRef == null) {
            return WebhookResult.ignored("No transaction reference");
        }
        logger.log(Level.INFO, "Webhook for {0} reports {1}", new Object[] {transactionRef, text(json, "status")});

        Optional<ReconciliationResult> result = reconciler.verify(transactionRef);
        return result.isPresent() ? WebhookResult.reconciled(result.get()) : WebhookResult.pending(transactionRef);
    }

    private static String signature(Map<String, String> headers) {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            for (String name : SIGNATURE_HEADERS) {
                if (name.equalsIgnoreCase(header.getKey())) {
                    return header.getValue();
                }
            }
        }
        return null;
    }

    private static String text(JsonNode json, String field) {
        if (json == null || !json.hasNonNull(field)) {
            return null;
        }
        String value = json.get(field).asText();
        return value.isBlank() ? null : value;
    }
}
