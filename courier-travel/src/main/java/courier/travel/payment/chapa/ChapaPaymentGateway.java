package courier.travel.payment.chapa;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import courier.travel.payment.GatewayException;
import courier.travel.payment.PaymentGateway;
import courier.travel.payment.PaymentStatus;
import courier.travel.payment.ProviderVerification;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chapa verification client: {@code GET {baseUrl}/transaction/verify/{tx_ref}} with a bearer
 * secret key.
 *
 * <p>Status mapping of {@code data.status}: {@code success} is confirmed; {@code failed},
 * {@code cancelled} and {@code reversed} are failed; anything else is still pending. A 404, or a
 * 400 whose message says the transaction is invalid or not found, means Chapa does not know the
 * reference and counts as failed. Every other error reply (401 and 403 from a wrong or rotated
 * key, 429, 5xx), unparseable replies and I/O errors raise {@link GatewayException}, so the
 * reference stays pending and is verified again later.
 */
public final class ChapaPaymentGateway implements PaymentGateway {
    private static final Logger logger = Logger.getLogger(ChapaPaymentGateway.class.getName());

    public static final String DEFAULT_BASE_URL = "https://api.chapa.co/v1";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String secretKey;
    private final Duration timeout;

    private ChapaPaymentGateway(Builder builder) {
        this.secretKey = Objects.requireNonNull(builder.secretKey, "secretKey");
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.timeout = builder.timeout;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ProviderVerification verify(String transactionRef) {
        Objects.requireNonNull(transactionRef, "transactionRef");
        URI uri = URI.create(baseUrl + "/transaction/verify/"
                + URLEncoder.encode(transactionRef, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Authorization", "Bearer " + secretKey)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new GatewayException("Chapa verification of " + transactionRef + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted while verifying " + transactionRef, e);
        }

        int code = response.statusCode();
        if (isUnknownTransaction(code, response.body())) {
            logger.log(Level.WARNING, "Chapa does not know transaction {0} (HTTP {1})",
                    new Object[] {transactionRef, code});
            return new ProviderVerification(transactionRef, PaymentStatus.FAILED, null, "http_" + code);
        }
        if (code == 401 || code == 403) {
            logger.log(Level.SEVERE, "Chapa rejected the secret key (HTTP {0}); {1} stays pending",
                    new Object[] {code, transactionRef});
            throw new GatewayException("Chapa rejected credentials with HTTP " + code + " for " + transactionRef);
        }
        if (code < 200 || code >= 300) {
            throw new GatewayException("Unexpected HTTP " + code + " from Chapa for " + transactionRef);
        }
        return parse(transactionRef, response.body());
    }

    private ProviderVerification parse(String transactionRef, String body) {
        JsonNode data;
        try {
            data = objectMapper.readTree(body).path("data");
        } catch (IOException e) {
            throw new GatewayException("Malformed Chapa response for " + transactionRef, e);
        }
        String rawStatus = data.path("status").asText("");
        String reference = data.hasNonNull("reference") ? data.get("reference").asText() : null;
        PaymentStatus status = mapStatus(rawStatus);
        logger.log(Level.FINE, "Chapa status for {0}: {1}", new Object[] {transactionRef, rawStatus});
        return new ProviderVerification(transactionRef, status, reference, rawStatus);
    }

    private boolean isUnknownTransaction(int code, String body) {
        if (code == 404) {
            return true;
        }
        if (code != 400 || body == null) {
            return false;
        }
        String message;
        try {
            message = objectMapper.readTree(body).path("message").asText("").toLowerCase(Locale.ROOT);
        } catch (IOException e) {
            return false;
        }
        return message.contains("not found") || message.contains("invalid transaction");
    }

    static PaymentStatus mapStatus(String rawStatus) {
        return switch (rawStatus.toLowerCase(Locale.ROOT)) {
            case "success" -> PaymentStatus.CONFIRMED;
            case "failed", "cancelled", "reversed" -> PaymentStatus.FAILED;
            default -> PaymentStatus.PENDING;
        };
    }

    private static String stripTrailingSlash(String url) {
        Objects.requireNonNull(url, "baseUrl");
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Builder for {@link ChapaPaymentGateway}.
     */
    public static final class Builder {
        private String secretKey;
        private String baseUrl = DEFAULT_BASE_URL;
        private Duration timeout = Duration.ofSeconds(30);
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        private Builder() {
        }

        /**
         * <b>Required.</b> Chapa secret key, sent as a bearer token.
         */
        public Builder secretKey(String secretKey) {
            this.secretKey = secretKey;
            return this;
        }

        /**
         * Optional. Defaults to {@code https://api.chapa.co/v1}.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        /**
         * Optional. Connect and request timeout. Defaults to 30 seconds.
         */
        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Optional. Defaults to a client with the configured connect timeout.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Optional. Defaults to a plain {@link ObjectMapper}.
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public ChapaPaymentGateway build() {
            return new ChapaPaymentGateway(this);
        }
    }
}
