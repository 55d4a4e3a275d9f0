package courier.travel.payment;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookSignatureVerifierTest {
    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("key");
    private final byte[] body = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);

    @Test
    void signsWithHmacSha256() {
        assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8", verifier.sign(body));
    }

    @Test
    void acceptsMatchingSignatureInAnyCase() {
        String signature = verifier.sign(body);

        assertTrue(verifier.verify(body, signature));
        assertTrue(verifier.verify(body, " " + signature.toUpperCase(Locale.ROOT) + " "));
    }

    @Test
    void rejectsTamperedBodyOrWrongKey() {
        String signature = verifier.sign(body);

        assertFalse(verifier.verify("tampered".getBytes(StandardCharsets.UTF_8), signature));
        assertFalse(new WebhookSignatureVerifier("other").verify(body, signature));
    }

    @Test
    void rejectsMissingSignature() {
        assertFalse(verifier.verify(body, null));
        assertFalse(verifier.verify(body, ""));
        assertFalse(verifier.verify(null, "abc"));
    }

    @Test
    void emptySecretIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WebhookSignatureVerifier(""));
    }
}
