package courier.travel.payment;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transaction references of the form {@code booking-<bookingId>-<8 hex digits>}.
 *
 * <p>The booking id is embedded so that a webhook for a payment the system of record has lost
 * can still be attributed.
 */
public final class TransactionRefs {
    private static final Pattern REF = Pattern.compile("^booking-(.+)-([0-9a-f]{8})$");
    private static final SecureRandom RANDOM = new SecureRandom();

    private TransactionRefs() {
    }

    public static String generate(String bookingId) {
        Objects.requireNonNull(bookingId, "bookingId");
        if (bookingId.isBlank()) {
            throw new IllegalArgumentException("bookingId must not be blank");
        }
        byte[] suffix = new byte[4];
        RANDOM.nextBytes(suffix);
        return "booking-" + bookingId + "-" + HexFormat.of().formatHex(suffix);
    }

    /**
     * Extracts the booking id from a reference produced by {@link #generate(String)}.
     *
     * @return the booking id, or empty if the reference has another shape
     */
    public static Optional<String> bookingIdOf(String transactionRef) {
        if (transactionRef == null) {
            return Optional.empty();
        }
        Matcher m = REF.matcher(transactionRef);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
