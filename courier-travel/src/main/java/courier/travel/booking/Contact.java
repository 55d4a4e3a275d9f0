package courier.travel.booking;

import java.util.Objects;

/**
 * Person attached to a booking: the guest or the listing's host.
 *
 * @param firstName first name
 * @param lastName  last name
 * @param email     email address
 * @param phone     phone number, or {@code null} if unknown
 */
public record Contact(String firstName, String lastName, String email, String phone) {

    public Contact {
        Objects.requireNonNull(firstName, "firstName");
        Objects.requireNonNull(lastName, "lastName");
        Objects.requireNonNull(email, "email");
    }

    public String fullName() {
        return (firstName + " " + lastName).trim();
    }
}
