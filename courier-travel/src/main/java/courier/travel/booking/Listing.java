package courier.travel.booking;

import java.util.Objects;

/**
 * @param name     property name shown to guests
 * @param location free-form location
 * @param host     the listing's host
 */
public record Listing(String name, String location, Contact host) {

    public Listing {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(host, "host");
    }
}
