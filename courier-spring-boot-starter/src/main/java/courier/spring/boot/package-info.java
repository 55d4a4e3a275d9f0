/**
 * Spring Boot auto-configuration for courier.
 *
 * <p>{@link courier.spring.boot.CourierAutoConfiguration} wires a {@link courier.Courier} from
 * {@code courier.*} properties. {@link courier.spring.boot.CourierTravelAutoConfiguration} adds
 * the travel notification tasks and Chapa payment reconciliation, and
 * {@link courier.spring.boot.CourierMicrometerAutoConfiguration} exports metrics to Micrometer.
 *
 * <p>Use {@link courier.spring.boot.CourierTask @CourierTask} on handler beans to register
 * further tasks.
 *
 * @see courier.spring.boot.CourierProperties
 */
package courier.spring.boot;
