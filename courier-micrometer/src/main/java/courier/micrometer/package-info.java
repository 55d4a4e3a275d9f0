/**
 * Micrometer bridge for {@link courier.spi.MetricsExporter}.
 */
package courier.micrometer;
