/**
 * Service provider interfaces: broker transport, delayed redelivery, transaction hooks and
 * metrics.
 */
package courier.spi;
