/**
 * Chapa payment provider: verification client and webhook entry point.
 */
package courier.travel.payment.chapa;
