/**
 * Travel booking side effects running on courier: booking and payment emails, and payment
 * reconciliation against the provider.
 *
 * <p>{@link courier.travel.TravelNotifications} wires the handlers into a registry;
 * {@link courier.travel.payment.PaymentReconciler} turns provider verifications and webhooks
 * into exactly one notification per transaction.
 */
package courier.travel;
