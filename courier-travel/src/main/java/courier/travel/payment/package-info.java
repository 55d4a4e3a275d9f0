/**
 * Payment reconciliation: provider verification, per-reference terminal records and the
 * notified marker that keeps duplicate webhooks from enqueueing duplicate emails.
 */
package courier.travel.payment;
