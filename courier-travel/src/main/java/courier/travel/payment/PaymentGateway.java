package courier.travel.payment;

/**
 * Verification side of an external payment provider.
 *
 * @see courier.travel.payment.chapa.ChapaPaymentGateway
 */
public interface PaymentGateway {

    /**
     * Asks the provider for the current state of a transaction.
     *
     * @param transactionRef reference sent to the provider when the payment was initialized
     * @return the provider's answer
     * @throws GatewayException if the provider could not be reached or answered with an error
     *                          that says nothing about the transaction
     */
    ProviderVerification verify(String transactionRef);
}
