package com.flagship.learning_platform.payment.gateway;

import com.flagship.learning_platform.exception.ExternalServiceException;

import java.math.BigDecimal;

/**
 * Contract with the card/UPI payment provider.
 */
public interface PaymentGateway {

    /**
     * Creates an order the client pays against.
     *
     * @throws ExternalServiceException if the provider cannot be reached or rejects the request
     */
    GatewayOrder createOrder(BigDecimal amount, String currency, String receipt);

    /**
     * Confirms that {@code signature} was issued by the provider for this order and payment.
     *
     * @throws PaymentVerificationException if it was not
     */
    void verifySignature(String orderId, String gatewayPaymentId, String signature);
}
