package com.flagship.learning_platform.payment.gateway;

import lombok.Value;

import java.math.BigDecimal;

/**
 * An order created at the gateway. {@code orderId} becomes the payment's transaction id.
 */
@Value
public class GatewayOrder {
    String orderId;
    BigDecimal amount;
    String currency;
    String receipt;
}
