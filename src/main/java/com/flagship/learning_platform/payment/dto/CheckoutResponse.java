package com.flagship.learning_platform.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.payment.Checkout;
import com.flagship.learning_platform.payment.Payment;
import com.flagship.learning_platform.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * What the client needs to open the gateway checkout widget.
 */
@Value
@Builder
public class CheckoutResponse {

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("order_id")
    String orderId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("razorpay_key")
    String razorpayKey;

    public static CheckoutResponse from(Checkout checkout, String razorpayKey) {
        Payment payment = checkout.getPayment();
        return CheckoutResponse.builder()
            .paymentId(payment.getId())
            .orderId(checkout.getOrderId())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .paymentMethod(payment.getPaymentMethod())
            .status(payment.getStatus())
            .razorpayKey(razorpayKey)
            .build();
    }
}
