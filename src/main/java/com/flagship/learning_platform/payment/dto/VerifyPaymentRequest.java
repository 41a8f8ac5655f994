package com.flagship.learning_platform.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class VerifyPaymentRequest {

    @NotBlank(message = "Order id is required")
    @JsonProperty("razorpay_order_id")
    String orderId;

    @NotBlank(message = "Payment id is required")
    @JsonProperty("razorpay_payment_id")
    String gatewayPaymentId;

    @NotBlank(message = "Signature is required")
    @JsonProperty("razorpay_signature")
    String signature;
}
