package com.flagship.learning_platform.payment.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Razorpay orders API and checkout signature check.
 *
 * Amounts go to Razorpay in the smallest currency unit (paise). The checkout
 * signature is HMAC-SHA256 over {@code orderId|paymentId} keyed with the API
 * secret, hex encoded.
 */
@Component
@Slf4j
public class RazorpayPaymentGateway implements PaymentGateway {

    static final String SERVICE = "razorpay";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final RestTemplate restTemplate;
    private final LearningProperties.Razorpay config;

    public RazorpayPaymentGateway(@Qualifier("razorpayRestTemplate") RestTemplate restTemplate,
                                  LearningProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getGateway().getRazorpay();
    }

    @Override
    public GatewayOrder createOrder(BigDecimal amount, String currency, String receipt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", toSubunits(amount));
        body.put("currency", currency);
        body.put("receipt", receipt);
        body.put("payment_capture", 1);

        JsonNode response;
        try {
            response = restTemplate.postForObject(config.getBaseUrl() + "/v1/orders", body, JsonNode.class);
        } catch (RestClientException e) {
            log.error("Razorpay order creation failed: receipt={}, error={}", receipt, e.getMessage());
            throw new ExternalServiceException(SERVICE, "Payment initialization failed: " + e.getMessage(), e);
        }

        if (response == null || !response.hasNonNull("id")) {
            throw new ExternalServiceException(SERVICE, "Payment initialization failed: order id missing in response");
        }

        String orderId = response.get("id").asText();
        log.info("Created Razorpay order {} for receipt {}", orderId, receipt);
        return new GatewayOrder(orderId, amount, currency, receipt);
    }

    @Override
    public void verifySignature(String orderId, String gatewayPaymentId, String signature) {
        if (isBlank(orderId) || isBlank(gatewayPaymentId) || isBlank(signature)) {
            throw new PaymentVerificationException("Order id, payment id and signature are required");
        }
        if (isBlank(config.getKeySecret())) {
            throw new ExternalServiceException(SERVICE, "Razorpay key secret is not configured");
        }

        String expected = sign(config.getKeySecret(), orderId + "|" + gatewayPaymentId);
        boolean matches = MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            signature.getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            throw new PaymentVerificationException("Invalid payment signature for order " + orderId);
        }
    }

    static String sign(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    static long toSubunits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
