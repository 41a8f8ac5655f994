package com.flagship.learning_platform.payment;

import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.observability.CorrelationContext;
import com.flagship.learning_platform.payment.dto.CheckoutRequest;
import com.flagship.learning_platform.payment.dto.CheckoutResponse;
import com.flagship.learning_platform.payment.dto.PaymentResponse;
import com.flagship.learning_platform.payment.dto.TransactionsResponse;
import com.flagship.learning_platform.payment.dto.VerifyPaymentRequest;
import com.flagship.learning_platform.payment.dto.VerifyPaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Checkout and verification of course and event payments.
 *
 * Checkout requires an Idempotency-Key header; repeating it returns the
 * original payment with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PaymentCheckoutService checkoutService;
    private final PaymentCompletionService completionService;
    private final PaymentService paymentService;
    private final LearningProperties properties;

    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResponse> checkout(
            @Valid @RequestBody CheckoutRequest request,
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Checkout request: idempotencyKey={}, courseId={}, eventId={}",
                idempotencyKey, request.getCourseId(), request.getEventId());

        Checkout checkout = checkoutService.checkout(
            userId,
            request.getCourseId(),
            request.getEventId(),
            request.getAmount(),
            request.getPaymentMethod(),
            idempotencyKey
        );

        HttpStatus status = checkout.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status)
            .body(CheckoutResponse.from(checkout, properties.getGateway().getRazorpay().getKeyId()));
    }

    @PostMapping("/verify")
    public ResponseEntity<VerifyPaymentResponse> verify(
            @Valid @RequestBody VerifyPaymentRequest request,
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        log.info("Payment verification for order {}", request.getOrderId());

        PaymentCompletion completion = completionService.completePayment(
            userId, request.getOrderId(), request.getGatewayPaymentId(), request.getSignature());
        return ResponseEntity.ok(VerifyPaymentResponse.from(completion));
    }

    @GetMapping("/transactions")
    public ResponseEntity<TransactionsResponse> transactions(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        return ResponseEntity.ok(TransactionsResponse.of(paymentService.listTransactions(userId).stream()
            .map(PaymentResponse::from)
            .toList()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(
            @PathVariable("id") UUID id,
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        return ResponseEntity.ok(PaymentResponse.from(paymentService.getPayment(userId, id)));
    }
}
