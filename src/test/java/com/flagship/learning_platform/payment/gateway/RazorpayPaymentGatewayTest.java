package com.flagship.learning_platform.payment.gateway;

import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.exception.ExternalServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RazorpayPaymentGatewayTest {

    private static final String SECRET = "rzp_secret";

    private MockRestServiceServer server;
    private RazorpayPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        LearningProperties properties = new LearningProperties();
        properties.getGateway().getRazorpay().setKeyId("rzp_test_key");
        properties.getGateway().getRazorpay().setKeySecret(SECRET);
        properties.getGateway().getRazorpay().setBaseUrl("https://api.razorpay.test");
        gateway = new RazorpayPaymentGateway(restTemplate, properties);
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("Sends the amount in paise and returns the order id")
        void createOrder() {
            server.expect(requestTo("https://api.razorpay.test/v1/orders"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.amount").value(149950))
                .andExpect(jsonPath("$.currency").value("INR"))
                .andExpect(jsonPath("$.receipt").value("rcpt_1"))
                .andRespond(withSuccess("{\"id\": \"order_Abc\", \"status\": \"created\"}", MediaType.APPLICATION_JSON));

            GatewayOrder order = gateway.createOrder(new BigDecimal("1499.50"), "INR", "rcpt_1");

            assertEquals("order_Abc", order.getOrderId());
            assertEquals(new BigDecimal("1499.50"), order.getAmount());
            server.verify();
        }

        @Test
        @DisplayName("A rejected order is an external service failure")
        void rejected() {
            server.expect(requestTo("https://api.razorpay.test/v1/orders")).andRespond(withBadRequest());

            ExternalServiceException e = assertThrows(ExternalServiceException.class,
                () -> gateway.createOrder(BigDecimal.TEN, "INR", "rcpt_2"));
            assertTrue(e.getMessage().startsWith("Payment initialization failed"));
        }

        @Test
        @DisplayName("A response without an id is an external service failure")
        void missingId() {
            server.expect(requestTo("https://api.razorpay.test/v1/orders"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            assertThrows(ExternalServiceException.class, () -> gateway.createOrder(BigDecimal.TEN, "INR", "rcpt_3"));
        }
    }

    @Nested
    @DisplayName("Signatures")
    class Signatures {

        @Test
        @DisplayName("Accepts the HMAC of order and payment id")
        void valid() {
            String signature = RazorpayPaymentGateway.sign(SECRET, "order_1|pay_1");

            assertDoesNotThrow(() -> gateway.verifySignature("order_1", "pay_1", signature));
        }

        @Test
        @DisplayName("Rejects a signature for another payment")
        void otherPayment() {
            String signature = RazorpayPaymentGateway.sign(SECRET, "order_1|pay_2");

            assertThrows(PaymentVerificationException.class,
                () -> gateway.verifySignature("order_1", "pay_1", signature));
        }

        @Test
        @DisplayName("Rejects blank inputs")
        void blank() {
            assertThrows(PaymentVerificationException.class, () -> gateway.verifySignature("order_1", "pay_1", ""));
        }

        @Test
        @DisplayName("Signature is lower case hex SHA-256")
        void hex() {
            assertTrue(RazorpayPaymentGateway.sign(SECRET, "a|b").matches("[0-9a-f]{64}"));
        }
    }

    @Test
    @DisplayName("Subunit conversion rounds half up")
    void toSubunits() {
        assertEquals(79900L, RazorpayPaymentGateway.toSubunits(new BigDecimal("799")));
        assertEquals(101L, RazorpayPaymentGateway.toSubunits(new BigDecimal("1.005")));
    }
}
