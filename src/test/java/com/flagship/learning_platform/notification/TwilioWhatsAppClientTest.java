package com.flagship.learning_platform.notification;

import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.exception.ExternalServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TwilioWhatsAppClientTest {

    private static final String MESSAGES_URL = "https://api.twilio.test/2010-04-01/Accounts/AC123/Messages.json";

    private MockRestServiceServer server;
    private TwilioWhatsAppClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        LearningProperties.Twilio twilio = new LearningProperties.Twilio();
        twilio.setAccountSid("AC123");
        twilio.setAuthToken("token");
        twilio.setFromNumber("+14155238886");
        twilio.setBaseUrl("https://api.twilio.test");
        client = new TwilioWhatsAppClient(restTemplate, twilio);
    }

    private Map<String, String> reminderData() {
        return Map.of(
            NotificationTemplate.USER_NAME, "Kiran",
            NotificationTemplate.EVENT_TITLE, "Kafka Workshop",
            NotificationTemplate.EVENT_TIME, "Thu 10 Jan, 18:30");
    }

    @Test
    @DisplayName("Posts a form to the Messages API and returns the message sid")
    void send() {
        server.expect(requestTo(MESSAGES_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
            .andExpect(content().string(containsString("From=whatsapp%3A%2B14155238886")))
            .andExpect(content().string(containsString("To=whatsapp%3A%2B919800000009")))
            .andRespond(withSuccess("{\"sid\": \"SM42\", \"status\": \"queued\"}", MediaType.APPLICATION_JSON));

        Optional<String> sid = client.send("+919800000009", NotificationTemplate.EVENT_REMINDER, reminderData());

        assertEquals(Optional.of("SM42"), sid);
        server.verify();
    }

    @Test
    @DisplayName("Provider errors surface as external service failures")
    void providerError() {
        server.expect(requestTo(MESSAGES_URL)).andRespond(withServerError());

        ExternalServiceException e = assertThrows(ExternalServiceException.class,
            () -> client.send("+919800000009", NotificationTemplate.EVENT_REMINDER, reminderData()));
        assertEquals("twilio", e.getService());
    }

    @Test
    @DisplayName("Numbers already in WhatsApp form are left alone")
    void whatsappPrefix() {
        assertEquals("whatsapp:+91980", TwilioWhatsAppClient.whatsapp("+91980"));
        assertEquals("whatsapp:+91980", TwilioWhatsAppClient.whatsapp("whatsapp:+91980"));
    }
}
