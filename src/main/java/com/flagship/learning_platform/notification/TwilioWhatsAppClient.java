package com.flagship.learning_platform.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Optional;

/**
 * Sends WhatsApp messages through the Twilio Messages API
 * ({@code POST /2010-04-01/Accounts/{sid}/Messages.json}, form encoded).
 * Authentication and timeouts come with the injected RestTemplate.
 */
@Slf4j
public class TwilioWhatsAppClient implements NotificationClient {

    static final String SERVICE = "twilio";
    static final String WHATSAPP_PREFIX = "whatsapp:";

    private final RestTemplate restTemplate;
    private final LearningProperties.Twilio config;

    public TwilioWhatsAppClient(RestTemplate restTemplate, LearningProperties.Twilio config) {
        this.restTemplate = restTemplate;
        this.config = config;
    }

    /**
     * @throws ExternalServiceException if Twilio cannot be reached or rejects the message
     */
    @Override
    public Optional<String> send(String phone, NotificationTemplate template, Map<String, String> data) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", whatsapp(config.getFromNumber()));
        form.add("To", whatsapp(phone));
        form.add("Body", template.render(data));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        String url = config.getBaseUrl() + "/2010-04-01/Accounts/" + config.getAccountSid() + "/Messages.json";
        JsonNode response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(form, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException(SERVICE, "Failed to send WhatsApp message: " + e.getMessage(), e);
        }

        Optional<String> sid = Optional.ofNullable(response)
            .map(body -> body.get("sid"))
            .map(JsonNode::asText);
        sid.ifPresent(id -> log.info("WhatsApp {} message sent: {}", template, id));
        return sid;
    }

    static String whatsapp(String phone) {
        return phone.startsWith(WHATSAPP_PREFIX) ? phone : WHATSAPP_PREFIX + phone;
    }
}
