package com.flagship.learning_platform.notification;

import com.flagship.learning_platform.config.LearningProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@Slf4j
public class NotificationConfig {

    @Bean
    public NotificationClient notificationClient(LearningProperties properties,
                                                 @Qualifier("twilioRestTemplate") RestTemplate twilioRestTemplate) {
        LearningProperties.Twilio twilio = properties.getNotification().getTwilio();
        if (!twilio.isConfigured()) {
            log.warn("Twilio credentials not found. WhatsApp messaging will be disabled.");
            return new DisabledNotificationClient();
        }
        return new TwilioWhatsAppClient(twilioRestTemplate, twilio);
    }
}
