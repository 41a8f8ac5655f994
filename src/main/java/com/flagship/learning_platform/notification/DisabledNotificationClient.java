package com.flagship.learning_platform.notification;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Used when no messaging credentials are configured.
 */
@Slf4j
public class DisabledNotificationClient implements NotificationClient {

    @Override
    public Optional<String> send(String phone, NotificationTemplate template, Map<String, String> data) {
        log.warn("WhatsApp messaging disabled, dropping {} message", template);
        return Optional.empty();
    }
}
