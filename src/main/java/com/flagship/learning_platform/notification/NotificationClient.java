package com.flagship.learning_platform.notification;

import java.util.Map;
import java.util.Optional;

/**
 * Outbound messaging provider.
 */
public interface NotificationClient {

    /**
     * Sends one templated message.
     *
     * @return the provider's message id, or empty when nothing was sent
     */
    Optional<String> send(String phone, NotificationTemplate template, Map<String, String> data);
}
