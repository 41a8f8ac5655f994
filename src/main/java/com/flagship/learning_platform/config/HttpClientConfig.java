package com.flagship.learning_platform.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

/**
 * Outbound HTTP clients. Every client has a connect and read timeout so a slow
 * provider cannot hold a request thread (or a consumer thread) indefinitely.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestTemplate razorpayRestTemplate(RestTemplateBuilder builder, LearningProperties properties) {
        LearningProperties.Razorpay razorpay = properties.getGateway().getRazorpay();
        RestTemplateBuilder configured = withTimeout(builder, razorpay.getTimeout());
        if (hasText(razorpay.getKeyId()) && hasText(razorpay.getKeySecret())) {
            configured = configured.basicAuthentication(razorpay.getKeyId(), razorpay.getKeySecret());
        } else {
            log.warn("Razorpay credentials not configured; checkout will fail at the gateway");
        }
        return configured.build();
    }

    @Bean
    public RestTemplate twilioRestTemplate(RestTemplateBuilder builder, LearningProperties properties) {
        LearningProperties.Twilio twilio = properties.getNotification().getTwilio();
        RestTemplateBuilder configured = withTimeout(builder, twilio.getTimeout());
        if (twilio.isConfigured()) {
            configured = configured.basicAuthentication(twilio.getAccountSid(), twilio.getAuthToken());
        }
        return configured.build();
    }

    private RestTemplateBuilder withTimeout(RestTemplateBuilder builder, Duration timeout) {
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .additionalInterceptors(new LoggingInterceptor());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    static class LoggingInterceptor implements ClientHttpRequestInterceptor {

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body,
                                            ClientHttpRequestExecution execution) throws IOException {
            long startTime = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("HTTP {} {} -> {} in {}ms",
                    request.getMethod(), request.getURI(), response.getStatusCode(),
                    System.currentTimeMillis() - startTime);
            return response;
        }
    }
}
