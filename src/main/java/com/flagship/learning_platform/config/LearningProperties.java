package com.flagship.learning_platform.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Typed view over the {@code learning.*} keys in application.yml.
 */
@ConfigurationProperties(prefix = "learning")
@Getter
@Setter
public class LearningProperties {

    private Certificate certificate = new Certificate();
    private Payment payment = new Payment();
    private Gateway gateway = new Gateway();
    private Notification notification = new Notification();

    @Getter
    @Setter
    public static class Certificate {
        private String baseUrl = "https://certificates.lotplatform.com";
        private Badge firstBadge = new Badge();
    }

    @Getter
    @Setter
    public static class Badge {
        private String name = "First Course Complete";
        private String description = "Completed your first course";
        private String icon = "trophy";
    }

    @Getter
    @Setter
    public static class Payment {
        private String currency = "INR";
    }

    @Getter
    @Setter
    public static class Gateway {
        private Razorpay razorpay = new Razorpay();
    }

    @Getter
    @Setter
    public static class Razorpay {
        private String keyId;
        private String keySecret;
        private String baseUrl = "https://api.razorpay.com";
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Notification {
        private String dashboardUrl = "https://lotplatform.com/dashboard";
        /** Zone the zoneless event date and time columns are written in. */
        private ZoneId eventTimeZone = ZoneId.of("Asia/Kolkata");
        private Twilio twilio = new Twilio();
    }

    @Getter
    @Setter
    public static class Twilio {
        private String accountSid;
        private String authToken;
        private String fromNumber;
        private String baseUrl = "https://api.twilio.com";
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isConfigured() {
            return hasText(accountSid) && hasText(authToken) && hasText(fromNumber);
        }

        private static boolean hasText(String value) {
            return value != null && !value.isBlank();
        }
    }
}
