package com.flagship.learning_platform.certificate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CertificateNumberGeneratorTest {

    @Test
    @DisplayName("Number carries the UTC issue date and six alphanumeric characters")
    void format() {
        // 23:30 in UTC is already the next day in Kolkata
        Clock clock = Clock.fixed(Instant.parse("2024-05-31T23:30:00Z"), ZoneId.of("Asia/Kolkata"));
        CertificateNumberGenerator generator = new CertificateNumberGenerator(clock, new Random(42));

        String number = generator.next();

        assertTrue(number.startsWith("CERT-20240531-"), number);
        assertTrue(number.matches("CERT-\\d{8}-[A-Z0-9]{6}"), number);
    }

    @Test
    @DisplayName("Same seed gives the same suffix, different draws differ")
    void randomSuffix() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneId.of("UTC"));

        String first = new CertificateNumberGenerator(clock, new Random(7)).next();
        String again = new CertificateNumberGenerator(clock, new Random(7)).next();
        assertEquals(first, again);

        CertificateNumberGenerator generator = new CertificateNumberGenerator(clock, new Random(7));
        assertNotEquals(generator.next(), generator.next());
    }
}
