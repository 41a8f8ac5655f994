package com.flagship.learning_platform.certificate;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Random;

/**
 * Produces numbers of the form {@code CERT-yyyyMMdd-XXXXXX}: the UTC issue
 * date followed by six random characters from A-Z and 0-9.
 *
 * Numbers are not unique by construction; uq_certificates_number decides.
 */
@Component
public class CertificateNumberGenerator {

    static final String PREFIX = "CERT-";
    static final int SUFFIX_LENGTH = 6;

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final Clock clock;
    private final Random random;

    public CertificateNumberGenerator() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    CertificateNumberGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    public String next() {
        StringBuilder number = new StringBuilder(PREFIX)
            .append(LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(DATE_FORMAT))
            .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            number.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return number.toString();
    }
}
