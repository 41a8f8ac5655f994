package com.flagship.learning_platform.certificate;

import lombok.Value;

@Value
public class CertificateSummary {
    Certificate certificate;
    String courseTitle;
}
