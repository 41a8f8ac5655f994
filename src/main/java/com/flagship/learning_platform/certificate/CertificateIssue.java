package com.flagship.learning_platform.certificate;

import lombok.Value;

/**
 * Certificate returned by an issue request, flagged with whether this request created it.
 */
@Value
public class CertificateIssue {
    Certificate certificate;
    boolean newlyIssued;
}
