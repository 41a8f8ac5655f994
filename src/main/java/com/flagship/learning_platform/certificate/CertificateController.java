package com.flagship.learning_platform.certificate;

import com.flagship.learning_platform.certificate.dto.CertificateResponse;
import com.flagship.learning_platform.certificate.dto.CertificateVerificationResponse;
import com.flagship.learning_platform.certificate.dto.GenerateCertificateResponse;
import com.flagship.learning_platform.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/certificates")
@RequiredArgsConstructor
@Slf4j
public class CertificateController {

    private final CertificateIssuer certificateIssuer;

    /**
     * Issues the certificate for a completed course. Repeating the call
     * returns the stored certificate with 200 instead of 201.
     */
    @PostMapping("/generate/{courseId}")
    public ResponseEntity<GenerateCertificateResponse> generate(
            @PathVariable("courseId") UUID courseId,
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        CertificateIssue issue = certificateIssuer.issue(userId, courseId);
        HttpStatus status = issue.isNewlyIssued() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(GenerateCertificateResponse.from(issue));
    }

    @GetMapping("/my-certificates")
    public ResponseEntity<List<CertificateResponse>> myCertificates(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        return ResponseEntity.ok(certificateIssuer.listForUser(userId).stream()
            .map(CertificateResponse::from)
            .toList());
    }

    @GetMapping("/verify/{certificateNumber}")
    public ResponseEntity<CertificateVerificationResponse> verify(
            @PathVariable("certificateNumber") String certificateNumber) {

        log.info("Certificate verification requested: {}", certificateNumber);
        return ResponseEntity.ok(CertificateVerificationResponse.from(certificateIssuer.verify(certificateNumber)));
    }
}
