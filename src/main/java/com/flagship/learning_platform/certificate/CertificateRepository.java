package com.flagship.learning_platform.certificate;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CertificateRepository extends JpaRepository<CertificateEntity, UUID> {

    Optional<CertificateEntity> findByUserIdAndCourseId(UUID userId, UUID courseId);

    Optional<CertificateEntity> findByCertificateNumber(String certificateNumber);

    List<CertificateEntity> findByUserIdOrderByIssuedAtDesc(UUID userId);

    long countByUserId(UUID userId);

    /**
     * Inserts a certificate unless one already exists for the (user, course)
     * pair or the number is taken. Returns the number of rows inserted.
     * A concurrent insert for the same pair blocks here until the other
     * transaction ends, then reports 0.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        INSERT INTO certificates (id, user_id, course_id, certificate_number, certificate_url, issued_at)
        VALUES (:id, :userId, :courseId, :number, :url, now())
        ON CONFLICT DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("userId") UUID userId,
                       @Param("courseId") UUID courseId,
                       @Param("number") String certificateNumber,
                       @Param("url") String certificateUrl);
}
