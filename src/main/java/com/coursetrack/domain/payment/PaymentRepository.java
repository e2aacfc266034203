package com.coursetrack.domain.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByIdAndTenantId(Long id, Long tenantId);

    @Query("SELECT p.enrollment.id FROM Payment p WHERE p.id = :id AND p.tenantId = :tenantId")
    Optional<Long> findEnrollmentId(@Param("id") Long id, @Param("tenantId") Long tenantId);
}
