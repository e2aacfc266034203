package com.coursetrack.domain.payment;

import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.enrollment.Enrollment;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "payments",
        indexes = @Index(name = "idx_payment_enrollment_id", columnList = "enrollment_id"))
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "enrollment_id", nullable = false)
    private Enrollment enrollment;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    public static Payment pending(Enrollment enrollment, BigDecimal amount, String currency, LocalDateTime now) {
        return Payment.builder()
                .tenantId(enrollment.getTenantId())
                .enrollment(enrollment)
                .amount(amount)
                .currency(currency)
                .status(PaymentStatus.PENDING)
                .createdAt(now)
                .build();
    }

    public void complete(LocalDateTime now) {
        requirePending();
        this.status = PaymentStatus.COMPLETED;
        this.completedAt = now;
    }

    public void fail() {
        requirePending();
        this.status = PaymentStatus.FAILED;
    }

    private void requirePending() {
        if (status != PaymentStatus.PENDING) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_PENDING);
        }
    }
}
