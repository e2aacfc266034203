package com.coursetrack.service.payment;

import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.enrollment.EnrollmentRepository;
import com.coursetrack.domain.payment.Payment;
import com.coursetrack.domain.payment.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 결제 결과 반영. 결제 확인 시 PENDING 수강이 ACTIVE로 전이된다.
 * 결제 상태 변경은 항상 해당 Enrollment 락을 잡은 뒤에 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final EnrollmentRepository enrollmentRepository;

    @Transactional
    public Payment confirm(LearnerPrincipal principal, Long paymentId) {
        Enrollment enrollment = lockEnrollmentOf(principal, paymentId);
        Payment payment = paymentRepository.findByIdAndTenantId(paymentId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));

        LocalDateTime now = LocalDateTime.now();
        payment.complete(now);
        enrollment.activate(now);

        log.info("결제 확인: paymentId={}, enrollmentId={}", paymentId, enrollment.getId());
        return payment;
    }

    /**
     * 결제 실패를 기록한다. 수강은 PENDING으로 남으며, 학습자가 철회한 뒤 다시 신청하면 새 결제 건이 만들어진다.
     */
    @Transactional
    public Payment fail(LearnerPrincipal principal, Long paymentId) {
        Enrollment enrollment = lockEnrollmentOf(principal, paymentId);
        Payment payment = paymentRepository.findByIdAndTenantId(paymentId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));

        payment.fail();

        log.info("결제 실패: paymentId={}, enrollmentId={}", paymentId, enrollment.getId());
        return payment;
    }

    private Enrollment lockEnrollmentOf(LearnerPrincipal principal, Long paymentId) {
        Long enrollmentId = paymentRepository.findEnrollmentId(paymentId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));

        return enrollmentRepository.findByIdAndTenantIdWithLock(enrollmentId, principal.tenantId())
                .filter(e -> principal.isAdmin() || e.isOwnedBy(principal.learnerId()))
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));
    }
}
