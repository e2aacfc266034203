package com.coursetrack.service.enrollment;

import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.payment.Payment;

/**
 * 수강신청 결과. 유료 강좌라면 결제 대기 건이 함께 만들어진다.
 */
public record EnrollmentResult(
        Enrollment enrollment,
        Payment payment
) {
}
