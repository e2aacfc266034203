package com.coursetrack.service.payment;

import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.enrollment.EnrollmentRepository;
import com.coursetrack.domain.enrollment.EnrollmentStatus;
import com.coursetrack.domain.learner.LearnerRole;
import com.coursetrack.domain.payment.Payment;
import com.coursetrack.domain.payment.PaymentStatus;
import com.coursetrack.domain.tenant.Tenant;
import com.coursetrack.service.enrollment.EnrollmentResult;
import com.coursetrack.service.enrollment.EnrollmentService;
import com.coursetrack.support.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestDataFactory.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class PaymentServiceTest {

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private EnrollmentService enrollmentService;

    @Autowired
    private EnrollmentRepository enrollmentRepository;

    @Autowired
    private TestDataFactory factory;

    private Tenant tenant;
    private LearnerPrincipal learner;
    private Course course;
    private EnrollmentResult pending;

    @BeforeEach
    void setUp() {
        tenant = factory.tenant();
        learner = factory.principal(factory.learner(tenant, LearnerRole.LEARNER));
        course = factory.paidCourse(tenant, factory.learner(tenant, LearnerRole.INSTRUCTOR));
        pending = enrollmentService.enroll(learner, course.getId());
    }

    @Test
    @DisplayName("결제 확인 시 결제는 COMPLETED, 수강은 ACTIVE")
    void confirm_activatesEnrollment() {
        Payment payment = paymentService.confirm(learner, pending.payment().getId());

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(payment.getCompletedAt()).isNotNull();
        assertThat(enrollmentRepository.findById(pending.enrollment().getId()).orElseThrow().getStatus())
                .isEqualTo(EnrollmentStatus.ACTIVE);
    }

    @Test
    @DisplayName("이미 확인된 결제를 다시 확인하면 PAYMENT_NOT_PENDING 예외")
    void confirm_twice() {
        paymentService.confirm(learner, pending.payment().getId());

        assertThatThrownBy(() -> paymentService.confirm(learner, pending.payment().getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.PAYMENT_NOT_PENDING));
    }

    @Test
    @DisplayName("결제 실패 시 수강은 PENDING으로 남고, 철회 후 재신청하면 새 결제 건이 생긴다")
    void fail_thenReEnroll() {
        Payment failed = paymentService.fail(learner, pending.payment().getId());

        assertThat(failed.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(enrollmentRepository.findById(pending.enrollment().getId()).orElseThrow().getStatus())
                .isEqualTo(EnrollmentStatus.PENDING);

        assertThatThrownBy(() -> paymentService.confirm(learner, pending.payment().getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.PAYMENT_NOT_PENDING));

        enrollmentService.withdraw(learner, pending.enrollment().getId());
        EnrollmentResult retry = enrollmentService.enroll(learner, course.getId());

        assertThat(retry.payment().getId()).isNotEqualTo(pending.payment().getId());
        assertThat(retry.enrollment().getStatus()).isEqualTo(EnrollmentStatus.PENDING);
    }

    @Test
    @DisplayName("다른 학습자의 결제는 찾을 수 없다")
    void confirm_notOwner() {
        LearnerPrincipal another = factory.principal(factory.learner(tenant, LearnerRole.LEARNER));

        assertThatThrownBy(() -> paymentService.confirm(another, pending.payment().getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.PAYMENT_NOT_FOUND));
    }

    @Test
    @DisplayName("관리자는 테넌트 내 결제를 확인할 수 있다")
    void confirm_byAdmin() {
        LearnerPrincipal admin = factory.principal(factory.learner(tenant, LearnerRole.ADMIN));

        Payment payment = paymentService.confirm(admin, pending.payment().getId());

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
    }

    @Test
    @DisplayName("결제 대기 중 철회된 수강의 결제는 확인할 수 없다")
    void confirm_afterWithdrawal() {
        enrollmentService.withdraw(learner, pending.enrollment().getId());

        assertThatThrownBy(() -> paymentService.confirm(learner, pending.payment().getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_ENROLLMENT_STATE));
    }
}
