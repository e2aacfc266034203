package com.coursetrack.service.enrollment;

import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.course.CourseRepository;
import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.enrollment.EnrollmentRepository;
import com.coursetrack.domain.enrollment.EnrollmentStatus;
import com.coursetrack.domain.learner.Learner;
import com.coursetrack.domain.learner.LearnerRepository;
import com.coursetrack.domain.payment.Payment;
import com.coursetrack.domain.payment.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnrollmentService {

    private final EnrollmentRepository enrollmentRepository;
    private final LearnerRepository learnerRepository;
    private final CourseRepository courseRepository;
    private final PaymentRepository paymentRepository;

    @Transactional(readOnly = true)
    public List<Enrollment> findMine(LearnerPrincipal principal) {
        return enrollmentRepository.findByLearner(principal.tenantId(), principal.learnerId());
    }

    @Transactional
    public EnrollmentResult enroll(LearnerPrincipal principal, Long courseId) {
        // 1. Learner 비관적 락 획득 (같은 학습자의 동시 신청 직렬화)
        Learner learner = learnerRepository.findByIdAndTenantIdWithLock(principal.learnerId(), principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.LEARNER_NOT_FOUND));

        // 2. Course 비관적 락 획득 (락 순서: Learner → Course)
        Course course = courseRepository.findByIdAndTenantIdWithLock(courseId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));

        // 3. 공개 여부 검증
        if (!course.isPublished()) {
            throw new BusinessException(ErrorCode.COURSE_NOT_PUBLISHED);
        }

        // 4. 진행 중(PENDING/ACTIVE) 수강 중복 검증. 완료/철회 후 재신청은 새 기록으로 허용
        long open = enrollmentRepository.countByLearnerAndCourse(
                principal.tenantId(), learner.getId(), courseId, EnrollmentStatus.OPEN);
        if (open > 0) {
            throw new BusinessException(ErrorCode.DUPLICATE_ENROLLMENT);
        }

        // 5. 정원 검증
        if (course.getMaxStudents() != null
                && enrollmentRepository.countByCourse(principal.tenantId(), courseId, EnrollmentStatus.SEAT_HOLDING) >= course.getMaxStudents()) {
            throw new BusinessException(ErrorCode.CAPACITY_EXCEEDED);
        }

        // 6. Enrollment 저장 (유료 강좌는 결제 대기 건 생성)
        LocalDateTime now = LocalDateTime.now();
        Enrollment enrollment = enrollmentRepository.save(Enrollment.open(learner, course, now));
        Payment payment = null;
        if (enrollment.getStatus() == EnrollmentStatus.PENDING) {
            payment = paymentRepository.save(Payment.pending(enrollment, course.getPrice(), course.getCurrency(), now));
        }

        log.info("수강신청: enrollmentId={}, learnerId={}, courseId={}, status={}",
                enrollment.getId(), learner.getId(), courseId, enrollment.getStatus());
        return new EnrollmentResult(enrollment, payment);
    }

    @Transactional
    public Enrollment withdraw(LearnerPrincipal principal, Long enrollmentId) {
        Enrollment enrollment = enrollmentRepository.findByIdAndTenantIdWithLock(enrollmentId, principal.tenantId())
                .filter(e -> e.isOwnedBy(principal.learnerId()))
                .orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_NOT_FOUND));

        enrollment.withdraw(LocalDateTime.now());
        log.info("수강 철회: enrollmentId={}, learnerId={}", enrollmentId, principal.learnerId());
        return enrollment;
    }

    /**
     * 관리자 권한으로 테넌트 내 수강 건을 철회한다.
     */
    @Transactional
    public Enrollment withdrawByAdmin(LearnerPrincipal principal, Long enrollmentId) {
        principal.requireAdmin();
        Enrollment enrollment = enrollmentRepository.findByIdAndTenantIdWithLock(enrollmentId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_NOT_FOUND));

        enrollment.withdraw(LocalDateTime.now());
        log.info("관리자 수강 철회: enrollmentId={}, adminId={}", enrollmentId, principal.learnerId());
        return enrollment;
    }
}
