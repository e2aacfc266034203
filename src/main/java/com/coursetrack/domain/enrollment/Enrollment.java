package com.coursetrack.domain.enrollment;

import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.learner.Learner;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "enrollments",
        indexes = {
            @Index(name = "idx_enrollment_learner_course", columnList = "tenant_id, learner_id, course_id"),
            @Index(name = "idx_enrollment_course_status", columnList = "course_id, status")
        })
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Enrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "learner_id", nullable = false)
    private Learner learner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EnrollmentStatus status;

    @Column(nullable = false)
    private Integer completionPercentage;

    @Column(nullable = false)
    private LocalDateTime enrolledAt;

    private LocalDateTime activatedAt;

    private LocalDateTime completedAt;

    private LocalDateTime withdrawnAt;

    /**
     * 무료 강좌는 즉시 ACTIVE, 유료 강좌는 결제 확인 전까지 PENDING
     */
    public static Enrollment open(Learner learner, Course course, LocalDateTime now) {
        boolean free = course.isFree();
        return Enrollment.builder()
                .tenantId(course.getTenantId())
                .learner(learner)
                .course(course)
                .status(free ? EnrollmentStatus.ACTIVE : EnrollmentStatus.PENDING)
                .completionPercentage(0)
                .enrolledAt(now)
                .activatedAt(free ? now : null)
                .build();
    }

    public boolean isActive() {
        return status == EnrollmentStatus.ACTIVE;
    }

    public boolean isOwnedBy(Long learnerId) {
        return learner.getId().equals(learnerId);
    }

    public void activate(LocalDateTime now) {
        if (status != EnrollmentStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_ENROLLMENT_STATE);
        }
        this.status = EnrollmentStatus.ACTIVE;
        this.activatedAt = now;
    }

    public void withdraw(LocalDateTime now) {
        if (!EnrollmentStatus.OPEN.contains(status)) {
            throw new BusinessException(ErrorCode.INVALID_ENROLLMENT_STATE);
        }
        this.status = EnrollmentStatus.WITHDRAWN;
        this.withdrawnAt = now;
    }

    /**
     * 집계된 진도율을 반영한다. ACTIVE 상태에서 100에 도달하면 COMPLETED로 전이.
     *
     * @return 이번 호출로 COMPLETED 전이가 일어났으면 true
     */
    public boolean applyCompletion(int percentage, LocalDateTime now) {
        if (status != EnrollmentStatus.ACTIVE) {
            return false;
        }
        this.completionPercentage = percentage;
        if (percentage >= 100) {
            this.status = EnrollmentStatus.COMPLETED;
            this.completedAt = now;
            return true;
        }
        return false;
    }
}
