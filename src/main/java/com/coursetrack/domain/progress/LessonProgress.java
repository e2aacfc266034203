package com.coursetrack.domain.progress;

import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.enrollment.Enrollment;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 수강 건별, 레슨별 학습 진도.
 * 수치 변경은 {@link LessonProgressRepository}의 조건부 UPDATE로만 이루어진다.
 */
@Entity
@Table(name = "lesson_progress",
        uniqueConstraints = @UniqueConstraint(name = LessonProgress.UNIQUE_ENROLLMENT_LESSON,
                columnNames = {"enrollment_id", "lesson_id"}),
        indexes = @Index(name = "idx_progress_enrollment_completed", columnList = "enrollment_id, completed"))
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LessonProgress {

    public static final String UNIQUE_ENROLLMENT_LESSON = "uk_lesson_progress_enrollment_lesson";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "enrollment_id", nullable = false)
    private Enrollment enrollment;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lesson_id", nullable = false)
    private Lesson lesson;

    @Column(nullable = false)
    private Integer completionPercentage;

    @Column(nullable = false)
    private Integer watchTimeSeconds;

    @Column(nullable = false)
    private Integer lastPositionSeconds;

    @Column(nullable = false)
    private boolean completed;

    @Column(nullable = false)
    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public static LessonProgress start(Enrollment enrollment, Lesson lesson, LocalDateTime now) {
        return LessonProgress.builder()
                .tenantId(enrollment.getTenantId())
                .enrollment(enrollment)
                .lesson(lesson)
                .completionPercentage(0)
                .watchTimeSeconds(0)
                .lastPositionSeconds(0)
                .completed(false)
                .startedAt(now)
                .updatedAt(now)
                .build();
    }
}
