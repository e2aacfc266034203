package com.coursetrack.service.progress;

import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.config.ProgressProperties;
import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.course.LessonRepository;
import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.enrollment.EnrollmentRepository;
import com.coursetrack.domain.progress.LessonProgress;
import com.coursetrack.domain.progress.LessonProgressRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 진도 보고 한 건을 하나의 트랜잭션으로 적용한다.
 * 락 순서: Enrollment → LessonProgress
 */
@Component
@RequiredArgsConstructor
public class ProgressRecorder {

    private final EnrollmentRepository enrollmentRepository;
    private final LessonRepository lessonRepository;
    private final LessonProgressRepository lessonProgressRepository;
    private final CompletionAggregator completionAggregator;
    private final ProgressProperties progressProperties;

    @Transactional
    public LessonProgress record(Long tenantId, Long enrollmentId, Long lessonId, ProgressReport report) {
        // 1. Enrollment 비관적 락 획득 (같은 수강 건의 보고와 집계를 직렬화)
        Enrollment enrollment = enrollmentRepository.findByIdAndTenantIdWithLock(enrollmentId, tenantId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_NOT_FOUND));

        Lesson lesson = lessonRepository.findWithCourseByIdAndTenantId(lessonId, tenantId)
                .orElseThrow(() -> new BusinessException(ErrorCode.LESSON_NOT_FOUND));

        // 2. 상태/소속/범위 검증 (실패 시 아무것도 쓰지 않음)
        if (!enrollment.isActive()) {
            throw new BusinessException(ErrorCode.ENROLLMENT_NOT_ACTIVE);
        }
        if (!lesson.getCourseId().equals(enrollment.getCourse().getId())) {
            throw new BusinessException(ErrorCode.LESSON_NOT_IN_COURSE);
        }
        if (report.lastPositionSeconds() != null && lesson.exceedsDuration(report.lastPositionSeconds())) {
            throw new BusinessException(ErrorCode.INVALID_PROGRESS,
                    "lastPosition이 레슨 길이(" + lesson.getDurationSeconds() + "초)를 넘습니다");
        }

        // 3. 첫 보고라면 진도 행 생성
        LocalDateTime now = LocalDateTime.now();
        Long progressId = lessonProgressRepository.findByEnrollmentAndLesson(tenantId, enrollmentId, lessonId)
                .orElseGet(() -> lessonProgressRepository.saveAndFlush(LessonProgress.start(enrollment, lesson, now)))
                .getId();

        // 4. 조건부 UPDATE (저장된 값보다 작은 보고는 무시)
        lessonProgressRepository.raiseCompletion(progressId, report.completionPercentage(), now);
        lessonProgressRepository.markCompleted(progressId, progressProperties.getCompletionThreshold(), now);
        if (report.watchTimeSeconds() != null) {
            lessonProgressRepository.raiseWatchTime(progressId, report.watchTimeSeconds(), now);
        }
        if (report.lastPositionSeconds() != null) {
            lessonProgressRepository.updateLastPosition(progressId, report.lastPositionSeconds(), now);
        }

        // 5. 강좌 진도율 재계산 (벌크 UPDATE로 영속성 컨텍스트가 비워졌으므로 다시 조회)
        Enrollment current = enrollmentRepository.findByIdAndTenantId(enrollmentId, tenantId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_NOT_FOUND));
        completionAggregator.recompute(current, now);

        return lessonProgressRepository.findWithLessonByIdAndTenantId(progressId, tenantId)
                .orElseThrow(() -> new IllegalStateException("진도 행이 사라졌습니다: " + progressId));
    }
}
