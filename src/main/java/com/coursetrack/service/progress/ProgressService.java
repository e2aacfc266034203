package com.coursetrack.service.progress;

import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.config.ProgressProperties;
import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.course.LessonRepository;
import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.enrollment.EnrollmentRepository;
import com.coursetrack.domain.enrollment.EnrollmentStatus;
import com.coursetrack.domain.progress.LessonProgress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * 레슨 진도 보고.
 *
 * 락 대기 시간 초과, 데드락, 첫 보고 동시 INSERT 충돌은 여기서 재시도하며 호출자에게 드러나지 않는다.
 * 재시도 한도를 넘긴 경합만 CONCURRENT_UPDATE_FAILED로 응답한다. 그 밖의 무결성 위반은 그대로 전파된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressService {

    private final ProgressRecorder progressRecorder;
    private final LessonRepository lessonRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final ProgressProperties progressProperties;

    LessonProgress report(Long tenantId, Long enrollmentId, Long lessonId, ProgressReport report) {
        report.validate();
        return withRetry(() -> progressRecorder.record(tenantId, enrollmentId, lessonId, report));
    }

    /**
     * 인증된 학습자의 수강 건을 찾아 진도를 보고한다.
     */
    public LessonProgress reportForLearner(LearnerPrincipal principal, Long lessonId, ProgressReport report) {
        report.validate();
        Enrollment enrollment = resolveEnrollment(principal, lessonId);
        return report(principal.tenantId(), enrollment.getId(), lessonId, report);
    }

    /**
     * 진도율을 완료 기준치로 올린다. 시청 시간과 재생 위치는 그대로 둔다.
     */
    public LessonProgress completeForLearner(LearnerPrincipal principal, Long lessonId) {
        return reportForLearner(principal, lessonId,
                ProgressReport.completion(progressProperties.getCompletionThreshold()));
    }

    private Enrollment resolveEnrollment(LearnerPrincipal principal, Long lessonId) {
        Lesson lesson = lessonRepository.findWithCourseByIdAndTenantId(lessonId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.LESSON_NOT_FOUND));

        // 가장 최근 수강 건 (완료된 수강도 포함해 ENROLLMENT_NOT_ACTIVE로 응답)
        List<Enrollment> enrollments = enrollmentRepository.findByLearnerAndCourse(
                principal.tenantId(), principal.learnerId(), lesson.getCourseId(),
                EnumSet.of(EnrollmentStatus.PENDING, EnrollmentStatus.ACTIVE, EnrollmentStatus.COMPLETED));
        if (enrollments.isEmpty()) {
            throw new BusinessException(ErrorCode.NOT_ENROLLED);
        }
        return enrollments.get(0);
    }

    private <T> T withRetry(Supplier<T> action) {
        int maxAttempts = progressProperties.getMaxRetries();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                if (e instanceof DataIntegrityViolationException && !isDuplicateProgressRow(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("진도 기록 재시도 한도 초과 ({}회): {}", maxAttempts, e.getMessage());
                    throw new BusinessException(ErrorCode.CONCURRENT_UPDATE_FAILED);
                }
                log.debug("진도 기록 충돌, 재시도 {}/{}: {}", attempt, maxAttempts, e.getMessage());
                sleep(progressProperties.getRetryBackoffMs() * attempt);
            }
        }
    }

    /**
     * 같은 (수강, 레슨) 진도 행을 두 요청이 동시에 처음 만들 때 나는 유니크 제약 위반인지 판별한다.
     */
    static boolean isDuplicateProgressRow(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                ConstraintViolationException violation = (ConstraintViolationException) cause;
                String name = violation.getConstraintName() != null ? violation.getConstraintName() : violation.getMessage();
                return name != null && name.toLowerCase(Locale.ROOT).contains(LessonProgress.UNIQUE_ENROLLMENT_LESSON);
            }
        }
        return false;
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.CONCURRENT_UPDATE_FAILED);
        }
    }
}
