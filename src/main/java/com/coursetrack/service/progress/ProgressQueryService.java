package com.coursetrack.service.progress;

import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.api.progress.dtos.ProgressDtos;
import com.coursetrack.domain.course.CourseRepository;
import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.course.LessonRepository;
import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.enrollment.EnrollmentRepository;
import com.coursetrack.domain.enrollment.EnrollmentStatus;
import com.coursetrack.domain.progress.LessonProgress;
import com.coursetrack.domain.progress.LessonProgressRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProgressQueryService {

    private static final Set<EnrollmentStatus> VISIBLE = EnumSet.of(
            EnrollmentStatus.PENDING, EnrollmentStatus.ACTIVE, EnrollmentStatus.COMPLETED);

    private final CourseRepository courseRepository;
    private final LessonRepository lessonRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final LessonProgressRepository lessonProgressRepository;

    public ProgressDtos.CourseProgressResponse getCourseProgress(LearnerPrincipal principal, Long courseId) {
        if (courseRepository.findByIdAndTenantId(courseId, principal.tenantId()).isEmpty()) {
            throw new BusinessException(ErrorCode.COURSE_NOT_FOUND);
        }
        Enrollment enrollment = latestEnrollment(principal, courseId);

        List<Lesson> lessons = lessonRepository.findByCourseOrdered(principal.tenantId(), courseId);
        Map<Long, LessonProgress> progressByLesson = progressByLesson(principal.tenantId(), enrollment.getId());

        List<ProgressDtos.LessonProgressItem> items = lessons.stream()
                .map(lesson -> ProgressDtos.LessonProgressItem.of(lesson, progressByLesson.get(lesson.getId())))
                .toList();

        long completedLessons = items.stream().filter(ProgressDtos.LessonProgressItem::completed).count();
        long totalMandatory = items.stream().filter(ProgressDtos.LessonProgressItem::mandatory).count();
        long completedMandatory = items.stream()
                .filter(item -> item.mandatory() && item.completed())
                .count();

        return new ProgressDtos.CourseProgressResponse(
                enrollment.getId(),
                courseId,
                enrollment.getStatus(),
                enrollment.getCompletionPercentage(),
                completedLessons,
                (long) lessons.size(),
                completedMandatory,
                totalMandatory,
                items
        );
    }

    public ProgressDtos.LessonProgressResponse getLessonProgress(LearnerPrincipal principal, Long lessonId) {
        Lesson lesson = lessonRepository.findWithCourseByIdAndTenantId(lessonId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.LESSON_NOT_FOUND));
        Enrollment enrollment = latestEnrollment(principal, lesson.getCourseId());

        return lessonProgressRepository.findByEnrollmentAndLesson(principal.tenantId(), enrollment.getId(), lessonId)
                .map(ProgressDtos.LessonProgressResponse::from)
                .orElseGet(() -> ProgressDtos.LessonProgressResponse.notStarted(lesson));
    }

    private Enrollment latestEnrollment(LearnerPrincipal principal, Long courseId) {
        List<Enrollment> enrollments = enrollmentRepository.findByLearnerAndCourse(
                principal.tenantId(), principal.learnerId(), courseId, VISIBLE);
        if (enrollments.isEmpty()) {
            throw new BusinessException(ErrorCode.NOT_ENROLLED);
        }
        return enrollments.get(0);
    }

    private Map<Long, LessonProgress> progressByLesson(Long tenantId, Long enrollmentId) {
        return lessonProgressRepository.findByEnrollment(tenantId, enrollmentId).stream()
                .collect(Collectors.toMap(progress -> progress.getLesson().getId(), Function.identity()));
    }
}
