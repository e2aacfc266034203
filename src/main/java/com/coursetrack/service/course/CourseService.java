package com.coursetrack.service.course;

import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.course.dtos.CourseDtos;
import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.course.CourseModule;
import com.coursetrack.domain.course.CourseModuleRepository;
import com.coursetrack.domain.course.CourseRepository;
import com.coursetrack.domain.course.CourseStatus;
import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.course.LessonRepository;
import com.coursetrack.domain.course.LessonType;
import com.coursetrack.domain.learner.Learner;
import com.coursetrack.domain.learner.LearnerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CourseService {

    private static final String DEFAULT_CURRENCY = "USD";

    private final CourseRepository courseRepository;
    private final CourseModuleRepository courseModuleRepository;
    private final LessonRepository lessonRepository;
    private final LearnerRepository learnerRepository;
    private final CourseOutlineLoader courseOutlineLoader;

    /**
     * 학습자는 공개 강좌만, 강사/관리자는 테넌트의 전체 강좌를 본다.
     */
    public List<Course> findCatalog(LearnerPrincipal principal) {
        if (principal.canAuthorCourses()) {
            return courseRepository.findByTenantIdOrderByIdDesc(principal.tenantId());
        }
        return courseRepository.findByTenantIdAndStatusOrderByIdDesc(principal.tenantId(), CourseStatus.PUBLISHED);
    }

    public CourseDtos.Outline getOutline(LearnerPrincipal principal, Long courseId) {
        CourseDtos.Outline outline = courseOutlineLoader.load(principal.tenantId(), courseId);
        if (outline.status() != CourseStatus.PUBLISHED && !principal.canAuthorCourses()) {
            throw new BusinessException(ErrorCode.COURSE_NOT_FOUND);
        }
        return outline;
    }

    @Transactional
    public Course create(LearnerPrincipal principal, CourseDtos.CreateRequest request) {
        principal.requireAuthor();
        Learner instructor = learnerRepository.findByIdAndTenantId(principal.learnerId(), principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.LEARNER_NOT_FOUND));

        Course course = courseRepository.save(Course.builder()
                .tenantId(principal.tenantId())
                .title(request.title())
                .description(request.description())
                .price(request.price())
                .currency(request.currency() != null ? request.currency() : DEFAULT_CURRENCY)
                .status(CourseStatus.DRAFT)
                .maxStudents(request.maxStudents())
                .instructor(instructor)
                .createdAt(LocalDateTime.now())
                .build());

        log.info("강좌 생성: courseId={}, tenantId={}", course.getId(), principal.tenantId());
        return course;
    }

    @Transactional
    public CourseModule addModule(LearnerPrincipal principal, Long courseId, CourseDtos.ModuleRequest request) {
        principal.requireAuthor();
        Course course = courseRepository.findByIdAndTenantIdWithLock(courseId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));

        int orderIndex = request.orderIndex() != null
                ? request.orderIndex()
                : courseModuleRepository.findMaxOrderIndex(principal.tenantId(), courseId) + 1;
        if (courseModuleRepository.existsByTenantIdAndCourseIdAndOrderIndex(principal.tenantId(), courseId, orderIndex)) {
            throw new BusinessException(ErrorCode.DUPLICATE_ORDER);
        }

        CourseModule module = courseModuleRepository.save(CourseModule.builder()
                .tenantId(principal.tenantId())
                .course(course)
                .title(request.title())
                .orderIndex(orderIndex)
                .build());

        courseOutlineLoader.evict(principal.tenantId(), courseId);
        return module;
    }

    @Transactional
    public Lesson addLesson(LearnerPrincipal principal, Long moduleId, CourseDtos.LessonRequest request) {
        principal.requireAuthor();
        CourseModule module = courseModuleRepository.findWithCourseByIdAndTenantId(moduleId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.MODULE_NOT_FOUND));
        Long courseId = module.getCourse().getId();

        // 같은 강좌의 목차 변경 직렬화
        courseRepository.findByIdAndTenantIdWithLock(courseId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));

        int orderIndex = request.orderIndex() != null
                ? request.orderIndex()
                : lessonRepository.findMaxOrderIndex(principal.tenantId(), moduleId) + 1;
        if (lessonRepository.existsByTenantIdAndModuleIdAndOrderIndex(principal.tenantId(), moduleId, orderIndex)) {
            throw new BusinessException(ErrorCode.DUPLICATE_ORDER);
        }

        Lesson lesson = lessonRepository.save(Lesson.builder()
                .tenantId(principal.tenantId())
                .module(module)
                .title(request.title())
                .type(request.type())
                .durationSeconds(request.type() == LessonType.VIDEO ? request.durationSeconds() : null)
                .orderIndex(orderIndex)
                .mandatory(request.mandatory() == null || request.mandatory())
                .build());

        courseOutlineLoader.evict(principal.tenantId(), courseId);
        return lesson;
    }

    @Transactional
    public Course publish(LearnerPrincipal principal, Long courseId) {
        principal.requireAuthor();
        Course course = courseRepository.findByIdAndTenantIdWithLock(courseId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));

        course.publish(LocalDateTime.now());
        courseOutlineLoader.evict(principal.tenantId(), courseId);
        log.info("강좌 공개: courseId={}", courseId);
        return course;
    }

    @Transactional
    public Course archive(LearnerPrincipal principal, Long courseId) {
        principal.requireAuthor();
        Course course = courseRepository.findByIdAndTenantIdWithLock(courseId, principal.tenantId())
                .orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));

        course.archive();
        courseOutlineLoader.evict(principal.tenantId(), courseId);
        log.info("강좌 보관: courseId={}", courseId);
        return course;
    }
}
