package com.coursetrack.service.course;

import com.coursetrack.api.course.dtos.CourseDtos;
import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.course.CourseModule;
import com.coursetrack.domain.course.CourseModuleRepository;
import com.coursetrack.domain.course.CourseRepository;
import com.coursetrack.domain.course.LessonRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 강좌 목차 조회. redis 프로필에서는 Redis 캐시를 거친다.
 */
@Component
@RequiredArgsConstructor
public class CourseOutlineLoader {

    static final String CACHE_NAME = "courseOutline";

    private final CourseRepository courseRepository;
    private final CourseModuleRepository courseModuleRepository;
    private final LessonRepository lessonRepository;

    @Transactional(readOnly = true)
    @Cacheable(value = CACHE_NAME, key = "#tenantId + ':' + #courseId")
    public CourseDtos.Outline load(Long tenantId, Long courseId) {
        Course course = courseRepository.findByIdAndTenantId(courseId, tenantId)
                .orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));

        List<CourseModule> modules = courseModuleRepository.findByCourse(tenantId, courseId);
        Map<Long, List<CourseDtos.LessonOutline>> lessonsByModule = lessonRepository.findByCourseOrdered(tenantId, courseId)
                .stream()
                .collect(Collectors.groupingBy(
                        lesson -> lesson.getModule().getId(),
                        Collectors.mapping(CourseDtos.LessonOutline::from, Collectors.toList())));

        List<CourseDtos.ModuleOutline> moduleOutlines = modules.stream()
                .map(module -> new CourseDtos.ModuleOutline(
                        module.getId(),
                        module.getTitle(),
                        module.getOrderIndex(),
                        lessonsByModule.getOrDefault(module.getId(), List.of())))
                .toList();

        int totalLessons = moduleOutlines.stream().mapToInt(m -> m.lessons().size()).sum();
        int mandatoryLessons = (int) moduleOutlines.stream()
                .flatMap(m -> m.lessons().stream())
                .filter(CourseDtos.LessonOutline::mandatory)
                .count();

        return new CourseDtos.Outline(
                course.getId(),
                course.getTitle(),
                course.getDescription(),
                course.getStatus(),
                totalLessons,
                mandatoryLessons,
                moduleOutlines
        );
    }

    @CacheEvict(value = CACHE_NAME, key = "#tenantId + ':' + #courseId")
    public void evict(Long tenantId, Long courseId) {
    }
}
