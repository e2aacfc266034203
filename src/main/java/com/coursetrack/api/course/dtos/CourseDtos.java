package com.coursetrack.api.course.dtos;

import com.coursetrack.domain.course.Course;
import com.coursetrack.domain.course.CourseModule;
import com.coursetrack.domain.course.CourseStatus;
import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.course.LessonType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public class CourseDtos {

    public record CreateRequest(
            @NotBlank @Size(max = 255) String title,
            @Size(max = 2000) String description,
            @NotNull @DecimalMin("0.00") BigDecimal price,
            @Pattern(regexp = "[A-Z]{3}") String currency,
            @Min(1) Integer maxStudents
    ) {
    }

    public record ModuleRequest(
            @NotBlank @Size(max = 255) String title,
            @Min(1) Integer orderIndex
    ) {
    }

    public record LessonRequest(
            @NotBlank @Size(max = 255) String title,
            @NotNull LessonType type,
            @Min(1) Integer durationSeconds,
            @Min(1) Integer orderIndex,
            Boolean mandatory
    ) {
    }

    public record Response(
            Long id,
            String title,
            String description,
            BigDecimal price,
            String currency,
            Boolean free,
            CourseStatus status,
            Integer maxStudents,
            LocalDateTime publishedAt
    ) {
        public static Response from(Course course) {
            return new Response(
                    course.getId(),
                    course.getTitle(),
                    course.getDescription(),
                    course.getPrice(),
                    course.getCurrency(),
                    course.isFree(),
                    course.getStatus(),
                    course.getMaxStudents(),
                    course.getPublishedAt()
            );
        }
    }

    public record ModuleResponse(
            Long id,
            Long courseId,
            String title,
            Integer orderIndex
    ) {
        public static ModuleResponse from(CourseModule module) {
            return new ModuleResponse(
                    module.getId(),
                    module.getCourse().getId(),
                    module.getTitle(),
                    module.getOrderIndex()
            );
        }
    }

    /**
     * 강좌 목차 (redis 프로필에서 캐시되므로 Serializable)
     */
    public record Outline(
            Long id,
            String title,
            String description,
            CourseStatus status,
            Integer totalLessons,
            Integer mandatoryLessons,
            List<ModuleOutline> modules
    ) implements Serializable {
    }

    public record ModuleOutline(
            Long id,
            String title,
            Integer orderIndex,
            List<LessonOutline> lessons
    ) implements Serializable {
    }

    public record LessonOutline(
            Long id,
            String title,
            LessonType type,
            Integer durationSeconds,
            Integer orderIndex,
            Boolean mandatory
    ) implements Serializable {
        public static LessonOutline from(Lesson lesson) {
            return new LessonOutline(
                    lesson.getId(),
                    lesson.getTitle(),
                    lesson.getType(),
                    lesson.getDurationSeconds(),
                    lesson.getOrderIndex(),
                    lesson.isMandatory()
            );
        }
    }
}
