package com.coursetrack.api.progress.dtos;

import com.coursetrack.domain.course.Lesson;
import com.coursetrack.domain.enrollment.EnrollmentStatus;
import com.coursetrack.domain.progress.LessonProgress;
import com.coursetrack.service.progress.ProgressReport;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;
import java.util.List;

public class ProgressDtos {

    /**
     * 진도 보고 본문. 기존 클라이언트 호환을 위해 snake_case 이름을 기본으로 받는다.
     */
    public record ReportRequest(
            @JsonProperty("completion_percentage") @JsonAlias("completionPercentage") @NotNull @Min(0) @Max(100) Integer completionPercentage,
            @JsonProperty("watch_time") @JsonAlias("watchTime") @Min(0) Integer watchTime,
            @JsonProperty("last_position") @JsonAlias("lastPosition") @Min(0) Integer lastPosition
    ) {
        public ProgressReport toReport() {
            return new ProgressReport(completionPercentage, watchTime, lastPosition);
        }
    }

    public record LessonProgressResponse(
            Long lessonId,
            String lessonTitle,
            Boolean completed,
            Integer completionPercentage,
            Integer watchTime,
            Integer lastPosition,
            LocalDateTime completedAt
    ) {
        public static LessonProgressResponse from(LessonProgress progress) {
            return new LessonProgressResponse(
                    progress.getLesson().getId(),
                    progress.getLesson().getTitle(),
                    progress.isCompleted(),
                    progress.getCompletionPercentage(),
                    progress.getWatchTimeSeconds(),
                    progress.getLastPositionSeconds(),
                    progress.getCompletedAt()
            );
        }

        public static LessonProgressResponse notStarted(Lesson lesson) {
            return new LessonProgressResponse(lesson.getId(), lesson.getTitle(), false, 0, 0, 0, null);
        }
    }

    public record LessonProgressItem(
            Long lessonId,
            String lessonTitle,
            Long moduleId,
            String moduleTitle,
            Boolean mandatory,
            Boolean completed,
            Integer completionPercentage,
            Integer watchTime,
            Integer lastPosition
    ) {
        public static LessonProgressItem of(Lesson lesson, LessonProgress progress) {
            if (progress == null) {
                return new LessonProgressItem(
                        lesson.getId(), lesson.getTitle(),
                        lesson.getModule().getId(), lesson.getModule().getTitle(),
                        lesson.isMandatory(), false, 0, 0, 0);
            }
            return new LessonProgressItem(
                    lesson.getId(), lesson.getTitle(),
                    lesson.getModule().getId(), lesson.getModule().getTitle(),
                    lesson.isMandatory(),
                    progress.isCompleted(),
                    progress.getCompletionPercentage(),
                    progress.getWatchTimeSeconds(),
                    progress.getLastPositionSeconds());
        }
    }

    public record CourseProgressResponse(
            Long enrollmentId,
            Long courseId,
            EnrollmentStatus status,
            Integer completionPercentage,
            Long completedLessons,
            Long totalLessons,
            Long completedMandatoryLessons,
            Long totalMandatoryLessons,
            List<LessonProgressItem> lessonProgress
    ) {
    }
}
