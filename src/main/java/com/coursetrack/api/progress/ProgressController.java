package com.coursetrack.api.progress;

import com.coursetrack.api.auth.AuthenticatedLearner;
import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.progress.dtos.ProgressDtos;
import com.coursetrack.service.progress.ProgressQueryService;
import com.coursetrack.service.progress.ProgressService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressService progressService;
    private final ProgressQueryService progressQueryService;

    @GetMapping("/courses/{courseId}/progress")
    public ProgressDtos.CourseProgressResponse getCourseProgress(@AuthenticatedLearner LearnerPrincipal principal,
                                                                 @PathVariable Long courseId) {
        return progressQueryService.getCourseProgress(principal, courseId);
    }

    @GetMapping("/lessons/{lessonId}/progress")
    public ProgressDtos.LessonProgressResponse getLessonProgress(@AuthenticatedLearner LearnerPrincipal principal,
                                                                 @PathVariable Long lessonId) {
        return progressQueryService.getLessonProgress(principal, lessonId);
    }

    @PostMapping("/lessons/{lessonId}/progress")
    public ProgressDtos.LessonProgressResponse report(@AuthenticatedLearner LearnerPrincipal principal,
                                                      @PathVariable Long lessonId,
                                                      @Valid @RequestBody ProgressDtos.ReportRequest request) {
        return ProgressDtos.LessonProgressResponse.from(
                progressService.reportForLearner(principal, lessonId, request.toReport()));
    }

    @PostMapping("/lessons/{lessonId}/complete")
    public ProgressDtos.LessonProgressResponse complete(@AuthenticatedLearner LearnerPrincipal principal,
                                                        @PathVariable Long lessonId) {
        return ProgressDtos.LessonProgressResponse.from(
                progressService.completeForLearner(principal, lessonId));
    }
}
